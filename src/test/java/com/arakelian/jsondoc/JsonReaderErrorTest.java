/*
 * Copyright 2012-2017 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.arakelian.jsondoc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import com.arakelian.jsondoc.JsonReader.JsonParseException;
import com.arakelian.jsondoc.ParseError.Kind;

public class JsonReaderErrorTest {
    private static Stream<Arguments> invalidJson() {
        return Stream.of(
                Arguments.of("", Kind.EMPTY_INPUT),
                Arguments.of(" \t\r\n ", Kind.EMPTY_INPUT),
                Arguments.of("3.14", Kind.INVALID_ROOT),
                Arguments.of("\"text\"", Kind.INVALID_ROOT),
                Arguments.of("null", Kind.INVALID_ROOT),
                Arguments.of("{} x", Kind.CONTENT_AFTER_ROOT),
                Arguments.of("[][]", Kind.CONTENT_AFTER_ROOT),
                Arguments.of("{1:2}", Kind.INVALID_MEMBER_NAME),
                Arguments.of("{\"a\":1,}", Kind.INVALID_MEMBER_NAME),
                Arguments.of("{\"a\" 1}", Kind.MISSING_COLON),
                Arguments.of("{\"a\":1 \"b\":2}", Kind.MISSING_OBJECT_SEPARATOR),
                Arguments.of("{\"a\":1", Kind.MISSING_OBJECT_SEPARATOR),
                Arguments.of("[1 2]", Kind.MISSING_ARRAY_SEPARATOR),
                Arguments.of("[1", Kind.MISSING_ARRAY_SEPARATOR),
                Arguments.of("[1,]", Kind.INVALID_VALUE),
                Arguments.of("[nul]", Kind.INVALID_VALUE),
                Arguments.of("[tru]", Kind.INVALID_VALUE),
                Arguments.of("[fals]", Kind.INVALID_VALUE),
                Arguments.of("[x]", Kind.INVALID_VALUE),
                Arguments.of("{\"a\": \"abc", Kind.UNTERMINATED_STRING),
                Arguments.of("{\"x\": \"has \\\" a backslash\"}", Kind.UNSUPPORTED_ESCAPE),
                Arguments.of("[\"tab\\t\"]", Kind.UNSUPPORTED_ESCAPE),
                Arguments.of("[1.2.3]", Kind.INVALID_NUMBER),
                Arguments.of("[1e5]", Kind.INVALID_NUMBER),
                Arguments.of("[-]", Kind.INVALID_NUMBER),
                Arguments.of("[e--]", Kind.INVALID_NUMBER),
                Arguments.of("[99999999999999999999]", Kind.INVALID_NUMBER),
                Arguments.of("[1.0e999]", Kind.INVALID_NUMBER));
    }

    @Test
    public void testBooleanEntryPointLeavesRootUntouched() {
        final JsonValue root = new JsonValue(5);
        final JsonReader reader = new JsonReader(new StringStream("[1,"));
        assertFalse(reader.parse(root));
        assertEquals(5, root.asNatural());
        assertEquals(Kind.INVALID_VALUE, reader.getLastError().get().getKind());

        assertFalse(JsonReader.parse("3.14", root));
        assertEquals(5, root.asNatural());
    }

    @Test
    public void testDepthLimit() throws JsonParseException {
        final JsonReaderOptions options = ImmutableJsonReaderOptions.builder().maxDepth(2).build();
        assertEquals(1, new JsonReader(new StringStream("[[]]"), options).read().size());

        final JsonParseException e = assertThrows(
                JsonParseException.class,
                () -> new JsonReader(new StringStream("[[{}]]"), options).read());
        assertEquals(Kind.DEPTH_EXCEEDED, e.getError().getKind());
        assertEquals(2, e.getError().getOffset());

        assertThrows(IllegalStateException.class, () -> ImmutableJsonReaderOptions.builder().maxDepth(0).build());
    }

    @ParameterizedTest
    @MethodSource("invalidJson")
    public void testInvalid(final String json, final Kind kind) {
        final JsonParseException e = assertThrows(JsonParseException.class, () -> JsonReader.readValue(json));
        assertEquals(kind, e.getError().getKind(), e.getMessage());

        final JsonValue root = new JsonValue();
        final JsonReader reader = new JsonReader(new StringStream(json));
        assertFalse(reader.parse(root));
        assertTrue(root.isNull());
        assertEquals(kind, reader.getLastError().get().getKind());
    }

    @Test
    public void testOffsets() {
        assertEquals(5, offsetOf("{\"a\" 1}"));
        assertEquals(11, offsetOf("{\"x\": \"has \\\" a backslash\"}"));
        assertEquals(3, offsetOf("{} x"));
        assertEquals(0, offsetOf("3.14"));
        assertEquals(3, offsetOf("[1 2]"));
    }

    private int offsetOf(final String json) {
        final JsonParseException e = assertThrows(JsonParseException.class, () -> JsonReader.readValue(json));
        assertTrue(e.getMessage().endsWith("position=" + e.getError().getOffset()), e.getMessage());
        return e.getError().getOffset();
    }

    @Test
    public void testSuccessClearsLastError() {
        final JsonReader reader = new JsonReader(new StringStream("{}"));
        assertTrue(reader.parse(new JsonValue()));
        assertFalse(reader.getLastError().isPresent());
    }
}
