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

import java.io.IOException;
import java.io.StringWriter;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JsonWriterTest {
    @FunctionalInterface
    public interface JsonTest {
        void execute(JsonWriter<StringWriter> writer) throws IOException;
    }

    /** Logger **/
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonWriterTest.class);

    private void assertIllegalStateException(final JsonTest test) throws IOException {
        final StringWriter sw = new StringWriter();
        try (JsonWriter<StringWriter> writer = new JsonWriter<>(sw)) {
            Assertions.assertThrows(IllegalStateException.class, () -> {
                test.execute(writer);
                writer.flush();
                LOGGER.info("Supposed to be invalid: {}", sw.toString());
            });
        }
    }

    private String capture(final JsonTest test) throws IOException {
        final StringWriter sw = new StringWriter();
        try (JsonWriter<StringWriter> writer = new JsonWriter<>(sw)) {
            test.execute(writer);
        }
        return sw.toString();
    }

    private JsonValue sample() {
        final JsonValue root = new JsonValue(ValueType.OBJECT);
        root.put("s", new JsonValue("string"));
        root.put("e", new JsonValue(""));
        root.put("b", new JsonValue(true));
        root.put("n", new JsonValue());
        root.put("d", new JsonValue(3.141592653589793));
        root.put("l", new JsonValue(Long.MAX_VALUE));
        final JsonValue list = root.getOrInsert("x");
        list.append(new JsonValue());
        list.append(new JsonValue(100));
        root.put("y", new JsonValue(ValueType.ARRAY));
        final JsonValue map = root.getOrInsert("z");
        map.put("a", new JsonValue(Long.MIN_VALUE));
        root.put("o", new JsonValue(ValueType.OBJECT));
        return root;
    }

    @Test
    public void testCompact() {
        assertEquals(
                "{\"b\" : true,\"d\" : 3.141592653589793,\"e\" : \"\",\"l\" : 9223372036854775807,"
                        + "\"n\" : null,\"o\" : {},\"s\" : \"string\",\"x\" : [null,100],\"y\" : [],"
                        + "\"z\" : {\"a\" : -9223372036854775808}}",
                sample().toString());
    }

    @Test
    public void testEmptyContainers() {
        assertEquals("[]", new JsonValue(ValueType.ARRAY).toString());
        assertEquals("{}", new JsonValue(ValueType.OBJECT).toString());
        assertEquals("[]", JsonWriter.toString(new JsonValue(ValueType.ARRAY), true));
        assertEquals("{}", JsonWriter.toString(new JsonValue(ValueType.OBJECT), true));
    }

    @Test
    public void testInvalidNesting() throws IOException {
        assertIllegalStateException(writer -> writer.writeEndArray());
        assertIllegalStateException(writer -> writer.writeKey("a"));
        assertIllegalStateException(writer -> writer.writeStartObject().writeEndObject().writeEndObject());
    }

    @Test
    public void testNonFiniteRealsAreNull() throws IOException {
        assertEquals("null", capture(writer -> writer.writeDouble(Double.NaN)));
        assertEquals("[null,null]", capture(writer -> writer.writeStartArray() //
                .writeDouble(Double.POSITIVE_INFINITY) //
                .writeNumber(JsonNumber.ofReal(Double.NEGATIVE_INFINITY)) //
                .writeEndArray()));
    }

    @Test
    public void testPretty() {
        Assertions.assertEquals(
                "{\n" //
                        + "  \"b\" : true,\n" //
                        + "  \"d\" : 3.141592653589793,\n" //
                        + "  \"e\" : \"\",\n" //
                        + "  \"l\" : 9223372036854775807,\n" //
                        + "  \"n\" : null,\n" //
                        + "  \"o\" : {},\n" //
                        + "  \"s\" : \"string\",\n" //
                        + "  \"x\" : [\n" //
                        + "    null,\n" //
                        + "    100\n" //
                        + "  ],\n" //
                        + "  \"y\" : [],\n" //
                        + "  \"z\" : {\n" //
                        + "    \"a\" : -9223372036854775808\n" //
                        + "  }\n" //
                        + "}", //
                JsonWriter.toString(sample(), true));
    }

    @Test
    public void testPrimitives() throws IOException {
        assertEquals(
                "{\"a\" : [1,2.5,false,\"raw\"],\"b\" : null}",
                capture(writer -> writer.writeStartObject() //
                        .writeKey("a") //
                        .writeStartArray() //
                        .writeNumber(1) //
                        .writeDouble(2.5) //
                        .writeBoolean(false) //
                        .writeString("raw") //
                        .writeEndArray() //
                        .writeKeyValue("b", new JsonValue()) //
                        .writeEndObject()));
    }

    @Test
    public void testStringsAreNotEscaped() {
        final JsonValue array = new JsonValue(ValueType.ARRAY);
        array.append(new JsonValue("tab\there"));
        assertEquals("[\"tab\there\"]", array.toString());
    }

    @Test
    public void testWriteToStream() {
        final JsonValue root = new JsonValue();
        root.append(new JsonValue("a"));
        root.append(new JsonValue(1.5));

        final StringBufferStream stream = new StringBufferStream();
        JsonWriter.write(root, stream, false);
        assertEquals("[\"a\",1.5]", stream.toString());

        // the written text can be read back from the same stream
        final JsonValue copy = new JsonValue();
        Assertions.assertTrue(new JsonReader(stream).parse(copy));
        assertEquals(root, copy);
    }
}
