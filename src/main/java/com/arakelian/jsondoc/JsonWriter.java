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

import java.io.Closeable;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Arrays;
import java.util.Map;

import com.google.common.base.Preconditions;

/**
 * <p>
 * Writes JSON text, either from a {@link JsonValue} tree or from individual calls. Commas between
 * values are inserted automatically.
 * </p>
 * <p>
 * Strings and member names are written without escaping, mirroring {@link JsonReader}, which does
 * not accept escape sequences. Members are written as <code>"key" : value</code>. Output is compact
 * unless pretty printing is enabled, which puts each element on its own line and indents it by two
 * spaces per level.
 * </p>
 */
public class JsonWriter<W extends Writer> implements Closeable {
    private static enum CommaState {
        BEFORE_FIRST, AFTER_KEY, AFTER_VALUE;
    }

    /**
     * Convenience function for converting a value into a JSON string
     *
     * @param value
     *            value to be converted
     * @param pretty
     *            true if pretty output
     * @return a JSON representation of the given value
     */
    public static String toString(final JsonValue value, final boolean pretty) {
        try (final JsonWriter<StringWriter> writer = new JsonWriter<>(new StringWriter())) {
            writer.withPretty(pretty);
            writer.writeValue(value);
            return writer.getWriter().toString();
        } catch (final IOException e) {
            // we're writing to a string buffer and shouldn't have an error
            throw new RuntimeException("Unexpected exception while generating JSON", e);
        }
    }

    /**
     * Convenience function for writing a value to a stream
     *
     * @param value
     *            value to be written
     * @param stream
     *            writable stream
     * @param pretty
     *            true if pretty output
     */
    public static void write(final JsonValue value, final JsonStream stream, final boolean pretty) {
        final JsonWriter<JsonStreamWriter> writer = new JsonWriter<>(new JsonStreamWriter(stream));
        try {
            writer.withPretty(pretty);
            writer.writeValue(value);
            writer.flush();
        } catch (final IOException e) {
            // streams do not throw
            throw new RuntimeException("Unexpected exception while generating JSON", e);
        }
    }

    private W writer;

    private int indent;

    private boolean pretty;

    private CommaState[] commaState = new CommaState[16];

    public JsonWriter() {
        reset();
    }

    public JsonWriter(final W writer) {
        setWriter(writer);
        reset();
    }

    private final JsonWriter<W> afterValue() {
        this.commaState[indent] = CommaState.AFTER_VALUE;
        return this;
    }

    /** Determines if a separator is needed here and automatically inserts one **/
    private final void beforeValue() throws IOException {
        final CommaState state = this.commaState[indent];
        if (state == CommaState.AFTER_VALUE) {
            writer.write(',');
            nextLine();
        } else if (state == CommaState.BEFORE_FIRST && indent != 0) {
            nextLine();
        }
    }

    @Override
    public void close() throws IOException {
        try {
            if (writer != null) {
                writer.close();
            }
        } finally {
            writer = null;
            reset();
        }
    }

    private final void endContainer(final char closer) throws IOException {
        Preconditions.checkState(indent > 0, "No open object or array to close");
        final boolean empty = this.commaState[indent] == CommaState.BEFORE_FIRST;
        indent--;
        if (!empty) {
            nextLine();
        }
        writer.write(closer);
        afterValue();
    }

    public final JsonWriter<W> flush() throws IOException {
        writer.flush();
        return this;
    }

    public final int getLevel() {
        return indent;
    }

    public final W getWriter() {
        return writer;
    }

    private void indent() throws IOException {
        if (pretty) {
            for (int i = 0; i < indent; i++) {
                writer.write("  ");
            }
        }
    }

    private void internalWriteUnescapedString(final CharSequence csq) throws IOException {
        writer.write('\"');
        for (int i = 0, len = csq != null ? csq.length() : 0; i < len; i++) {
            final char ch = csq.charAt(i);
            writer.write(ch);
        }
        writer.write('\"');
    }

    public final boolean isPretty() {
        return pretty;
    }

    private final void nextLine() throws IOException {
        if (pretty) {
            writer.write("\n");
            indent();
        }
    }

    public final void reset() {
        this.indent = 0;
        this.commaState[indent] = CommaState.BEFORE_FIRST;
    }

    public final void setPretty(final boolean pretty) {
        this.pretty = pretty;
    }

    public final void setWriter(final W writer) {
        this.writer = writer;
    }

    private final void startContainer(final char opener) throws IOException {
        beforeValue();
        writer.write(opener);
        if (++indent >= commaState.length) {
            // doubling here is probably overkill, but anything that needs to double more than
            // once is very atypical anyway.
            commaState = Arrays.copyOf(commaState, commaState.length << 1);
        }
        this.commaState[indent] = CommaState.BEFORE_FIRST;
    }

    public final JsonWriter<W> withPretty(final boolean pretty) {
        setPretty(pretty);
        return this;
    }

    public final JsonWriter<W> withWriter(final W writer) {
        setWriter(writer);
        return this;
    }

    public final JsonWriter<W> writeArray(final JsonValue array) throws IOException {
        writeStartArray();
        for (final JsonValue element : array.asArray()) {
            writeValue(element);
        }
        writeEndArray();
        return this;
    }

    public final JsonWriter<W> writeBoolean(final boolean val) throws IOException {
        writeChars(val ? "true" : "false");
        return this;
    }

    private final void writeChars(final CharSequence csq) throws IOException {
        beforeValue();
        for (int i = 0, length = csq.length(); i < length; i++) {
            writer.write(csq.charAt(i));
        }
        afterValue();
    }

    public final JsonWriter<W> writeDouble(final double val) throws IOException {
        if (Double.isInfinite(val) || Double.isNaN(val)) {
            return writeNull();
        }
        final StringBuilder buf = new StringBuilder();
        buf.append(val);
        writeChars(buf);
        return this;
    }

    public final JsonWriter<W> writeEndArray() throws IOException {
        endContainer(']');
        return this;
    }

    public final JsonWriter<W> writeEndObject() throws IOException {
        endContainer('}');
        return this;
    }

    public final JsonWriter<W> writeKey(final CharSequence key) throws IOException {
        Preconditions.checkState(indent > 0, "Member name outside of an object");
        beforeValue();
        internalWriteUnescapedString(key);
        // space before colon matches Jackson
        writer.write(" : ");
        this.commaState[indent] = CommaState.AFTER_KEY;
        return this;
    }

    public final JsonWriter<W> writeKeyValue(final CharSequence key, final JsonValue value) throws IOException {
        writeKey(key).writeValue(value);
        return this;
    }

    public final JsonWriter<W> writeNull() throws IOException {
        writeChars("null");
        return this;
    }

    public final JsonWriter<W> writeNumber(final JsonNumber val) throws IOException {
        if (val.isReal()) {
            return writeDouble(val.asReal());
        }
        return writeNumber(val.asNatural());
    }

    public final JsonWriter<W> writeNumber(final long val) throws IOException {
        final StringBuilder buf = new StringBuilder();
        buf.append(val);
        writeChars(buf);
        return this;
    }

    public final JsonWriter<W> writeObject(final JsonValue object) throws IOException {
        writeStartObject();
        for (final Map.Entry<JsonValue, JsonValue> member : object.asObject().entrySet()) {
            writeKeyValue(member.getKey().asString(), member.getValue());
        }
        writeEndObject();
        return this;
    }

    public final JsonWriter<W> writeStartArray() throws IOException {
        startContainer('[');
        return this;
    }

    public final JsonWriter<W> writeStartObject() throws IOException {
        startContainer('{');
        return this;
    }

    public final JsonWriter<W> writeString(final CharSequence csq) throws IOException {
        beforeValue();
        internalWriteUnescapedString(csq);
        afterValue();
        return this;
    }

    public final JsonWriter<W> writeValue(final JsonValue value) throws IOException {
        Preconditions.checkArgument(value != null, "value must be non-null");
        switch (value.getType()) {
        case NULL:
            return writeNull();
        case FALSE:
        case TRUE:
            return writeBoolean(value.asBool());
        case NUMBER:
            return writeNumber(value.asNumber());
        case STRING:
            return writeString(value.asString());
        case ARRAY:
            return writeArray(value);
        case OBJECT:
            return writeObject(value);
        default:
            throw new IllegalStateException("Unknown value type " + value.getType());
        }
    }
}
