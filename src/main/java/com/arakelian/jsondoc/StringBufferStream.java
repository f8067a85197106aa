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

import com.google.common.base.Preconditions;

/**
 * Growable {@link JsonStream} used as the output of {@link JsonWriter}. Characters are appended by
 * {@link #put(char)}; the read side consumes them in the order they were written.
 */
public final class StringBufferStream implements JsonStream {
    private final StringBuilder buf;

    /** current read position **/
    private int pos;

    public StringBufferStream() {
        this(new StringBuilder(256));
    }

    public StringBufferStream(final int capacity) {
        this(new StringBuilder(capacity));
    }

    private StringBufferStream(final StringBuilder buf) {
        this.buf = buf;
    }

    @Override
    public int begin() {
        return buf.length();
    }

    public void clear() {
        buf.setLength(0);
        pos = 0;
    }

    @Override
    public void commit(final JsonStream snapshot) {
        Preconditions.checkArgument(
                snapshot instanceof StringBufferStream && ((StringBufferStream) snapshot).buf == buf,
                "Snapshot was not taken from this stream");
        pos = ((StringBufferStream) snapshot).pos;
    }

    @Override
    public int end(final int begin) {
        return buf.length() - begin;
    }

    @Override
    public boolean isWritable() {
        return true;
    }

    public int length() {
        return buf.length();
    }

    @Override
    public char peek() {
        return pos < buf.length() ? buf.charAt(pos) : EOF;
    }

    @Override
    public void put(final char c) {
        buf.append(c);
    }

    @Override
    public StringBufferStream snapshot() {
        final StringBufferStream copy = new StringBufferStream(buf);
        copy.pos = pos;
        return copy;
    }

    @Override
    public CharSequence span(final int from, final int to) {
        Preconditions.checkPositionIndexes(from, to, buf.length());
        return buf.substring(from, to);
    }

    @Override
    public char take() {
        return pos < buf.length() ? buf.charAt(pos++) : EOF;
    }

    @Override
    public int tell() {
        return pos;
    }

    /**
     * Returns the characters that have been written but not yet read.
     */
    @Override
    public String toString() {
        return buf.substring(pos);
    }
}
