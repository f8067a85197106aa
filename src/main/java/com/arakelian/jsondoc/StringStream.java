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
 * Read-only {@link JsonStream} over immutable source text. The write side is never used by the
 * reader for this stream; calling it throws {@link IllegalStateException}.
 */
public final class StringStream implements JsonStream {
    /** input buffer with JSON text in it **/
    final char[] buf;

    /** origin of the stream in the buffer **/
    final int head;

    /** end position in the buffer (one past last valid index) **/
    final int end;

    /** current read position in the buffer **/
    int pos;

    public StringStream(final char[] data, final int start, final int end) {
        Preconditions.checkPositionIndexes(start, end, data.length);
        this.buf = data;
        this.head = start;
        this.pos = start;
        this.end = end;
    }

    public StringStream(final CharSequence data) {
        this(data, 0, data.length());
    }

    public StringStream(final CharSequence data, final int start, final int end) {
        Preconditions.checkPositionIndexes(start, end, data.length());
        this.buf = new char[end - start];
        if (data instanceof String) {
            ((String) data).getChars(start, end, buf, 0);
        } else {
            for (int i = start; i < end; i++) {
                buf[i - start] = data.charAt(i);
            }
        }
        this.head = 0;
        this.pos = 0;
        this.end = buf.length;
    }

    private StringStream(final StringStream other) {
        this.buf = other.buf;
        this.head = other.head;
        this.end = other.end;
        this.pos = other.pos;
    }

    @Override
    public int begin() {
        throw readOnly();
    }

    @Override
    public void commit(final JsonStream snapshot) {
        Preconditions.checkArgument(
                snapshot instanceof StringStream && ((StringStream) snapshot).buf == buf,
                "Snapshot was not taken from this stream");
        pos = ((StringStream) snapshot).pos;
    }

    @Override
    public int end(final int begin) {
        throw readOnly();
    }

    @Override
    public boolean isWritable() {
        return false;
    }

    @Override
    public char peek() {
        return pos < end ? buf[pos] : EOF;
    }

    @Override
    public void put(final char c) {
        throw readOnly();
    }

    private IllegalStateException readOnly() {
        return new IllegalStateException("Cannot write to a read-only stream");
    }

    @Override
    public StringStream snapshot() {
        return new StringStream(this);
    }

    @Override
    public CharSequence span(final int from, final int to) {
        Preconditions.checkPositionIndexes(from, to, end - head);
        return new String(buf, head + from, to - from);
    }

    @Override
    public char take() {
        return pos < end ? buf[pos++] : EOF;
    }

    @Override
    public int tell() {
        return pos - head;
    }

    @Override
    public String toString() {
        return "pos=" + tell() + ",length=" + (end - head);
    }
}
