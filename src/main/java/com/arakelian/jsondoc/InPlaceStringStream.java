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
 * <p>
 * Read-write {@link JsonStream} designed for in-place parsing.
 * </p>
 * <p>
 * Decoded output is written into the same buffer that is being read. {@link #begin()} places the
 * write cursor on the read cursor; since a decoder never produces more characters than it
 * consumes, the write cursor always stays at or behind the read cursor and only overwrites
 * characters that were already read.
 * </p>
 */
public final class InPlaceStringStream implements JsonStream {
    /** buffer that is read and overwritten **/
    final char[] buf;

    /** origin of the stream in the buffer **/
    final int head;

    /** end position in the buffer (one past last valid index) **/
    final int end;

    /** current read position in the buffer **/
    int src;

    /** current write position in the buffer, or -1 before {@link #begin()} **/
    int dst;

    public InPlaceStringStream(final char[] data) {
        this(data, 0, data.length);
    }

    public InPlaceStringStream(final char[] data, final int start, final int end) {
        Preconditions.checkPositionIndexes(start, end, data.length);
        this.buf = data;
        this.head = start;
        this.end = end;
        this.src = start;
        this.dst = -1;
    }

    private InPlaceStringStream(final InPlaceStringStream other) {
        this.buf = other.buf;
        this.head = other.head;
        this.end = other.end;
        this.src = other.src;
        this.dst = other.dst;
    }

    @Override
    public int begin() {
        dst = src;
        return dst - head;
    }

    @Override
    public void commit(final JsonStream snapshot) {
        Preconditions.checkArgument(
                snapshot instanceof InPlaceStringStream && ((InPlaceStringStream) snapshot).buf == buf,
                "Snapshot was not taken from this stream");
        final InPlaceStringStream other = (InPlaceStringStream) snapshot;
        src = other.src;
        dst = other.dst;
    }

    @Override
    public int end(final int begin) {
        Preconditions.checkState(dst != -1, "end() called without begin()");
        return dst - head - begin;
    }

    @Override
    public boolean isWritable() {
        return true;
    }

    @Override
    public char peek() {
        return src < end ? buf[src] : EOF;
    }

    @Override
    public void put(final char c) {
        Preconditions.checkState(dst != -1, "put() called without begin()");
        Preconditions.checkState(dst < src, "Write cursor cannot pass the read cursor");
        buf[dst++] = c;
    }

    @Override
    public InPlaceStringStream snapshot() {
        return new InPlaceStringStream(this);
    }

    @Override
    public CharSequence span(final int from, final int to) {
        Preconditions.checkPositionIndexes(from, to, end - head);
        return new String(buf, head + from, to - from);
    }

    @Override
    public char take() {
        return src < end ? buf[src++] : EOF;
    }

    @Override
    public int tell() {
        return src - head;
    }

    @Override
    public String toString() {
        return "src=" + tell() + ",dst=" + (dst == -1 ? "n/a" : Integer.toString(dst - head)) + ",length="
                + (end - head);
    }
}
