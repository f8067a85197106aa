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

import java.io.Writer;

import com.google.common.base.Preconditions;

/**
 * {@link Writer} that puts every character into a writable {@link JsonStream}.
 */
public class JsonStreamWriter extends Writer {
    private final JsonStream stream;

    public JsonStreamWriter(final JsonStream stream) {
        Preconditions.checkArgument(stream != null, "stream must be non-null");
        Preconditions.checkArgument(stream.isWritable(), "stream must be writable");
        this.stream = stream;
    }

    @Override
    public void close() {
        // nothing to release, the stream is owned by the caller
    }

    @Override
    public void flush() {
        // characters are put into the stream immediately
    }

    @Override
    public void write(final char[] cbuf, final int off, final int len) {
        for (int i = 0; i < len; i++) {
            stream.put(cbuf[off + i]);
        }
    }

    @Override
    public void write(final int c) {
        stream.put((char) c);
    }

    @Override
    public void write(final String str, final int off, final int len) {
        for (int i = 0; i < len; i++) {
            stream.put(str.charAt(off + i));
        }
    }
}
