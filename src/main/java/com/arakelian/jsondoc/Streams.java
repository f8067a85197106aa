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
 * Helpers for writing to a {@link JsonStream}.
 */
public final class Streams {
    /**
     * Writes <code>n</code> copies of a character.
     *
     * @param stream
     *            writable stream
     * @param c
     *            character to be written
     * @param n
     *            number of copies
     */
    public static void putN(final JsonStream stream, final char c, final int n) {
        Preconditions.checkArgument(n >= 0, "n must be non-negative");
        for (int i = 0; i < n; i++) {
            stream.put(c);
        }
    }

    /**
     * Writes a Unicode codepoint as one or two UTF-16 chars.
     *
     * @param stream
     *            writable stream
     * @param codePoint
     *            codepoint to be written
     * @return number of chars written
     */
    public static int putCodePoint(final JsonStream stream, final int codePoint) {
        return Encoding.UTF16.encode(codePoint, unit -> stream.put((char) unit));
    }

    private Streams() {
        // utility class
    }
}
