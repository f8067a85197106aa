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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.function.IntConsumer;

import com.google.common.base.Preconditions;

/**
 * Unicode encodings that can turn a codepoint into a sequence of code units.
 *
 * Code units are reported as <code>int</code> values: bytes (0-255) for {@link #UTF8}, UTF-16
 * chars for {@link #UTF16} and the codepoint itself for {@link #UTF32}.
 */
public enum Encoding {
    UTF8(StandardCharsets.UTF_8, 4) {
        @Override
        public int encode(final int codePoint, final IntConsumer sink) {
            checkCodePoint(codePoint);
            if (codePoint <= 0x7F) {
                sink.accept(codePoint & 0xFF);
                return 1;
            } else if (codePoint <= 0x7FF) {
                sink.accept(0xC0 | codePoint >> 6 & 0xFF);
                sink.accept(0x80 | codePoint & 0x3F);
                return 2;
            } else if (codePoint <= 0xFFFF) {
                sink.accept(0xE0 | codePoint >> 12 & 0xFF);
                sink.accept(0x80 | codePoint >> 6 & 0x3F);
                sink.accept(0x80 | codePoint & 0x3F);
                return 3;
            } else {
                sink.accept(0xF0 | codePoint >> 18 & 0xFF);
                sink.accept(0x80 | codePoint >> 12 & 0x3F);
                sink.accept(0x80 | codePoint >> 6 & 0x3F);
                sink.accept(0x80 | codePoint & 0x3F);
                return 4;
            }
        }
    },

    UTF16(StandardCharsets.UTF_16, 2) {
        @Override
        public int encode(final int codePoint, final IntConsumer sink) {
            checkCodePoint(codePoint);
            if (codePoint <= 0xFFFF) {
                // a codepoint by itself cannot be half of a surrogate pair
                Preconditions.checkArgument(
                        codePoint < 0xD800 || codePoint > 0xDFFF,
                        "Surrogate codepoint U+%s cannot be encoded",
                        Integer.toHexString(codePoint).toUpperCase());
                sink.accept(codePoint);
                return 1;
            }
            final int v = codePoint - 0x10000;
            sink.accept((v >> 10) + 0xD800);
            sink.accept((v & 0x3FF) + 0xDC00);
            return 2;
        }
    },

    UTF32(Charset.forName("UTF-32"), 1) {
        @Override
        public int encode(final int codePoint, final IntConsumer sink) {
            checkCodePoint(codePoint);
            sink.accept(codePoint);
            return 1;
        }
    };

    /** Largest valid Unicode codepoint **/
    public static final int MAX_CODE_POINT = 0x10FFFF;

    private static void checkCodePoint(final int codePoint) {
        Preconditions.checkArgument(
                codePoint >= 0 && codePoint <= MAX_CODE_POINT,
                "Invalid codepoint: %s",
                codePoint);
    }

    private final Charset charset;

    private final int maxUnits;

    private Encoding(final Charset charset, final int maxUnits) {
        this.charset = charset;
        this.maxUnits = maxUnits;
    }

    /**
     * Encodes a codepoint into the given buffer.
     *
     * @param codePoint
     *            codepoint in the range 0 to {@link #MAX_CODE_POINT} inclusive
     * @param buffer
     *            destination buffer, with room for at least {@link #getMaxUnits()} units after
     *            <code>offset</code>
     * @param offset
     *            position of the first code unit
     * @return position after the last code unit written
     */
    public final int encode(final int codePoint, final int[] buffer, final int offset) {
        final int[] pos = new int[] { offset };
        encode(codePoint, unit -> buffer[pos[0]++] = unit);
        return pos[0];
    }

    /**
     * Encodes a codepoint, passing each code unit to the given sink.
     *
     * @param codePoint
     *            codepoint in the range 0 to {@link #MAX_CODE_POINT} inclusive
     * @param sink
     *            receives the code units in order
     * @return number of code units produced
     */
    public abstract int encode(int codePoint, IntConsumer sink);

    /**
     * Returns the charset used when text in this encoding is read from a file.
     *
     * @return the charset used when text in this encoding is read from a file
     */
    public final Charset getCharset() {
        return charset;
    }

    public final int getMaxUnits() {
        return maxUnits;
    }
}
