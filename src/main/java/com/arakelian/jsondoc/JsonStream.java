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

/**
 * <p>
 * Cursor over character data.
 * </p>
 * <p>
 * The read side ({@link #peek()}, {@link #take()}, {@link #tell()}) is always available. The write
 * side ({@link #begin()}, {@link #put(char)}, {@link #end(int)}) is only available when
 * {@link #isWritable()} returns true; calling it on a read-only stream is a programming error and
 * fails immediately.
 * </p>
 * <p>
 * A stream can be copied cheaply with {@link #snapshot()}. The snapshot shares the underlying
 * characters but has its own cursor, so it can be advanced to scan ahead and later either dropped
 * or adopted with {@link #commit(JsonStream)}.
 * </p>
 */
public interface JsonStream {
    /** Character returned once the end of the input has been reached **/
    public static final char EOF = '\0';

    /**
     * Marks the current read position as the start of a write.
     *
     * @return write cursor, to be passed to {@link #end(int)}
     */
    public int begin();

    /**
     * Moves this stream's cursor to the cursor of a snapshot taken from it.
     *
     * @param snapshot
     *            a snapshot previously returned by {@link #snapshot()} on this stream
     */
    public void commit(JsonStream snapshot);

    /**
     * Ends a write that was started with {@link #begin()}.
     *
     * @param begin
     *            the value returned by {@link #begin()}
     * @return number of characters written since {@link #begin()}
     */
    public int end(int begin);

    public boolean isWritable();

    /**
     * Returns the character at the cursor without advancing.
     *
     * @return the character at the cursor, or {@link #EOF} at the end of input
     */
    public char peek();

    public void put(char c);

    /**
     * Returns a cursor copy that can scan ahead independently of this stream.
     *
     * @return a copy of this stream sharing the same characters
     */
    public JsonStream snapshot();

    /**
     * Returns the characters between two offsets, as reported by {@link #tell()} or
     * {@link #begin()}.
     *
     * @param from
     *            offset of the first character
     * @param to
     *            offset one past the last character
     * @return characters in the given range
     */
    public CharSequence span(int from, int to);

    /**
     * Returns the character at the cursor and advances the cursor by one.
     *
     * @return the character at the cursor, or {@link #EOF} at the end of input
     */
    public char take();

    /**
     * Returns the number of characters consumed from the start of the stream.
     *
     * @return number of characters consumed
     */
    public int tell();
}
