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

import org.immutables.value.Value;

/**
 * Describes why a JSON text could not be parsed.
 */
@Value.Immutable(copy = false)
public abstract class ParseError {
    public enum Kind {
        // input is empty or contains only whitespace
        EMPTY_INPUT,

        // first character is not '{' or '['
        INVALID_ROOT,

        // non-whitespace characters follow the root value
        CONTENT_AFTER_ROOT,

        // object member name is not a string
        INVALID_MEMBER_NAME,

        // ':' missing after an object member name
        MISSING_COLON,

        // ',' or '}' missing after an object member
        MISSING_OBJECT_SEPARATOR,

        // ',' or ']' missing after an array element
        MISSING_ARRAY_SEPARATOR,

        // malformed null, true or false literal, or no value at all
        INVALID_VALUE,

        // end of input before the closing quote of a string
        UNTERMINATED_STRING,

        // backslash escape inside a string
        UNSUPPORTED_ESCAPE,

        // numeric text that cannot be converted to a long or a finite double
        INVALID_NUMBER,

        // nesting deeper than the configured maximum
        DEPTH_EXCEEDED;
    }

    public abstract Kind getKind();

    public abstract String getMessage();

    /**
     * Returns the number of characters consumed when the error was detected.
     *
     * @return character offset of the error
     */
    public abstract int getOffset();

    @Override
    public String toString() {
        return getMessage() + " (" + getKind() + ", offset=" + getOffset() + ")";
    }
}
