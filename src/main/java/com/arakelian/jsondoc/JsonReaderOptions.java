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

import com.google.common.base.Preconditions;

@Value.Immutable(copy = false)
public abstract class JsonReaderOptions {
    public static final JsonReaderOptions DEFAULT = ImmutableJsonReaderOptions.builder().build();

    @Value.Check
    protected void checkMaxDepth() {
        Preconditions.checkState(getMaxDepth() > 0, "maxDepth must be positive");
    }

    /**
     * Returns the deepest nesting of objects and arrays that will be parsed. There is no limit by
     * default; very deep input may then exhaust the call stack.
     *
     * @return deepest nesting of objects and arrays that will be parsed
     */
    @Value.Default
    public int getMaxDepth() {
        return Integer.MAX_VALUE;
    }

    /**
     * Returns true if strings are decoded into the input buffer itself. This requires a writable
     * stream such as {@link InPlaceStringStream}.
     *
     * @return true if strings are decoded into the input buffer
     */
    @Value.Default
    public boolean isInPlace() {
        return false;
    }
}
