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
 * Immutable JSON number that holds either a signed 64 bit integer or a double.
 */
public final class JsonNumber {
    public enum NumericType {
        // signed 64 bit integer
        NATURAL,

        // double precision floating point
        REAL;
    }

    public static JsonNumber ofNatural(final long value) {
        return new JsonNumber(NumericType.NATURAL, value, 0d);
    }

    public static JsonNumber ofReal(final double value) {
        return new JsonNumber(NumericType.REAL, 0L, value);
    }

    private final NumericType type;

    private final long natural;

    private final double real;

    private JsonNumber(final NumericType type, final long natural, final double real) {
        this.type = type;
        this.natural = natural;
        this.real = real;
    }

    /**
     * Returns the value as a long, truncating a real value towards zero.
     *
     * @return the value as a long
     */
    public long asNatural() {
        return type == NumericType.NATURAL ? natural : (long) real;
    }

    /**
     * Returns the value as a double, widening a natural value.
     *
     * @return the value as a double
     */
    public double asReal() {
        return type == NumericType.REAL ? real : (double) natural;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof JsonNumber)) {
            return false;
        }
        final JsonNumber other = (JsonNumber) obj;
        if (type != other.type) {
            return false;
        }
        return type == NumericType.NATURAL ? natural == other.natural
                : Double.doubleToLongBits(real) == Double.doubleToLongBits(other.real);
    }

    public NumericType getType() {
        return type;
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + (type == NumericType.NATURAL ? Long.hashCode(natural) : Double.hashCode(real));
    }

    public boolean isNatural() {
        return type == NumericType.NATURAL;
    }

    public boolean isReal() {
        return type == NumericType.REAL;
    }

    @Override
    public String toString() {
        return type == NumericType.NATURAL ? Long.toString(natural) : Double.toString(real);
    }
}
