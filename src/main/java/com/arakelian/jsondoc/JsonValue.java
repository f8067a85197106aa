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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.base.Preconditions;

/**
 * <p>
 * A node of a JSON document: null, false, true, number, string, array or object.
 * </p>
 * <p>
 * The {@link ValueType} determines which accessors may be called; calling an accessor that does not
 * match the current type throws {@link IllegalStateException}. Arrays, objects and strings are
 * owned exclusively by their value. Copying a value ({@link #JsonValue(JsonValue)},
 * {@link #assign(JsonValue)}, {@link #append(JsonValue)}, {@link #insert(JsonValue, JsonValue)})
 * copies the whole subtree; moving a value ({@link #move()}, {@link #moveFrom(JsonValue)})
 * transfers ownership and resets the source to null. Since values are only ever added by copy or
 * move, a document is always a tree.
 * </p>
 * <p>
 * Object members are ordered by {@link #KEY_ORDER}. Inserting a member whose name is already
 * present replaces the existing member's value. Member names are read-only: the keys returned by
 * {@link #asObject()} throw {@link IllegalStateException} from every mutator.
 * </p>
 * <p>
 * This class is not thread-safe. A fully built tree may be read from several threads, but any
 * mutation must be synchronized by the caller.
 * </p>
 */
public final class JsonValue {
    /**
     * Ordering of object member names: by cached string hash first, then lexicographically.
     */
    public static final Comparator<JsonValue> KEY_ORDER = (lhs, rhs) -> {
        Preconditions.checkArgument(lhs.type == ValueType.STRING, "Object key must be a string: %s", lhs.type);
        Preconditions.checkArgument(rhs.type == ValueType.STRING, "Object key must be a string: %s", rhs.type);
        final int result = Integer.compare(lhs.hash, rhs.hash);
        if (result != 0) {
            return result;
        }
        return lhs.string.compareTo(rhs.string);
    };

    /** Shared null returned by lookups that do not find anything; it can never be modified **/
    private static final JsonValue NULL = new JsonValue(true, ValueType.NULL);

    private static JsonValue memberName(final JsonValue key) {
        Preconditions.checkArgument(key.type == ValueType.STRING, "Object key must be a string: %s", key.type);
        return key.frozen ? key : memberName(key.string);
    }

    private static JsonValue memberName(final String key) {
        final JsonValue name = new JsonValue(true, ValueType.NULL);
        name.setString(key);
        return name;
    }

    /**
     * Returns the shared, unmodifiable null value.
     *
     * @return the shared, unmodifiable null value
     */
    public static JsonValue nullValue() {
        return NULL;
    }

    private ValueType type;

    private JsonNumber number;

    private String string;

    /** cached hash of {@link #string} **/
    private int hash;

    private List<JsonValue> elements;

    private SortedMap<JsonValue, JsonValue> members;

    /** true for the shared null value and for object member names **/
    private final boolean frozen;

    public JsonValue() {
        this(false, ValueType.NULL);
    }

    public JsonValue(final boolean value) {
        this(false, value ? ValueType.TRUE : ValueType.FALSE);
    }

    private JsonValue(final boolean frozen, final ValueType type) {
        this.frozen = frozen;
        this.type = type;
    }

    public JsonValue(final CharSequence value) {
        this(false, ValueType.NULL);
        Preconditions.checkArgument(value != null, "value must be non-null");
        setString(value.toString());
    }

    public JsonValue(final double value) {
        this(JsonNumber.ofReal(value));
    }

    /**
     * Creates a deep copy of the given value.
     *
     * @param other
     *            value to be copied
     */
    public JsonValue(final JsonValue other) {
        this(false, ValueType.NULL);
        Preconditions.checkArgument(other != null, "other must be non-null");
        copyPayload(other);
    }

    public JsonValue(final JsonNumber value) {
        this(false, ValueType.NUMBER);
        Preconditions.checkArgument(value != null, "value must be non-null");
        this.number = value;
    }

    public JsonValue(final long value) {
        this(JsonNumber.ofNatural(value));
    }

    /**
     * Creates an empty value of the given type: an empty array, an empty object, an empty string,
     * the number zero, or a literal.
     *
     * @param type
     *            value type
     */
    public JsonValue(final ValueType type) {
        this(false, ValueType.NULL);
        Preconditions.checkArgument(type != null, "type must be non-null");
        initialize(type);
    }

    /**
     * Appends a copy of the given value to this array. A null value becomes an empty array first.
     *
     * @param value
     *            value to be appended
     * @return the element that was stored
     */
    public JsonValue append(final JsonValue value) {
        Preconditions.checkArgument(value != null, "value must be non-null");
        return add(new JsonValue(value));
    }

    /**
     * Returns an unmodifiable view of the elements of this array.
     *
     * @return an unmodifiable view of the elements of this array
     */
    public List<JsonValue> asArray() {
        checkType(ValueType.ARRAY);
        return Collections.unmodifiableList(elements);
    }

    public boolean asBool() {
        Preconditions.checkState(
                type == ValueType.TRUE || type == ValueType.FALSE,
                "Expected boolean but value is %s",
                type);
        return type == ValueType.TRUE;
    }

    /**
     * Returns the value of this number as a long, truncating a real value.
     *
     * @return value of this number as a long
     */
    public long asNatural() {
        return asNumber().asNatural();
    }

    public JsonNumber asNumber() {
        checkType(ValueType.NUMBER);
        return number;
    }

    /**
     * Returns an unmodifiable view of the members of this object. The keys are read-only string
     * values.
     *
     * @return an unmodifiable view of the members of this object
     */
    public SortedMap<JsonValue, JsonValue> asObject() {
        checkType(ValueType.OBJECT);
        return Collections.unmodifiableSortedMap(members);
    }

    /**
     * Returns the value of this number as a double.
     *
     * @return value of this number as a double
     */
    public double asReal() {
        return asNumber().asReal();
    }

    public String asString() {
        checkType(ValueType.STRING);
        return string;
    }

    /**
     * Replaces this value with a deep copy of the given value.
     *
     * @param other
     *            value to be copied; may be a descendant of this value
     * @return this value
     */
    public JsonValue assign(final JsonValue other) {
        checkMutable();
        Preconditions.checkArgument(other != null, "other must be non-null");
        if (other != this) {
            // copy before releasing, other may live inside this value
            final JsonValue copy = new JsonValue(other);
            takePayload(copy);
        }
        return this;
    }

    private void checkMutable() {
        Preconditions.checkState(!frozen, "The shared null value and object member names cannot be modified");
    }

    private void checkType(final ValueType expected) {
        Preconditions.checkState(type == expected, "Expected %s but value is %s", expected, type);
    }

    /**
     * Resets an array, object or string back to null, releasing what it owns. Other values are left
     * unchanged.
     */
    public void clear() {
        checkMutable();
        switch (type) {
        case ARRAY:
        case OBJECT:
        case STRING:
            reset();
            break;
        default:
            break;
        }
    }

    private void copyPayload(final JsonValue other) {
        switch (other.type) {
        case ARRAY:
            elements = new ArrayList<>(other.elements.size());
            for (final JsonValue element : other.elements) {
                elements.add(new JsonValue(element));
            }
            break;
        case OBJECT:
            // member names are read-only and can be shared
            members = new TreeMap<>(KEY_ORDER);
            for (final Map.Entry<JsonValue, JsonValue> entry : other.members.entrySet()) {
                members.put(entry.getKey(), new JsonValue(entry.getValue()));
            }
            break;
        default:
            // numbers and strings are immutable
            number = other.number;
            string = other.string;
            break;
        }
        type = other.type;
        hash = other.hash;
    }

    /**
     * Returns true if the given value is this value or one of its descendants.
     *
     * @param value
     *            value to look for
     * @return true if the given value is this value or one of its descendants
     */
    public boolean encloses(final JsonValue value) {
        if (this == value) {
            return true;
        }
        switch (type) {
        case ARRAY:
            for (final JsonValue element : elements) {
                if (element.encloses(value)) {
                    return true;
                }
            }
            return false;
        case OBJECT:
            for (final JsonValue member : members.values()) {
                if (member.encloses(value)) {
                    return true;
                }
            }
            return false;
        default:
            return false;
        }
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof JsonValue)) {
            return false;
        }
        final JsonValue other = (JsonValue) obj;
        if (type != other.type) {
            return false;
        }
        switch (type) {
        case STRING:
            return hash == other.hash && string.equals(other.string);
        case NUMBER:
            return number.equals(other.number);
        case ARRAY:
            return elements.equals(other.elements);
        case OBJECT:
            return members.equals(other.members);
        default:
            return true;
        }
    }

    /**
     * Returns the member with the given name without modifying this value.
     *
     * @param key
     *            member name
     * @return the member, if this is an object that has it
     */
    public Optional<JsonValue> find(final String key) {
        Preconditions.checkArgument(key != null, "key must be non-null");
        Preconditions.checkState(
                type == ValueType.NULL || type == ValueType.OBJECT,
                "Expected OBJECT but value is %s",
                type);
        if (type == ValueType.NULL) {
            return Optional.empty();
        }
        return Optional.ofNullable(members.get(new JsonValue(key)));
    }

    /**
     * Returns the element at the given index of this array.
     *
     * @param index
     *            element index
     * @return the element at the given index
     * @throws IndexOutOfBoundsException
     *             if the index is negative or not less than {@link #size()}
     */
    public JsonValue get(final int index) {
        checkType(ValueType.ARRAY);
        Preconditions.checkElementIndex(index, elements.size());
        return elements.get(index);
    }

    /**
     * Returns the member with the given name, or the shared {@link #nullValue()} if there is none.
     * This value is never modified; use {@link #getOrInsert(String)} to create members.
     *
     * @param key
     *            member name
     * @return the member with the given name, or the shared null value
     */
    public JsonValue get(final String key) {
        return find(key).orElse(NULL);
    }

    /**
     * Returns the member with the given name, adding a null member when there is none. A null value
     * becomes an empty object first.
     *
     * @param key
     *            member name
     * @return the member with the given name
     */
    public JsonValue getOrInsert(final String key) {
        Preconditions.checkArgument(key != null, "key must be non-null");
        promote(ValueType.OBJECT);
        final JsonValue name = memberName(key);
        JsonValue member = members.get(name);
        if (member == null) {
            member = new JsonValue();
            members.put(name, member);
        }
        return member;
    }

    public ValueType getType() {
        return type;
    }

    @Override
    public int hashCode() {
        switch (type) {
        case STRING:
            return hash;
        case NUMBER:
            return number.hashCode();
        case ARRAY:
            return elements.hashCode();
        case OBJECT:
            return members.hashCode();
        default:
            return type.ordinal();
        }
    }

    private void initialize(final ValueType newType) {
        reset();
        switch (newType) {
        case ARRAY:
            elements = new ArrayList<>();
            break;
        case OBJECT:
            members = new TreeMap<>(KEY_ORDER);
            break;
        case STRING:
            setString("");
            return;
        case NUMBER:
            number = JsonNumber.ofNatural(0);
            break;
        default:
            break;
        }
        type = newType;
    }

    /**
     * Inserts a copy of the given member into this object. A null value becomes an empty object
     * first. If a member with the same name exists, its value is replaced and the given key is not
     * stored.
     *
     * @param key
     *            member name, must be a string value
     * @param value
     *            member value
     * @return the member value that was stored
     */
    public JsonValue insert(final JsonValue key, final JsonValue value) {
        Preconditions.checkArgument(key != null, "key must be non-null");
        Preconditions.checkArgument(value != null, "value must be non-null");
        Preconditions.checkArgument(key.type == ValueType.STRING, "Object key must be a string: %s", key.type);
        return put(key, new JsonValue(value));
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean isNull() {
        return type == ValueType.NULL;
    }

    /**
     * Transfers the contents of this value to a new value and resets this value to null.
     *
     * @return a new value owning what this value owned
     */
    public JsonValue move() {
        checkMutable();
        final JsonValue moved = new JsonValue(false, ValueType.NULL);
        moved.takePayload(this);
        reset();
        return moved;
    }

    /**
     * Releases what this value owns and takes over the contents of the given value, which is reset
     * to null. Moving from the shared null value resets this value to null.
     *
     * @param other
     *            value to be moved; must not contain this value and must not be an object member
     *            name
     * @return this value
     */
    public JsonValue moveFrom(final JsonValue other) {
        checkMutable();
        Preconditions.checkArgument(other != null, "other must be non-null");
        if (other == this) {
            return this;
        }
        if (other == NULL) {
            reset();
            return this;
        }
        other.checkMutable();
        Preconditions.checkArgument(!other.encloses(this), "Cannot move a value into one of its own descendants");
        takePayload(other);
        other.reset();
        return this;
    }

    private void promote(final ValueType container) {
        checkMutable();
        Preconditions.checkState(
                type == ValueType.NULL || type == container,
                "Expected %s but value is %s",
                container,
                type);
        if (type == ValueType.NULL) {
            initialize(container);
        }
    }

    /**
     * Inserts a copy of the given value as the member with the given name.
     *
     * @param key
     *            member name
     * @param value
     *            member value
     * @return the member value that was stored
     * @see #insert(JsonValue, JsonValue)
     */
    public JsonValue put(final String key, final JsonValue value) {
        Preconditions.checkArgument(key != null, "key must be non-null");
        Preconditions.checkArgument(value != null, "value must be non-null");
        return put(memberName(key), new JsonValue(value));
    }

    /**
     * Appends an element that nothing else refers to, without copying it.
     */
    JsonValue add(final JsonValue element) {
        promote(ValueType.ARRAY);
        elements.add(element);
        return element;
    }

    /**
     * Stores a member value that nothing else refers to, without copying it. The key is stored as a
     * read-only copy unless it already is one.
     */
    JsonValue put(final JsonValue key, final JsonValue value) {
        promote(ValueType.OBJECT);
        final JsonValue name = memberName(key);
        final JsonValue existing = members.get(name);
        if (existing != null) {
            existing.takePayload(value);
            return existing;
        }
        members.put(name, value);
        return value;
    }

    private void reset() {
        type = ValueType.NULL;
        number = null;
        string = null;
        hash = 0;
        elements = null;
        members = null;
    }

    private void setString(final String value) {
        reset();
        type = ValueType.STRING;
        string = value;
        hash = value.hashCode();
    }

    /**
     * Returns the number of elements or members; zero for null.
     *
     * @return the number of elements or members
     */
    public int size() {
        switch (type) {
        case NULL:
            return 0;
        case ARRAY:
            return elements.size();
        case OBJECT:
            return members.size();
        default:
            throw new IllegalStateException("Expected ARRAY or OBJECT but value is " + type);
        }
    }

    private void takePayload(final JsonValue other) {
        type = other.type;
        number = other.number;
        string = other.string;
        hash = other.hash;
        elements = other.elements;
        members = other.members;
    }

    /**
     * Returns the compact JSON text of this value.
     */
    @Override
    public String toString() {
        return JsonWriter.toString(this, false);
    }
}
