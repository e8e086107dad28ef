package com.example.redismanager.service;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Result of a read. Tells a missing key apart from a key whose stored value is {@code null}.
 */
public final class Lookup {

    private static final Lookup ABSENT = new Lookup(false, null);

    private final boolean present;
    private final Object value;

    private Lookup(boolean present, Object value) {
        this.present = present;
        this.value = value;
    }

    public static Lookup absent() {
        return ABSENT;
    }

    public static Lookup of(Object value) {
        return new Lookup(true, value);
    }

    public boolean isPresent() { return present; }

    public boolean isAbsent() { return !present; }

    /**
     * @return the stored value, possibly {@code null}
     * @throws NoSuchElementException if the key does not exist
     */
    public Object value() {
        if (!present) {
            throw new NoSuchElementException("No value present");
        }
        return value;
    }

    public <T> T as(Class<T> type) {
        return type.cast(value());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Lookup)) return false;
        Lookup other = (Lookup) o;
        return present == other.present && Objects.deepEquals(value, other.value);
    }

    @Override
    public int hashCode() {
        return present ? 31 + Arrays.deepHashCode(new Object[]{value}) : 0;
    }

    @Override
    public String toString() {
        return present ? "Lookup[" + value + "]" : "Lookup.ABSENT";
    }
}
