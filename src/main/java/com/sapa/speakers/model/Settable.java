package com.sapa.speakers.model;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Field presence for partial updates: a value is either not supplied, supplied, or explicitly cleared.
 * Absent fields are never written; cleared fields are written in their empty remote shape.
 */
public final class Settable<T> {

    private enum State { ABSENT, SET, CLEARED }

    private static final Settable<?> ABSENT = new Settable<>(State.ABSENT, null);
    private static final Settable<?> CLEARED = new Settable<>(State.CLEARED, null);

    private final State state;
    private final T value;

    private Settable(State state, T value) {
        this.state = state;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> Settable<T> absent() {
        return (Settable<T>) ABSENT;
    }

    @SuppressWarnings("unchecked")
    public static <T> Settable<T> cleared() {
        return (Settable<T>) CLEARED;
    }

    public static <T> Settable<T> of(T value) {
        return new Settable<>(State.SET, Objects.requireNonNull(value, "value"));
    }

    /** Null maps to absent, which is what sparse domain objects mean by null. */
    public static <T> Settable<T> ofNullable(T value) {
        return value == null ? absent() : of(value);
    }

    public boolean isAbsent() {
        return state == State.ABSENT;
    }

    public boolean isSet() {
        return state == State.SET;
    }

    public boolean isCleared() {
        return state == State.CLEARED;
    }

    public T get() {
        if (state != State.SET) {
            throw new NoSuchElementException("No value present (" + state + ")");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Settable<?> other)) return false;
        return state == other.state && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value);
    }

    @Override
    public String toString() {
        return state == State.SET ? "Settable[" + value + "]" : "Settable." + state.name().toLowerCase();
    }
}
