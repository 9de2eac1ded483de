package com.example.chatstore.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.function.Function;

/**
 * Three-state change of a single field: leave it as it is, set it to a value, or clear it.
 * Clearing is distinct from leaving untouched; a cleared field is removed from the stored record.
 *
 * @param <T> field type
 */
@EqualsAndHashCode(doNotUseGetters = true)
@ToString(doNotUseGetters = true)
public final class FieldUpdate<T> {

    public enum State { UNCHANGED, SET, CLEAR }

    private static final FieldUpdate<?> UNCHANGED = new FieldUpdate<>(State.UNCHANGED, null);
    private static final FieldUpdate<?> CLEAR = new FieldUpdate<>(State.CLEAR, null);

    @Getter
    private final State state;
    private final T value;

    private FieldUpdate(State state, T value) {
        this.state = state;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldUpdate<T> unchanged() {
        return (FieldUpdate<T>) UNCHANGED;
    }

    public static <T> FieldUpdate<T> set(T value) {
        return new FieldUpdate<>(State.SET, Objects.requireNonNull(value, "value"));
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldUpdate<T> clear() {
        return (FieldUpdate<T>) CLEAR;
    }

    public boolean isUnchanged() {
        return state == State.UNCHANGED;
    }

    public boolean isSet() {
        return state == State.SET;
    }

    public boolean isClear() {
        return state == State.CLEAR;
    }

    /**
     * The new value; only meaningful when {@link #isSet()}.
     */
    public T getValue() {
        if (state != State.SET) {
            throw new IllegalStateException("No value for " + state + " update");
        }
        return value;
    }

    public <R> FieldUpdate<R> map(Function<? super T, ? extends R> mapper) {
        if (state == State.SET) {
            return FieldUpdate.set(mapper.apply(value));
        }
        return state == State.CLEAR ? FieldUpdate.clear() : FieldUpdate.unchanged();
    }
}
