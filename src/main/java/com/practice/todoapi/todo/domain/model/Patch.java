package com.practice.todoapi.todo.domain.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * A single field of a partial update. It is either absent (leave the stored value alone),
 * cleared (store {@code null}) or carries a non-null value.
 *
 * @param <T> type of the field value
 */
public final class Patch<T> {

    private enum State { ABSENT, CLEARED, VALUE }

    private static final Patch<?> ABSENT = new Patch<>(State.ABSENT, null);
    private static final Patch<?> CLEARED = new Patch<>(State.CLEARED, null);

    private final State state;
    private final T value;

    private Patch(State state, T value) {
        this.state = state;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> Patch<T> absent() {
        return (Patch<T>) ABSENT;
    }

    @SuppressWarnings("unchecked")
    public static <T> Patch<T> clear() {
        return (Patch<T>) CLEARED;
    }

    public static <T> Patch<T> of(T value) {
        return new Patch<>(State.VALUE, Objects.requireNonNull(value, "value"));
    }

    /** {@code null} maps to {@link #clear()}. */
    public static <T> Patch<T> ofNullable(T value) {
        return value == null ? clear() : of(value);
    }

    /** True when the field was sent, with a value or as an explicit null. */
    public boolean isPresent() {
        return state != State.ABSENT;
    }

    public boolean isCleared() {
        return state == State.CLEARED;
    }

    public boolean hasValue() {
        return state == State.VALUE;
    }

    /** The value, or {@code null} when absent or cleared. */
    public T value() {
        return value;
    }

    public T applyTo(T current) {
        return isPresent() ? value : current;
    }

    public <R> Patch<R> map(Function<? super T, ? extends R> mapper) {
        return hasValue() ? of(mapper.apply(value)) : (state == State.CLEARED ? clear() : absent());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Patch<?> other)) {
            return false;
        }
        return state == other.state && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value);
    }

    @Override
    public String toString() {
        return switch (state) {
            case ABSENT -> "Patch.absent";
            case CLEARED -> "Patch.clear";
            case VALUE -> "Patch[" + value + "]";
        };
    }
}
