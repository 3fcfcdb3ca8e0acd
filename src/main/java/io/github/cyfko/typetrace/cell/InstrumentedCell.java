package io.github.cyfko.typetrace.cell;

import io.github.cyfko.typetrace.TypeIdentity;
import io.github.cyfko.typetrace.TypeWitness;
import io.github.cyfko.typetrace.Witnessed;
import io.github.cyfko.typetrace.model.ConstructionEvent;
import io.github.cyfko.typetrace.trace.Diagnostics;

import java.util.Arrays;
import java.util.Objects;

/**
 * Read-only wrapper around one value that records how it was constructed.
 *
 * <p>
 * A cell is created by exactly one of three constructions, each reported as a
 * {@link ConstructionEvent} through {@link Diagnostics#record(ConstructionEvent)} before the
 * factory returns:
 * </p>
 * <ul>
 *   <li>{@link #withDefault(TypeWitness)}: holds {@code T}'s default value
 *       ({@link ConstructionEvent.Kind#DEFAULT}).</li>
 *   <li>{@link #of(Object)} / {@link #of(TypeWitness, Object)}: holds the given value
 *       ({@link ConstructionEvent.Kind#VALUE_INIT}).</li>
 *   <li>{@link #copyOf(InstrumentedCell)}: holds another cell's value
 *       ({@link ConstructionEvent.Kind#COPY}). Fires whenever a cell is duplicated, including
 *       when a container stores a cell.</li>
 * </ul>
 *
 * <p>
 * The cell keeps the witness of its value type, so {@code InstrumentedCell<Double>} and
 * {@code InstrumentedCell<Float>} stay distinguishable at run time
 * (see {@link #witness()}).
 * </p>
 *
 * <p>
 * A cell owns its value: it takes a copy on value and copy construction, and {@link #get()}
 * hands out a copy. Arrays and classes declaring a public copy constructor {@code T(T other)}
 * are copied; any other {@code T} is shared and must be an immutable value type.
 * </p>
 *
 * @param <T> held value type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class InstrumentedCell<T> implements Witnessed {

    private final TypeWitness<T> valueType;
    private final T value;

    private InstrumentedCell(TypeWitness<T> valueType, T value, ConstructionEvent event) {
        this.valueType = valueType;
        this.value = value;
        Diagnostics.record(event);
    }

    /**
     * Default construction.
     *
     * @throws IllegalArgumentException if {@code T} has no default value
     * @see DefaultValues#of(TypeWitness)
     */
    public static <T> InstrumentedCell<T> withDefault(TypeWitness<T> valueType) {
        Objects.requireNonNull(valueType, "valueType cannot be null");
        T value = DefaultValues.of(valueType);
        return new InstrumentedCell<>(valueType, value,
                ConstructionEvent.defaulted(TypeIdentity.displayName(valueType)));
    }

    /**
     * Value construction; the value type is the runtime witness of {@code value}.
     */
    @SuppressWarnings("unchecked")
    public static <T> InstrumentedCell<T> of(T value) {
        Objects.requireNonNull(value, "value cannot be null");
        return of((TypeWitness<T>) TypeIdentity.witnessOf(value), value);
    }

    /**
     * Value construction with an explicit value type.
     *
     * @throws IllegalArgumentException if {@code value} is not exactly of {@code valueType}
     */
    public static <T> InstrumentedCell<T> of(TypeWitness<T> valueType, T value) {
        Objects.requireNonNull(valueType, "valueType cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (!valueType.isPrimitive() && !valueType.isInstance(value)) {
            throw new IllegalArgumentException("Value " + value + " is not a "
                    + TypeIdentity.displayName(valueType));
        }
        T owned = ValueCopies.copy(value);
        return new InstrumentedCell<>(valueType, owned,
                ConstructionEvent.valueInit(TypeIdentity.displayName(valueType), owned));
    }

    /**
     * Copy construction.
     */
    public static <T> InstrumentedCell<T> copyOf(InstrumentedCell<T> other) {
        Objects.requireNonNull(other, "other cannot be null");
        T owned = ValueCopies.copy(other.value);
        return new InstrumentedCell<>(other.valueType, owned,
                ConstructionEvent.copy(TypeIdentity.displayName(other.valueType), owned));
    }

    /**
     * Returns the witness of {@code InstrumentedCell<T>} for a given {@code T}.
     */
    @SuppressWarnings("unchecked")
    public static <T> TypeWitness<InstrumentedCell<T>> witnessFor(TypeWitness<T> valueType) {
        return (TypeWitness<InstrumentedCell<T>>) TypeWitness.parameterized(InstrumentedCell.class, valueType);
    }

    /**
     * @return a copy of the held value
     */
    public T get() {
        return ValueCopies.copy(value);
    }

    public TypeWitness<T> valueType() {
        return valueType;
    }

    @Override
    public TypeWitness<InstrumentedCell<T>> witness() {
        return witnessFor(valueType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstrumentedCell)) return false;
        InstrumentedCell<?> other = (InstrumentedCell<?>) o;
        return valueType.equals(other.valueType) && Objects.deepEquals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * valueType.hashCode() + Arrays.deepHashCode(new Object[]{value});
    }

    @Override
    public String toString() {
        return "InstrumentedCell<" + TypeIdentity.displayName(valueType) + ">" + Arrays.deepToString(new Object[]{value});
    }
}
