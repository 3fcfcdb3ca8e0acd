package io.github.cyfko.typetrace;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Process-stable token denoting one concrete Java type.
 * <p>
 * A witness is a raw class plus the ordered witnesses of its type arguments, so that
 * {@code InstrumentedCell<Double>} and {@code InstrumentedCell<Float>} are told apart even
 * though both erase to the same class. Witnesses are interned by {@link TypeIdentity}:
 * two witnesses are equal iff they denote the same type, and equal witnesses are the same
 * instance for the lifetime of the process. This makes them usable as map and dispatch keys.
 * </p>
 *
 * <pre>{@code
 * TypeWitness<Double> d = TypeWitness.of(Double.class);
 * TypeWitness<?> cell = TypeWitness.parameterized(InstrumentedCell.class, d);
 * TypeWitness<InstrumentedCell<Float>> f = new TypeCapture<InstrumentedCell<Float>>() {}.witness();
 * }</pre>
 *
 * @param <T> the denoted type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TypeWitness<T> {

    private final Class<?> rawType;
    private final List<TypeWitness<?>> arguments;
    private final int hash;

    TypeWitness(Class<?> rawType, List<TypeWitness<?>> arguments) {
        this.rawType = rawType;
        this.arguments = List.copyOf(arguments);
        this.hash = Objects.hash(rawType, this.arguments);
    }

    /**
     * Returns the witness of a non-parameterized type.
     *
     * @throws NullPointerException if {@code type} is {@code null}
     */
    public static <T> TypeWitness<T> of(Class<T> type) {
        return TypeIdentity.identify(type);
    }

    /**
     * Returns the witness of {@code rawType} parameterized with {@code arguments}.
     *
     * @param rawType   generic class
     * @param arguments witnesses of its type arguments, in declaration order
     * @return the interned witness
     * @throws IllegalArgumentException if the argument count does not match the type
     *                                  parameters of {@code rawType}
     */
    public static TypeWitness<?> parameterized(Class<?> rawType, TypeWitness<?>... arguments) {
        Objects.requireNonNull(rawType, "rawType cannot be null");
        Objects.requireNonNull(arguments, "arguments cannot be null");
        return TypeIdentity.intern(rawType, Arrays.asList(arguments));
    }

    public Class<?> rawType() {
        return rawType;
    }

    public List<TypeWitness<?>> arguments() {
        return arguments;
    }

    /**
     * @throws IndexOutOfBoundsException if this witness has no argument at {@code index}
     */
    public TypeWitness<?> argument(int index) {
        return arguments.get(index);
    }

    public boolean isParameterized() {
        return !arguments.isEmpty();
    }

    public boolean isPrimitive() {
        return rawType.isPrimitive();
    }

    /**
     * Returns {@code true} if {@code value} is an instance of the denoted type, judged by
     * its runtime witness.
     */
    public boolean isInstance(Object value) {
        return value != null && TypeIdentity.witnessOf(value) == this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeWitness)) return false;
        TypeWitness<?> other = (TypeWitness<?>) o;
        return rawType.equals(other.rawType) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /** Raw (signature) form; use {@link TypeIdentity#displayName(TypeWitness)} for people. */
    @Override
    public String toString() {
        return TypeIdentity.rawName(this);
    }
}
