package io.github.cyfko.typetrace;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Exhaustive, exact-match dispatch on type witnesses.
 * <p>
 * A table maps witnesses to handlers and always carries a default handler: the builder's
 * only terminal operation is {@link Builder#orElse(Function)}, so a table without a default
 * arm cannot be written. The case table is frozen when the switch is built; a call selects
 * the handler registered for exactly the value's witness (no subtype, boxing or conversion
 * matching) and runs it, or runs the default. Exactly one handler runs per call.
 * </p>
 *
 * <pre>{@code
 * TypeSwitch<String> describe = TypeSwitch.<String>builder()
 *         .on(Integer.class, i -> "int")
 *         .on(Double.class, d -> "double")
 *         .on(new TypeCapture<InstrumentedCell<Float>>() {}.witness(), c -> "InstrumentedCell<float>")
 *         .orElse(v -> "something else");
 *
 * describe.apply(42);        // "int"
 * describe.apply("Hello");   // "something else"
 * }</pre>
 *
 * @param <R> handler result type
 */
public final class TypeSwitch<R> {

    private final Map<TypeWitness<?>, Function<Object, ? extends R>> cases;
    private final Function<Object, ? extends R> fallback;

    private TypeSwitch(Map<TypeWitness<?>, Function<Object, ? extends R>> cases,
                       Function<Object, ? extends R> fallback) {
        this.cases = Map.copyOf(cases);
        this.fallback = fallback;
    }

    public static <R> Builder<R> builder() {
        return new Builder<>();
    }

    /**
     * Dispatches on the static witness of {@code value}.
     */
    public <T> R apply(TypeWitness<T> type, T value) {
        Objects.requireNonNull(type, "type cannot be null");
        return select(type).apply(value);
    }

    /**
     * Dispatches on the runtime witness of {@code value}.
     *
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public R apply(Object value) {
        return select(TypeIdentity.witnessOf(value)).apply(value);
    }

    /**
     * Returns {@code true} if a case (not the default) is registered for {@code type}.
     */
    public boolean handles(TypeWitness<?> type) {
        return cases.containsKey(type);
    }

    private Function<Object, ? extends R> select(TypeWitness<?> type) {
        return cases.getOrDefault(type, fallback);
    }

    /**
     * Collects cases in registration order; duplicate witnesses are rejected.
     */
    public static final class Builder<R> {

        private final Map<TypeWitness<?>, Function<Object, ? extends R>> cases = new LinkedHashMap<>();

        private Builder() {
        }

        public <T> Builder<R> on(Class<T> type, Function<? super T, ? extends R> handler) {
            return on(TypeWitness.of(type), handler);
        }

        /**
         * @throws IllegalArgumentException if a handler is already registered for {@code type}
         */
        public <T> Builder<R> on(TypeWitness<T> type, Function<? super T, ? extends R> handler) {
            Objects.requireNonNull(type, "type cannot be null");
            Objects.requireNonNull(handler, "handler cannot be null");

            if (cases.containsKey(type)) {
                throw new IllegalArgumentException(
                        "Duplicate case for type " + TypeIdentity.displayName(type));
            }

            cases.put(type, value -> {
                @SuppressWarnings("unchecked")
                T typed = (T) value;
                return handler.apply(typed);
            });
            return this;
        }

        /**
         * Freezes the table with {@code fallback} as the default arm.
         */
        public TypeSwitch<R> orElse(Function<Object, ? extends R> fallback) {
            Objects.requireNonNull(fallback, "fallback cannot be null");
            return new TypeSwitch<>(cases, fallback);
        }
    }
}
