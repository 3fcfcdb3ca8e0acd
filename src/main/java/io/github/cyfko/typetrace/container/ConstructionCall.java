package io.github.cyfko.typetrace.container;

import io.github.cyfko.typetrace.TypeWitness;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A concrete construction invocation, as handed to {@link ConstructionResolver}.
 *
 * <p>
 * The {@link Form} records how the arguments were supplied: as a braced list
 * ({@code {a, b}}), as a parenthesized argument list ({@code (n, v)}), or not at all. The
 * form matters: a braced list always takes precedence over the sized constructions.
 * </p>
 *
 * <p>
 * A declared element type is optional. Primitive declared types are recorded as their
 * wrapper, since containers hold boxed values.
 * </p>
 *
 * @param form         how the arguments were supplied
 * @param declaredType explicitly declared element type, or {@code null} to deduce it
 * @param arguments    the arguments, in order; never {@code null} and without {@code null}s
 */
public record ConstructionCall(
        Form form,
        TypeWitness<?> declaredType,
        List<Object> arguments
) {

    public enum Form {
        NONE,
        PARENTHESIZED,
        BRACED
    }

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            double.class, Double.class,
            float.class, Float.class,
            short.class, Short.class,
            byte.class, Byte.class,
            char.class, Character.class,
            boolean.class, Boolean.class
    );

    public ConstructionCall {
        Objects.requireNonNull(form, "form cannot be null");
        Objects.requireNonNull(arguments, "arguments cannot be null");
        arguments = List.copyOf(arguments);

        if (form == Form.NONE && !arguments.isEmpty()) {
            throw new IllegalArgumentException("A call without argument list cannot carry arguments");
        }
        if (declaredType != null && declaredType.isPrimitive()) {
            declaredType = TypeWitness.of(WRAPPERS.get(declaredType.rawType()));
        }
    }

    public static ConstructionCall none() {
        return new ConstructionCall(Form.NONE, null, List.of());
    }

    public static ConstructionCall none(TypeWitness<?> declaredType) {
        return new ConstructionCall(Form.NONE, declaredType, List.of());
    }

    public static ConstructionCall parenthesized(Object... arguments) {
        return new ConstructionCall(Form.PARENTHESIZED, null, Arrays.asList(arguments));
    }

    public static ConstructionCall parenthesized(TypeWitness<?> declaredType, Object... arguments) {
        return new ConstructionCall(Form.PARENTHESIZED, declaredType, Arrays.asList(arguments));
    }

    public static ConstructionCall braced(Object... arguments) {
        return new ConstructionCall(Form.BRACED, null, Arrays.asList(arguments));
    }

    public static ConstructionCall braced(TypeWitness<?> declaredType, Object... arguments) {
        return new ConstructionCall(Form.BRACED, declaredType, Arrays.asList(arguments));
    }

    public Optional<TypeWitness<?>> declared() {
        return Optional.ofNullable(declaredType);
    }
}
