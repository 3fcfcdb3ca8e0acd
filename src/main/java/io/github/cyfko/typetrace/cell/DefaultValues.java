package io.github.cyfko.typetrace.cell;

import io.github.cyfko.typetrace.TypeIdentity;
import io.github.cyfko.typetrace.TypeWitness;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.Objects;

/**
 * Default ("value-initialized") values of Java types.
 *
 * <ol>
 *   <li><b>Primitives and their wrappers</b>: zero, {@code false} or {@code '\0'}.</li>
 *   <li><b>{@link String}</b>: the empty string.</li>
 *   <li><b>Arrays</b>: an empty array of the component type.</li>
 *   <li><b>Enums</b>: the first declared constant.</li>
 *   <li><b>Other classes</b>: a fresh instance from the public no-argument constructor.</li>
 * </ol>
 */
public final class DefaultValues {

    private static final Map<Class<?>, Object> ZEROS = Map.ofEntries(
            Map.entry(int.class, 0),
            Map.entry(Integer.class, 0),
            Map.entry(long.class, 0L),
            Map.entry(Long.class, 0L),
            Map.entry(double.class, 0.0d),
            Map.entry(Double.class, 0.0d),
            Map.entry(float.class, 0.0f),
            Map.entry(Float.class, 0.0f),
            Map.entry(short.class, (short) 0),
            Map.entry(Short.class, (short) 0),
            Map.entry(byte.class, (byte) 0),
            Map.entry(Byte.class, (byte) 0),
            Map.entry(char.class, '\0'),
            Map.entry(Character.class, '\0'),
            Map.entry(boolean.class, false),
            Map.entry(Boolean.class, false),
            Map.entry(String.class, "")
    );

    private DefaultValues() {
        // Utility class; not instantiable.
    }

    /**
     * Returns the default value of {@code type}; every call on a constructible class returns a
     * new instance.
     *
     * @throws IllegalArgumentException if the type has no default value
     */
    @SuppressWarnings("unchecked")
    public static <T> T of(TypeWitness<T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        Class<?> raw = type.rawType();

        Object zero = ZEROS.get(raw);
        if (zero != null) return (T) zero;

        if (raw.isArray()) {
            return (T) Array.newInstance(raw.getComponentType(), 0);
        }

        if (raw.isEnum()) {
            Object[] constants = raw.getEnumConstants();
            if (constants.length == 0) throw noDefault(type, null);
            return (T) constants[0];
        }

        if (raw.isInterface() || Modifier.isAbstract(raw.getModifiers()) || raw == void.class) {
            throw noDefault(type, null);
        }

        try {
            return (T) raw.getConstructor().newInstance();
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            throw noDefault(type, e);
        } catch (InvocationTargetException e) {
            throw noDefault(type, e.getCause());
        }
    }

    private static IllegalArgumentException noDefault(TypeWitness<?> type, Throwable cause) {
        return new IllegalArgumentException(
                "No default value for type " + TypeIdentity.displayName(type), cause);
    }
}
