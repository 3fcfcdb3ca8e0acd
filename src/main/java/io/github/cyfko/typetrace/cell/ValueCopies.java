package io.github.cyfko.typetrace.cell;

import io.github.cyfko.typetrace.TypeIdentity;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Objects;
import java.util.Set;

/**
 * Copies the values held by cells.
 *
 * <ol>
 *   <li><b>Known immutable types</b> (wrappers, {@link String}, enum constants): returned as is.</li>
 *   <li><b>Arrays</b>: a new array with the same elements; nested arrays are copied too.</li>
 *   <li><b>Classes with a public copy constructor</b> {@code T(T other)}: a new instance built
 *       from it.</li>
 *   <li><b>Anything else</b> is treated as an immutable value and shared.</li>
 * </ol>
 */
final class ValueCopies {

    private static final Set<Class<?>> IMMUTABLE = Set.of(
            Integer.class, Long.class, Double.class, Float.class, Short.class, Byte.class,
            Character.class, Boolean.class, String.class
    );

    private ValueCopies() {
        // Utility class; not instantiable.
    }

    /**
     * @throws IllegalStateException if the copy constructor of the value's class fails
     */
    @SuppressWarnings("unchecked")
    static <T> T copy(T value) {
        Objects.requireNonNull(value, "value cannot be null");
        Class<?> type = value.getClass();

        if (IMMUTABLE.contains(type) || value instanceof Enum) {
            return value;
        }

        if (type.isArray()) {
            return (T) copyArray(value);
        }

        Constructor<?> copyConstructor;
        try {
            copyConstructor = type.getConstructor(type);
        } catch (NoSuchMethodException e) {
            return value;
        }

        try {
            return (T) copyConstructor.newInstance(value);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Cannot copy a value of type " + TypeIdentity.displayNameOf(value), e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Copy constructor of " + TypeIdentity.displayNameOf(value)
                    + " failed", e.getCause());
        }
    }

    private static Object copyArray(Object array) {
        int length = Array.getLength(array);
        Object copy = Array.newInstance(array.getClass().getComponentType(), length);
        for (int i = 0; i < length; i++) {
            Object element = Array.get(array, i);
            Array.set(copy, i, element != null && element.getClass().isArray() ? copyArray(element) : element);
        }
        return copy;
    }
}
