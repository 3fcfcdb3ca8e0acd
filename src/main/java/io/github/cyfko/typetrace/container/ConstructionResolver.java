package io.github.cyfko.typetrace.container;

import io.github.cyfko.typetrace.TypeIdentity;
import io.github.cyfko.typetrace.TypeWitness;
import io.github.cyfko.typetrace.cell.InstrumentedCell;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides the element type and population strategy of a {@link DynamicArray} from the shape of
 * its construction call.
 *
 * <p>
 * Resolution is a pure function of the {@link ConstructionCall}: a successful resolution creates
 * no cells and emits no diagnostics. Decisions are logged at {@code FINER} with raw type names.
 * Rules are tried in order and the first match wins:
 * </p>
 * <ol>
 *   <li><b>Braced list of typed values</b>: with a declared element type every value must be of
 *       that type; without one, values that are all cells of one value type give
 *       {@link Strategy#LIST_OF_CELLS}. No wrapping is introduced.</li>
 *   <li><b>Braced list of bare values</b>: values all of one class give {@link Strategy#LIST} of
 *       that class. A pair made of an integral value followed by a value of another type is
 *       deduced as a list of {@code InstrumentedCell<type of the second>}: both values are
 *       widened to that type and wrapped. This is still a braced list of two elements, never a
 *       sized fill.</li>
 *   <li><b>{@code (count, value)}</b>, unbraced: {@link Strategy#SIZED_FILL} of
 *       {@code InstrumentedCell<type of value>}.</li>
 *   <li><b>{@code (count)}</b> with a declared element type: {@link Strategy#SIZED_DEFAULT}.</li>
 *   <li><b>No arguments</b>: {@link Strategy#EMPTY}.</li>
 * </ol>
 * <p>
 * Calls matching no rule are rejected with {@link AmbiguousCallShapeException}.
 * </p>
 */
public final class ConstructionResolver {

    private static final Logger log = Logger.getLogger(ConstructionResolver.class.getName());

    /** Largest element count a container can be asked for. */
    public static final int MAX_SIZE = Integer.MAX_VALUE - 8;

    private static final Set<Class<?>> INTEGRAL = Set.of(
            Byte.class, Short.class, Integer.class, Long.class
    );

    private static final Map<Class<?>, Set<Class<?>>> WIDENING = Map.of(
            Byte.class, Set.of(Short.class, Integer.class, Long.class, Float.class, Double.class),
            Short.class, Set.of(Integer.class, Long.class, Float.class, Double.class),
            Integer.class, Set.of(Long.class, Float.class, Double.class),
            Long.class, Set.of(Float.class, Double.class)
    );

    private ConstructionResolver() {
        // Utility class; not instantiable.
    }

    /**
     * Resolves {@code call}.
     *
     * @throws AmbiguousCallShapeException if no rule matches
     * @throws IllegalArgumentException    if a count is negative or above {@link #MAX_SIZE}
     */
    public static Resolution resolve(ConstructionCall call) {
        Objects.requireNonNull(call, "call cannot be null");

        Resolution resolution = classify(call);
        if (log.isLoggable(Level.FINER)) {
            log.finer("Resolved " + call.form() + " call with " + call.arguments().size()
                    + " argument(s) to " + resolution.strategy()
                    + " of " + resolution.elementType());
        }
        return resolution;
    }

    private static Resolution classify(ConstructionCall call) {
        List<Object> args = call.arguments();

        // 1, 2. A braced list wins over every other reading of the same arguments
        if (call.form() == ConstructionCall.Form.BRACED && !args.isEmpty()) {
            return call.declaredType() != null ? resolveDeclaredList(call) : resolveDeducedList(call);
        }

        if (call.form() == ConstructionCall.Form.PARENTHESIZED) {
            // 3. (count, value)
            if (args.size() == 2) return resolveSizedFill(call);
            // 4. (count)
            if (args.size() == 1) return resolveSizedDefault(call);
        }

        // 5. ()
        if (args.isEmpty()) {
            TypeWitness<?> type = call.declared().orElse(TypeWitness.of(Object.class));
            return new Resolution(type, new CallShape.Empty());
        }

        throw new AmbiguousCallShapeException(call, "No construction takes " + args.size() + " arguments");
    }

    private static Resolution resolveDeclaredList(ConstructionCall call) {
        TypeWitness<?> declared = call.declaredType();

        for (Object value : call.arguments()) {
            if (TypeIdentity.witnessOf(value) != declared) {
                throw new AmbiguousCallShapeException(call, "Value " + value + " is not a "
                        + TypeIdentity.displayName(declared));
            }
        }

        return isCellType(declared)
                ? new Resolution(declared, new CallShape.ListOfCells(cells(call.arguments())))
                : new Resolution(declared, new CallShape.ListOf(call.arguments()));
    }

    private static Resolution resolveDeducedList(ConstructionCall call) {
        List<Object> values = call.arguments();
        TypeWitness<?> first = TypeIdentity.witnessOf(values.get(0));

        boolean uniform = true;
        for (Object value : values) {
            if (TypeIdentity.witnessOf(value) != first) {
                uniform = false;
                break;
            }
        }

        if (uniform) {
            return isCellType(first)
                    ? new Resolution(first, new CallShape.ListOfCells(cells(values)))
                    : new Resolution(first, new CallShape.ListOf(values));
        }

        if (values.size() == 2 && INTEGRAL.contains(values.get(0).getClass())) {
            Object leading = values.get(0);
            Object value = values.get(1);
            Class<?> target = value.getClass();

            Object widened = widen((Number) leading, target);
            if (widened == null) {
                throw new AmbiguousCallShapeException(call, "Cannot convert " + leading + " to "
                        + TypeIdentity.displayNameOf(value));
            }

            TypeWitness<?> elementType = InstrumentedCell.witnessFor(TypeIdentity.identify(target));
            return new Resolution(elementType, new CallShape.ListOf(List.of(widened, value)));
        }

        throw new AmbiguousCallShapeException(call, "Braced list mixes element types");
    }

    private static Resolution resolveSizedFill(ConstructionCall call) {
        int size = count(call, call.arguments().get(0));
        Object value = call.arguments().get(1);
        TypeWitness<?> elementType = InstrumentedCell.witnessFor(TypeIdentity.witnessOf(value));

        if (call.declaredType() != null && call.declaredType() != elementType) {
            throw new AmbiguousCallShapeException(call, "Declared type "
                    + TypeIdentity.displayName(call.declaredType()) + " conflicts with deduced "
                    + TypeIdentity.displayName(elementType));
        }

        return new Resolution(elementType, new CallShape.SizedFill(size, value));
    }

    private static Resolution resolveSizedDefault(ConstructionCall call) {
        int size = count(call, call.arguments().get(0));

        if (call.declaredType() == null) {
            throw new AmbiguousCallShapeException(call, "Element type cannot be deduced from a count alone");
        }

        return new Resolution(call.declaredType(), new CallShape.SizedDefault(size));
    }

    private static int count(ConstructionCall call, Object argument) {
        if (!INTEGRAL.contains(argument.getClass())) {
            throw new AmbiguousCallShapeException(call, "Expected an integral count, got " + argument);
        }

        long size = ((Number) argument).longValue();
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        if (size > MAX_SIZE) {
            throw new IllegalArgumentException("size " + size + " exceeds the maximum of " + MAX_SIZE);
        }
        return (int) size;
    }

    /** Widening primitive conversion of {@code n} to {@code target}, or {@code null}. */
    private static Object widen(Number n, Class<?> target) {
        if (!WIDENING.getOrDefault(n.getClass(), Set.of()).contains(target)) {
            return null;
        }

        if (target == Short.class) return n.shortValue();
        if (target == Integer.class) return n.intValue();
        if (target == Long.class) return n.longValue();
        if (target == Float.class) return n.floatValue();
        return n.doubleValue();
    }

    private static boolean isCellType(TypeWitness<?> type) {
        return type.rawType() == InstrumentedCell.class;
    }

    private static List<InstrumentedCell<?>> cells(List<Object> values) {
        List<InstrumentedCell<?>> cells = new ArrayList<>(values.size());
        for (Object value : values) {
            cells.add((InstrumentedCell<?>) value);
        }
        return cells;
    }
}
