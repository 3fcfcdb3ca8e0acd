package io.github.cyfko.typetrace.container;

import io.github.cyfko.typetrace.TypeIdentity;
import io.github.cyfko.typetrace.TypeWitness;
import io.github.cyfko.typetrace.cell.DefaultValues;
import io.github.cyfko.typetrace.cell.InstrumentedCell;
import io.github.cyfko.typetrace.trace.Diagnostics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, index-accessible sequence whose element type is resolved from the shape of its
 * construction call.
 *
 * <h2>Construction</h2>
 * <p>
 * Every factory builds a {@link ConstructionCall}, resolves it with
 * {@link ConstructionResolver} and populates the storage according to the resolved
 * {@link Strategy}:
 * </p>
 * <ul>
 *   <li>{@link #empty()}: no elements.</li>
 *   <li>{@link #ofSize(int, Class)}: {@code size} default values, no cells, no trace.</li>
 *   <li>{@link #filled(int, Object)}: {@code size} cells holding the value. Each element is a
 *       temporary cell copied into storage, so the trace shows a value construction then a
 *       copy per element.</li>
 *   <li>{@link #listOf(Class, Object[])}: the given values, no cells, no trace.</li>
 *   <li>{@link #cellsOf(InstrumentedCell, InstrumentedCell[])}: a copy of each given cell.</li>
 *   <li>{@link #braced(Object...)}: a braced list whose element type is deduced. A pair
 *       {@code (10, 1.3)} yields two {@code InstrumentedCell<Double>} built in place.</li>
 * </ul>
 * <p>
 * Populating from a braced list (any {@link Strategy#LIST} or {@link Strategy#LIST_OF_CELLS})
 * also reports {@link Diagnostics#initializerList(String)} once the elements are stored. The
 * marker reaches the diagnostics sink only, never the trace log.
 * </p>
 * <p>
 * The typed factories cannot express an ambiguous call; only {@link #braced(Object...)} and
 * {@link #construct(ConstructionCall)} may throw {@link AmbiguousCallShapeException}.
 * </p>
 *
 * <pre>{@code
 * DynamicArray<InstrumentedCell<Double>> cells = DynamicArray.filled(5, 1.3);
 * DynamicArray<?> pair = DynamicArray.braced(10, 1.3);          // 2 cells, not 10
 * DynamicArray<InstrumentedCell<Double>> typed =
 *         pair.as(InstrumentedCell.witnessFor(TypeWitness.of(Double.class)));
 * }</pre>
 *
 * <p>
 * Containers are immutable once built: {@link #getElements()} is a read-only view.
 * </p>
 *
 * @param <E> element type: a plain value type or {@code InstrumentedCell<T>}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DynamicArray<E> implements Iterable<E> {

    private final Resolution resolution;
    private final List<E> elements;

    private DynamicArray(Resolution resolution) {
        this.resolution = resolution;
        this.elements = populate(resolution);
    }

    // ==================== Factories ====================

    public static <E> DynamicArray<E> empty() {
        return create(ConstructionCall.none());
    }

    /**
     * {@code size} default values of {@code type}.
     *
     * @throws IllegalArgumentException if {@code size} is negative or the type has no default
     * @see DefaultValues
     */
    public static <T> DynamicArray<T> ofSize(int size, Class<T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        return create(ConstructionCall.parenthesized(TypeWitness.of(type), size));
    }

    /**
     * {@code size} cells holding {@code value}; the element type is deduced as
     * {@code InstrumentedCell<T>}.
     *
     * @throws IllegalArgumentException if {@code size} is negative
     */
    public static <T> DynamicArray<InstrumentedCell<T>> filled(int size, T value) {
        Objects.requireNonNull(value, "value cannot be null");
        return create(ConstructionCall.parenthesized(size, value));
    }

    /**
     * The given values, each exactly of {@code type}.
     *
     * @throws IllegalArgumentException if a value's class is not exactly {@code type}
     */
    @SafeVarargs
    public static <T> DynamicArray<T> listOf(Class<T> type, T... values) {
        Objects.requireNonNull(type, "type cannot be null");
        return create(ConstructionCall.braced(TypeWitness.of(type), (Object[]) values));
    }

    /**
     * Copies of the given cells.
     *
     * @throws IllegalArgumentException if the cells do not share one value type
     */
    @SafeVarargs
    public static <T> DynamicArray<InstrumentedCell<T>> cellsOf(InstrumentedCell<T> first,
                                                               InstrumentedCell<T>... rest) {
        Objects.requireNonNull(first, "first cannot be null");
        Object[] cells = new Object[rest.length + 1];
        cells[0] = first;
        System.arraycopy(rest, 0, cells, 1, rest.length);
        return create(ConstructionCall.braced(first.witness(), cells));
    }

    /**
     * A braced list whose element type is deduced from the values.
     *
     * @throws AmbiguousCallShapeException if no element type can be deduced
     */
    public static DynamicArray<?> braced(Object... values) {
        return construct(ConstructionCall.braced(values));
    }

    /**
     * Builds a container from an arbitrary call.
     *
     * @throws AmbiguousCallShapeException if the call matches no construction
     */
    public static DynamicArray<?> construct(ConstructionCall call) {
        return create(call);
    }

    private static <E> DynamicArray<E> create(ConstructionCall call) {
        return new DynamicArray<>(ConstructionResolver.resolve(call));
    }

    // ==================== Population ====================

    @SuppressWarnings("unchecked")
    private static <E> List<E> populate(Resolution resolution) {
        CallShape shape = resolution.shape();
        List<Object> storage = new ArrayList<>(shape.size());

        if (shape instanceof CallShape.SizedDefault) {
            for (int i = 0; i < shape.size(); i++) {
                storage.add(DefaultValues.of(resolution.elementType()));
            }

        } else if (shape instanceof CallShape.SizedFill fill) {
            TypeWitness<?> valueType = resolution.elementType().argument(0);
            for (int i = 0; i < fill.size(); i++) {
                storage.add(InstrumentedCell.copyOf(valueCell(valueType, fill.value())));
            }

        } else if (shape instanceof CallShape.ListOf list) {
            if (resolution.wrapped()) {
                TypeWitness<?> valueType = resolution.elementType().argument(0);
                for (Object value : list.values()) {
                    storage.add(valueCell(valueType, value));
                }
            } else {
                storage.addAll(list.values());
            }
            Diagnostics.initializerList(containerName(resolution));

        } else if (shape instanceof CallShape.ListOfCells list) {
            for (InstrumentedCell<?> cell : list.cells()) {
                storage.add(InstrumentedCell.copyOf(cell));
            }
            Diagnostics.initializerList(containerName(resolution));
        }

        return (List<E>) Collections.unmodifiableList(storage);
    }

    /** Value construction of a cell; {@link InstrumentedCell#of(TypeWitness, Object)} checks the type. */
    @SuppressWarnings("unchecked")
    private static <T> InstrumentedCell<T> valueCell(TypeWitness<T> valueType, Object value) {
        return InstrumentedCell.of(valueType, (T) value);
    }

    private static String containerName(Resolution resolution) {
        return "DynamicArray<" + TypeIdentity.displayName(resolution.elementType()) + ">";
    }

    // ==================== Access ====================

    /**
     * @return a read-only view of the elements, in order
     */
    public List<E> getElements() {
        return elements;
    }

    public E get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public TypeWitness<?> elementType() {
        return resolution.elementType();
    }

    public Strategy strategy() {
        return resolution.strategy();
    }

    public Resolution resolution() {
        return resolution;
    }

    /**
     * Narrows this container to a statically known element type.
     *
     * @throws IllegalArgumentException if {@code type} is not exactly the element type
     */
    @SuppressWarnings("unchecked")
    public <X> DynamicArray<X> as(TypeWitness<X> type) {
        Objects.requireNonNull(type, "type cannot be null");
        if (type != resolution.elementType()) {
            throw new IllegalArgumentException("Element type mismatch. Expected: "
                    + TypeIdentity.displayName(type) + ", found: "
                    + TypeIdentity.displayName(resolution.elementType()));
        }
        return (DynamicArray<X>) this;
    }

    public <X> DynamicArray<X> as(Class<X> type) {
        return as(TypeWitness.of(type));
    }

    @Override
    public Iterator<E> iterator() {
        return elements.iterator();
    }

    @Override
    public String toString() {
        return containerName(resolution) + Arrays.toString(elements.toArray());
    }
}
