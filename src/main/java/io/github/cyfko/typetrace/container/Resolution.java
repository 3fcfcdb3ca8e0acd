package io.github.cyfko.typetrace.container;

import io.github.cyfko.typetrace.TypeWitness;
import io.github.cyfko.typetrace.cell.InstrumentedCell;

import java.util.Objects;

/**
 * Result of resolving a {@link ConstructionCall}: the element type and the shape that
 * drives population.
 *
 * @param elementType type of every element of the container
 * @param shape       classified call, carrying the (converted) arguments
 */
public record Resolution(
        TypeWitness<?> elementType,
        CallShape shape
) {

    public Resolution {
        Objects.requireNonNull(elementType, "elementType cannot be null");
        Objects.requireNonNull(shape, "shape cannot be null");
    }

    public Strategy strategy() {
        return shape.strategy();
    }

    /**
     * @return {@code true} if elements are {@link InstrumentedCell}s
     */
    public boolean wrapped() {
        return elementType.rawType() == InstrumentedCell.class;
    }
}
