package io.github.cyfko.typetrace.container;

import io.github.cyfko.typetrace.cell.InstrumentedCell;

import java.util.List;

/**
 * Classification of a {@link ConstructionCall} by {@link ConstructionResolver}.
 * Each shape maps to one population {@link Strategy}.
 */
public sealed interface CallShape permits
    CallShape.Empty,
    CallShape.SizedDefault,
    CallShape.SizedFill,
    CallShape.ListOf,
    CallShape.ListOfCells {

    Strategy strategy();

    /** Number of elements the container will hold. */
    int size();

    /**
     * No arguments.
     */
    record Empty() implements CallShape {
        @Override
        public Strategy strategy() {
            return Strategy.EMPTY;
        }

        @Override
        public int size() {
            return 0;
        }
    }

    /**
     * A count alone: {@code size} default values of the declared type.
     */
    record SizedDefault(int size) implements CallShape {
        @Override
        public Strategy strategy() {
            return Strategy.SIZED_DEFAULT;
        }
    }

    /**
     * A count and a value, unbraced: {@code size} cells each holding {@code value}.
     */
    record SizedFill(int size, Object value) implements CallShape {
        @Override
        public Strategy strategy() {
            return Strategy.SIZED_FILL;
        }
    }

    /**
     * A braced list of values. The values are stored as they are, or value-constructed into
     * cells when the resolved element type is a cell type.
     */
    record ListOf(List<Object> values) implements CallShape {
        public ListOf {
            values = List.copyOf(values);
        }

        @Override
        public Strategy strategy() {
            return Strategy.LIST;
        }

        @Override
        public int size() {
            return values.size();
        }
    }

    /**
     * A braced list of cells sharing one value type; each is copied into the container.
     */
    record ListOfCells(List<InstrumentedCell<?>> cells) implements CallShape {
        public ListOfCells {
            cells = List.copyOf(cells);
        }

        @Override
        public Strategy strategy() {
            return Strategy.LIST_OF_CELLS;
        }

        @Override
        public int size() {
            return cells.size();
        }
    }
}
