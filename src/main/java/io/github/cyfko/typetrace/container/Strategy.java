package io.github.cyfko.typetrace.container;

/**
 * How a {@link DynamicArray} populates its storage.
 */
public enum Strategy {
    EMPTY,
    SIZED_DEFAULT,
    SIZED_FILL,
    LIST,
    LIST_OF_CELLS
}
