package io.github.cyfko.typetrace;

/**
 * A value that knows its own full type.
 * <p>
 * Erasure hides the type arguments of a generic value at run time;
 * {@link TypeIdentity#witnessOf(Object)} asks implementors instead of relying on
 * {@link Object#getClass()}.
 */
public interface Witnessed {

    /**
     * @return the witness of this value's concrete type, arguments included
     */
    TypeWitness<?> witness();
}
