package io.github.cyfko.typetrace.container;

/**
 * Thrown when a {@link ConstructionCall} matches none of the construction rules.
 * <p>
 * The typed factories of {@link DynamicArray} cannot produce such calls; only the untyped
 * {@link DynamicArray#braced(Object...)} and {@link DynamicArray#construct(ConstructionCall)}
 * entry points can.
 */
public class AmbiguousCallShapeException extends IllegalArgumentException {

    private final transient ConstructionCall call;

    public AmbiguousCallShapeException(ConstructionCall call, String message) {
        super(message + " [" + call.form() + " call with " + call.arguments() + "]");
        this.call = call;
    }

    public ConstructionCall getCall() {
        return call;
    }
}
