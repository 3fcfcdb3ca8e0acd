package io.github.cyfko.typetrace;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures a parameterized type through an anonymous subclass.
 *
 * <pre>{@code
 * TypeWitness<InstrumentedCell<Float>> w = new TypeCapture<InstrumentedCell<Float>>() {}.witness();
 * }</pre>
 *
 * @param <T> the captured type; must be concrete
 */
public abstract class TypeCapture<T> {

    private final TypeWitness<T> witness;

    @SuppressWarnings("unchecked")
    protected TypeCapture() {
        Type superclass = getClass().getGenericSuperclass();
        if (!(superclass instanceof ParameterizedType)) {
            throw new IllegalStateException(
                    "TypeCapture must be created as an anonymous subclass with a type argument, "
                            + "e.g. new TypeCapture<List<String>>() {}");
        }
        Type captured = ((ParameterizedType) superclass).getActualTypeArguments()[0];
        this.witness = (TypeWitness<T>) TypeIdentity.identify(captured);
    }

    public final TypeWitness<T> witness() {
        return witness;
    }
}
