package io.github.cyfko.typetrace.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of one instrumented cell construction.
 *
 * <p>
 * Exactly one event is created per cell construction and appended to the
 * {@link io.github.cyfko.typetrace.trace.TraceLog}; events are never mutated or removed.
 * </p>
 *
 * @param kind     which constructor ran
 * @param typeName display name of the type held by the cell, e.g. {@code "Double"}
 * @param payload  string form of the held value (arrays element by element) for value and
 *                 copy constructions; {@code null} for default constructions
 */
public record ConstructionEvent(
        Kind kind,
        String typeName,
        String payload
) {

    public enum Kind {
        DEFAULT,
        VALUE_INIT,
        COPY
    }

    public ConstructionEvent {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(typeName, "typeName cannot be null");
        if (kind == Kind.DEFAULT && payload != null) {
            throw new IllegalArgumentException("Default construction carries no payload");
        }
    }

    public static ConstructionEvent defaulted(String typeName) {
        return new ConstructionEvent(Kind.DEFAULT, typeName, null);
    }

    public static ConstructionEvent valueInit(String typeName, Object value) {
        return new ConstructionEvent(Kind.VALUE_INIT, typeName, render(value));
    }

    public static ConstructionEvent copy(String typeName, Object value) {
        return new ConstructionEvent(Kind.COPY, typeName, render(value));
    }

    private static String render(Object value) {
        String rendered = Arrays.deepToString(new Object[]{value});
        return rendered.substring(1, rendered.length() - 1);
    }

    public Optional<String> payloadValue() {
        return Optional.ofNullable(payload);
    }
}
