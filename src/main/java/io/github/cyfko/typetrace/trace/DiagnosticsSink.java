package io.github.cyfko.typetrace.trace;

import io.github.cyfko.typetrace.model.ConstructionEvent;
import io.github.cyfko.typetrace.model.DemangleUnavailable;

/**
 * Receives the structured diagnostics of the library.
 * <p>
 * Formatting and display are up to the implementation; the library only hands events over.
 */
public interface DiagnosticsSink {

    /** Sink that drops everything. */
    DiagnosticsSink NONE = new DiagnosticsSink() {
        @Override
        public void onConstruction(ConstructionEvent event) {
        }

        @Override
        public void onDemangleUnavailable(DemangleUnavailable condition) {
        }

        @Override
        public void onInitializerList(String containerType) {
        }
    };

    void onConstruction(ConstructionEvent event);

    void onDemangleUnavailable(DemangleUnavailable condition);

    /**
     * A container was populated from a braced list.
     *
     * @param containerType display name of the container, e.g. {@code DynamicArray<Double>}
     */
    void onInitializerList(String containerType);
}
