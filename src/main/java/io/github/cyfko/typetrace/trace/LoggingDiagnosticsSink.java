package io.github.cyfko.typetrace.trace;

import io.github.cyfko.typetrace.model.ConstructionEvent;
import io.github.cyfko.typetrace.model.DemangleUnavailable;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default sink: writes diagnostics to {@code java.util.logging}.
 * <p>
 * Constructions and braced list initializations are logged at {@link Level#FINE}, unavailable
 * display names at {@link Level#WARNING}.
 */
public final class LoggingDiagnosticsSink implements DiagnosticsSink {

    private static final Logger log = Logger.getLogger(LoggingDiagnosticsSink.class.getName());

    @Override
    public void onConstruction(ConstructionEvent event) {
        if (!log.isLoggable(Level.FINE)) return;

        String cell = "InstrumentedCell<" + event.typeName() + ">";
        switch (event.kind()) {
            case DEFAULT -> log.fine("Default constructor of " + cell);
            case VALUE_INIT -> log.fine("Parameterized constructor of " + cell + " with value " + event.payload());
            case COPY -> log.fine("Copy constructor of " + cell + " with value " + event.payload());
        }
    }

    @Override
    public void onDemangleUnavailable(DemangleUnavailable condition) {
        log.warning("No display name for " + condition.rawName() + " (" + condition.reason()
                + "), using the raw name");
    }

    @Override
    public void onInitializerList(String containerType) {
        log.fine("Used initializer list in " + containerType);
    }
}
