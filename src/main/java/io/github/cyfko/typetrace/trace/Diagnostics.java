package io.github.cyfko.typetrace.trace;

import io.github.cyfko.typetrace.model.ConstructionEvent;
import io.github.cyfko.typetrace.model.DemangleUnavailable;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point through which the library emits diagnostics.
 *
 * <h2>Configuration</h2>
 * <p>
 * The global sink is chosen from the system property {@value #SINK_PROPERTY} when first
 * needed:
 * </p>
 * <ul>
 *   <li>{@code log} (default): {@link LoggingDiagnosticsSink}</li>
 *   <li>{@code none}: {@link DiagnosticsSink#NONE}</li>
 * </ul>
 * <p>
 * Any other value is logged and treated as {@code log}. {@link #install(DiagnosticsSink)}
 * replaces the sink programmatically.
 * </p>
 *
 * <p>
 * Construction events always go to the {@link TraceLog} first, whatever the sink. Other
 * diagnostics only reach the sink.
 * </p>
 */
public final class Diagnostics {

    private static final Logger log = Logger.getLogger(Diagnostics.class.getName());

    public static final String SINK_PROPERTY = "typetrace.diagnostics";

    private static volatile DiagnosticsSink SINK;

    private Diagnostics() {
        // Not instantiable
    }

    /**
     * Returns the global sink, configuring it on first use.
     */
    public static DiagnosticsSink sink() {
        if (SINK == null) {
            synchronized (Diagnostics.class) {
                if (SINK == null) {
                    SINK = configuredSink(System.getProperty(SINK_PROPERTY, "log"));
                }
            }
        }
        return SINK;
    }

    /**
     * Replaces the global sink.
     *
     * @return the sink in place before the call
     */
    public static DiagnosticsSink install(DiagnosticsSink sink) {
        Objects.requireNonNull(sink, "sink cannot be null");
        synchronized (Diagnostics.class) {
            DiagnosticsSink previous = sink();
            SINK = sink;
            return previous;
        }
    }

    static DiagnosticsSink configuredSink(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "log":
                return new LoggingDiagnosticsSink();
            case "none":
                return DiagnosticsSink.NONE;
            default:
                log.warning("Unknown value '" + value + "' for " + SINK_PROPERTY
                        + ", expected 'log' or 'none'. Falling back to 'log'.");
                return new LoggingDiagnosticsSink();
        }
    }

    /**
     * Appends {@code event} to the global trace log, then hands it to the sink.
     */
    public static void record(ConstructionEvent event) {
        Objects.requireNonNull(event, "event cannot be null");
        TraceLog.global().append(event);
        sink().onConstruction(event);
    }

    public static void report(DemangleUnavailable condition) {
        Objects.requireNonNull(condition, "condition cannot be null");
        sink().onDemangleUnavailable(condition);
    }

    public static void initializerList(String containerType) {
        Objects.requireNonNull(containerType, "containerType cannot be null");
        sink().onInitializerList(containerType);
    }
}
