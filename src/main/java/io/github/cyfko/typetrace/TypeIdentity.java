package io.github.cyfko.typetrace;

import io.github.cyfko.typetrace.model.DemangleUnavailable;
import io.github.cyfko.typetrace.providers.TypeNameProvider;
import io.github.cyfko.typetrace.trace.Diagnostics;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Global type identity service: witnesses, raw names and display names of Java types.
 *
 * <h2>Witness table</h2>
 * <p>
 * Every {@link TypeWitness} is interned in a process-wide table created when this class is
 * first used. Entries are never removed: a witness stays valid and unique for the lifetime of
 * the process, so identity comparison and map lookups on witnesses are always consistent.
 * </p>
 *
 * <h2>Raw names</h2>
 * <p>
 * {@link #rawName(TypeWitness)} returns the JVM type signature of the witness, for example
 * {@code D}, {@code [I}, {@code Ljava/lang/Double;} or
 * {@code Lio/github/cyfko/typetrace/cell/InstrumentedCell<Ljava/lang/Double;>;}.
 * It is deterministic and not meant to be read by people.
 * </p>
 *
 * <h2>Display name strategy</h2>
 * <ol>
 *   <li><b>Generated index</b>: names declared with {@link TypeName}, indexed at build time.</li>
 *   <li><b>Primitives</b>: the language keyword, e.g. {@code double}.</li>
 *   <li><b>Arrays</b>: component display name followed by {@code "[]"}.</li>
 *   <li><b>Classes</b>: canonical name without its package, e.g. {@code Outer.Inner}.</li>
 *   <li><b>Parameterized types</b>: {@code Base<Arg1, Arg2>}.</li>
 * </ol>
 * <p>
 * Local, anonymous and hidden classes have no canonical name. For them (or for a
 * parameterized type using one as an argument) the display name falls back to the raw name
 * and a {@link DemangleUnavailable} condition is reported to the
 * {@linkplain Diagnostics#sink() diagnostics sink}. The caller never sees a failure.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * <p>
 * The generated provider is loaded lazily on first display name lookup using double-checked
 * locking. When it is missing, which is expected for a build without any {@code @TypeName},
 * an informational message is logged and an empty index is used.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TypeIdentity {

    private static final Logger log = Logger.getLogger(TypeIdentity.class.getName());

    static final String GENERATED_PROVIDER = "io.github.cyfko.typetrace.providers.TypeNameProviderImpl";

    /**
     * Singleton provider instance generated at compile time.
     */
    private static volatile TypeNameProvider PROVIDER;

    private static final Map<TypeWitness<?>, TypeWitness<?>> WITNESS_TABLE = new ConcurrentHashMap<>();

    private static final Map<Class<?>, String> PRIMITIVE_SIGNATURES = Map.of(
            int.class, "I",
            long.class, "J",
            boolean.class, "Z",
            double.class, "D",
            float.class, "F",
            short.class, "S",
            byte.class, "B",
            char.class, "C",
            void.class, "V"
    );

    private TypeIdentity() {
        // Utility class; not instantiable.
    }

    /**
     * Returns the generated {@link TypeNameProvider}.
     *
     * @return the provider exposing the generated display name index
     * @throws IllegalStateException if the generated class exists but cannot be instantiated
     */
    public static TypeNameProvider getTypeNameProvider() {
        if (PROVIDER == null) {
            synchronized (TypeIdentity.class) {
                if (PROVIDER == null) {
                    PROVIDER = loadProvider();
                }
            }
        }
        return PROVIDER;
    }

    /**
     * Loads the auto-generated {@code TypeNameProviderImpl} using reflection.
     * <p>
     * If the generated class cannot be found (annotation processing disabled, or no
     * {@code @TypeName} in the build), an informational message is logged and an empty index
     * is used.
     * </p>
     */
    private static TypeNameProvider loadProvider() {
        try {
            Class<?> cls = Class.forName(GENERATED_PROVIDER);
            return (TypeNameProvider) cls.getConstructor().newInstance();

        } catch (ClassNotFoundException e) {
            log.info("""
                No generated display name index found (%s).
                Types without @TypeName use their derived names. If @TypeName is used,
                make sure annotation processing is enabled in the build.
                """.formatted(GENERATED_PROVIDER));
            return Map::of;

        } catch (InvocationTargetException | InstantiationException |
                 NoSuchMethodException | IllegalAccessException e) {
            throw new IllegalStateException("Failed to instantiate TypeNameProviderImpl", e);
        }
    }

    // ==================== Witnesses ====================

    /**
     * Returns the process-stable witness of {@code type}.
     *
     * @throws NullPointerException if {@code type} is {@code null}
     */
    @SuppressWarnings("unchecked")
    public static <T> TypeWitness<T> identify(Class<T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        return (TypeWitness<T>) intern(type, List.of());
    }

    /**
     * Returns the witness of a reflective type.
     * <p>
     * Classes and parameterized types whose arguments are themselves concrete are accepted.
     * </p>
     *
     * @throws IllegalArgumentException for type variables, wildcards and generic array types
     */
    public static TypeWitness<?> identify(Type type) {
        Objects.requireNonNull(type, "type cannot be null");

        if (type instanceof Class<?> cls) {
            return intern(cls, List.of());
        }

        if (type instanceof ParameterizedType parameterized) {
            Class<?> raw = (Class<?>) parameterized.getRawType();
            List<TypeWitness<?>> args = new ArrayList<>();
            for (Type argument : parameterized.getActualTypeArguments()) {
                args.add(identify(argument));
            }
            return intern(raw, args);
        }

        throw new IllegalArgumentException("Not a concrete type: " + type.getTypeName());
    }

    /**
     * Returns the witness of a value's concrete type.
     * <p>
     * {@link Witnessed} values report their own witness, type arguments included. Any other
     * value is identified by its runtime class.
     * </p>
     *
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static TypeWitness<?> witnessOf(Object value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value instanceof Witnessed witnessed) {
            return witnessed.witness();
        }
        return intern(value.getClass(), List.of());
    }

    static TypeWitness<?> intern(Class<?> rawType, List<TypeWitness<?>> arguments) {
        for (TypeWitness<?> argument : arguments) {
            Objects.requireNonNull(argument, "type argument cannot be null");
        }

        int expected = rawType.getTypeParameters().length;
        if (!arguments.isEmpty() && arguments.size() != expected) {
            throw new IllegalArgumentException(
                    rawType.getName() + " takes " + expected + " type argument(s), got " + arguments.size());
        }

        TypeWitness<?> candidate = new TypeWitness<>(rawType, arguments);
        TypeWitness<?> existing = WITNESS_TABLE.putIfAbsent(candidate, candidate);
        return existing != null ? existing : candidate;
    }

    // ==================== Names ====================

    /**
     * Returns the JVM type signature of {@code witness}.
     */
    public static String rawName(TypeWitness<?> witness) {
        Objects.requireNonNull(witness, "witness cannot be null");
        StringBuilder out = new StringBuilder();
        appendSignature(witness, out);
        return out.toString();
    }

    /**
     * Raw name of a value's concrete type.
     */
    public static String rawNameOf(Object value) {
        return rawName(witnessOf(value));
    }

    private static void appendSignature(TypeWitness<?> witness, StringBuilder out) {
        Class<?> raw = witness.rawType();

        String primitive = PRIMITIVE_SIGNATURES.get(raw);
        if (primitive != null) {
            out.append(primitive);
            return;
        }

        if (raw.isArray()) {
            // Class.getName() of an array is already its descriptor, with dots
            out.append(raw.getName().replace('.', '/'));
            return;
        }

        out.append('L').append(raw.getName().replace('.', '/'));
        if (witness.isParameterized()) {
            out.append('<');
            for (TypeWitness<?> argument : witness.arguments()) {
                appendSignature(argument, out);
            }
            out.append('>');
        }
        out.append(';');
    }

    /**
     * Returns the human-readable name of {@code witness}.
     * <p>
     * Never fails for a valid witness: when no readable rendering exists, the raw name is
     * returned and a {@link DemangleUnavailable} condition is reported to the diagnostics sink.
     * </p>
     */
    public static String displayName(TypeWitness<?> witness) {
        Objects.requireNonNull(witness, "witness cannot be null");

        String name = render(witness);
        if (name != null) return name;

        String raw = rawName(witness);
        Diagnostics.report(new DemangleUnavailable(raw, "type has no canonical name"));
        return raw;
    }

    /**
     * Display name of a value's concrete type.
     */
    public static String displayNameOf(Object value) {
        return displayName(witnessOf(value));
    }

    /** Returns {@code null} when any part of the type cannot be rendered. */
    private static String render(TypeWitness<?> witness) {
        Class<?> raw = witness.rawType();

        String base;
        if (raw.isArray()) {
            String component = render(identify(raw.getComponentType()));
            if (component == null) return null;
            base = component + "[]";
        } else if (raw.isPrimitive()) {
            base = raw.getName();
        } else {
            base = getTypeNameProvider().getDisplayNames().get(raw);
            if (base == null) {
                base = simpleCanonicalName(raw);
                if (base == null) return null;
            }
        }

        if (!witness.isParameterized()) {
            return base;
        }

        StringJoiner args = new StringJoiner(", ", base + "<", ">");
        for (TypeWitness<?> argument : witness.arguments()) {
            String rendered = render(argument);
            if (rendered == null) return null;
            args.add(rendered);
        }
        return args.toString();
    }

    private static String simpleCanonicalName(Class<?> type) {
        String canonical = type.getCanonicalName();
        if (canonical == null) return null;

        String pkg = type.getPackageName();
        return pkg.isEmpty() ? canonical : canonical.substring(pkg.length() + 1);
    }

    // ==================== Dispatch ====================

    /**
     * Runs the handler of {@code table} registered for exactly {@code type}, or its default.
     *
     * @param type  static witness of {@code value}
     * @param value the value handed to the selected handler
     * @param table exact-match dispatch table
     * @return the selected handler's result
     */
    public static <T, R> R staticDispatch(TypeWitness<T> type, T value, TypeSwitch<R> table) {
        Objects.requireNonNull(table, "table cannot be null");
        return table.apply(type, value);
    }
}
