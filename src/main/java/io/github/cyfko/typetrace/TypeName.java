package io.github.cyfko.typetrace;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the human-readable name {@link TypeIdentity#displayName(TypeWitness)} reports
 * for the annotated type.
 * <p>
 * {@code @TypeName} is read by the {@code TypeNameProcessor} annotation processor, which
 * indexes every annotated type at compile time into a generated
 * {@code TypeNameProviderImpl}. Display names of indexed types are therefore fixed by the
 * build, not derived from the class name at run time: renaming or moving the class does
 * not change the name traced for it.
 * </p>
 *
 * <h3>Validation Rules</h3>
 * <p>
 * The processor enforces the following constraints at compile time:
 * </p>
 * <ul>
 *   <li>{@code @TypeName} can only be applied to classes, enums and records.</li>
 *   <li>The name must not be blank.</li>
 *   <li>The name may contain only alphanumeric characters and {@code '.'}, {@code '_'},
 *       {@code '$'}.</li>
 *   <li>Names must be unique; a duplicate fails compilation with diagnostics on both
 *       declarations.</li>
 *   <li>The type must be reachable from generated code: local, anonymous and private
 *       types are rejected.</li>
 * </ul>
 *
 * <h3>Typical Usage</h3>
 * <pre>{@code
 * @TypeName("Point2D")
 * public record Point(double x, double y) {}
 *
 * TypeIdentity.displayName(TypeWitness.of(Point.class));    // "Point2D"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface TypeName {

    /**
     * Display name of the annotated type.
     *
     * @return the name reported for this type in traces and diagnostics
     */
    String value();
}
