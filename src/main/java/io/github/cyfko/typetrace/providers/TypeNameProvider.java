package io.github.cyfko.typetrace.providers;

import java.util.Map;

/**
 * Provides access to the generated index of display names declared with
 * {@link io.github.cyfko.typetrace.TypeName}.
 * <p>
 * This interface is implemented automatically by the annotation processor,
 * generating a deterministic and immutable index.
 */
public interface TypeNameProvider {

    /**
     * Returns an immutable map of Java classes to their declared display names.
     *
     * @return unmodifiable index mapping classes to display names
     */
    Map<Class<?>, String> getDisplayNames();
}
