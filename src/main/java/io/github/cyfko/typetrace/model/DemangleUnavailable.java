package io.github.cyfko.typetrace.model;

/**
 * Non-fatal condition: a type could not be rendered as a readable name and its raw name was
 * used instead.
 *
 * @param rawName the raw name returned to the caller in place of a display name
 * @param reason  why no readable name was available
 */
public record DemangleUnavailable(
        String rawName,
        String reason
) {}
