package dev.flowbridge.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The nine step kinds of a flow definition.
 */
public enum Verb {
    MAP, BRANCH, LOOP, REPEAT, SEQUENCE, TRY, CATCH, INVOKE, EXIT;

    /**
     * Resolve an element tag, ignoring case. Empty when the tag is not a verb.
     */
    public static Optional<Verb> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String upper = tag.trim().toUpperCase(Locale.ROOT);
        for (Verb verb : values()) {
            if (verb.name().equals(upper)) {
                return Optional.of(verb);
            }
        }
        return Optional.empty();
    }
}
