package com.omniva.dbnotifier.messaging.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Row-level events a subscription can listen to. Declaration order is the canonical
 * (alphabetical) order used when events are stored and when artifact names are derived.
 */
public enum ChangeType {
    DELETE, INSERT, UPDATE;

    /**
     * Lower-case first letter used in derived artifact names
     */
    public char initial() {
        return Character.toLowerCase(name().charAt(0));
    }

    /**
     * Parse an event token case-insensitively, ignoring surrounding whitespace
     */
    public static Optional<ChangeType> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        for (ChangeType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
