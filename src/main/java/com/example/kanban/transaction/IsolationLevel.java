package com.example.kanban.transaction;

import java.util.Optional;

/**
 * Isolation levels a transaction may request, mapped onto the directives the SQLite store
 * understands. Levels the store cannot express map to no directive at all.
 */
public enum IsolationLevel {
    /** Read uncommitted data from other transactions sharing the cache */
    READ_UNCOMMITTED("PRAGMA read_uncommitted = 1"),
    
    /** Prevent dirty reads */
    READ_COMMITTED("PRAGMA read_uncommitted = 0"),
    
    /** Not expressible in SQLite, accepted as a no-op */
    REPEATABLE_READ(null),
    
    /** SQLite transactions are already serializable for writers, accepted as a no-op */
    SERIALIZABLE(null);

    private final String directive;

    IsolationLevel(String directive) {
        this.directive = directive;
    }

    /**
     * The store directive enabling this level, empty when the store has no equivalent.
     */
    public Optional<String> directive() {
        return Optional.ofNullable(directive);
    }

    /**
     * Lenient lookup used for configuration values; blank or unknown names yield empty.
     */
    public static Optional<IsolationLevel> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase().replace(' ', '_').replace('-', '_');
        for (IsolationLevel level : values()) {
            if (level.name().equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
