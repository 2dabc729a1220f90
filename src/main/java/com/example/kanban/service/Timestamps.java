package com.example.kanban.service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Timestamps are stored as ISO-8601 text with millisecond precision.
 */
final class Timestamps {

    private Timestamps() {
    }

    static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    static String toDb(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    static Instant fromDb(String value) {
        return value != null ? Instant.parse(value) : null;
    }
}
