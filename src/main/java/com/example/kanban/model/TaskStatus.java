package com.example.kanban.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum TaskStatus {
    TODO("todo"),
    IN_PROGRESS("in_progress"),
    DONE("done"),
    BLOCKED("blocked"),
    ARCHIVED("archived");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TaskStatus fromValue(String value) {
        for (TaskStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }

    /**
     * Status implied by a column name such as "Todo", "In Progress" or "Done".
     */
    public static Optional<TaskStatus> forColumnName(String columnName) {
        if (columnName == null) {
            return Optional.empty();
        }
        String normalized = columnName.trim().toLowerCase(Locale.ROOT).replace('-', ' ').replace('_', ' ');
        switch (normalized) {
            case "todo":
            case "to do":
            case "backlog":
                return Optional.of(TODO);
            case "in progress":
            case "doing":
                return Optional.of(IN_PROGRESS);
            case "done":
            case "completed":
                return Optional.of(DONE);
            case "blocked":
                return Optional.of(BLOCKED);
            default:
                return Optional.empty();
        }
    }
}
