package com.example.kanban.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NoteCategory {
    GENERAL("general"),
    PROGRESS("progress"),
    BLOCKER("blocker"),
    DECISION("decision"),
    QUESTION("question");

    private final String value;

    NoteCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static NoteCategory fromValue(String value) {
        for (NoteCategory category : values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown note category: " + value);
    }
}
