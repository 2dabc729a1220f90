package com.example.kanban.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DependencyType {
    /** The dependency must be done before the dependent task can proceed */
    BLOCKS("blocks"),
    RELATES_TO("relates_to"),
    DUPLICATES("duplicates");

    private final String value;

    DependencyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DependencyType fromValue(String value) {
        for (DependencyType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown dependency type: " + value);
    }
}
