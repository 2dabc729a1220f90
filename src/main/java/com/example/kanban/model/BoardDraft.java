package com.example.kanban.model;

/**
 * Input for creating a board; {@code color} falls back to the default board color.
 */
public record BoardDraft(String name, String description, String color) {

    public static BoardDraft named(String name) {
        return new BoardDraft(name, null, null);
    }
}
