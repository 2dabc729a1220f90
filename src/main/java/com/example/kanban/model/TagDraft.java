package com.example.kanban.model;

public record TagDraft(String name, String color, String description, String parentTagId) {

    public static TagDraft named(String name) {
        return new TagDraft(name, null, null, null);
    }
}
