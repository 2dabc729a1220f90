package com.example.kanban.model;

import java.time.Instant;

public record Board(
    String id,
    String name,
    String description,
    String color,
    Instant createdAt,
    Instant updatedAt,
    boolean archived
) {
}
