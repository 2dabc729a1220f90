package com.example.kanban.model;

import java.time.Instant;

public record Tag(
    String id,
    String name,
    String color,
    String description,
    String parentTagId,
    Instant createdAt
) {
}
