package com.example.kanban.model;

import java.time.Instant;

public record Note(
    String id,
    String taskId,
    String content,
    NoteCategory category,
    boolean pinned,
    Instant createdAt,
    Instant updatedAt
) {
}
