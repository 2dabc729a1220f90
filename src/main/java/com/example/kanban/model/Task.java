package com.example.kanban.model;

import java.time.Instant;

/**
 * A unit of work on a board. Subtasks point at their parent through {@code parentTaskId}.
 */
public record Task(
    String id,
    String title,
    String description,
    String boardId,
    String columnId,
    int position,
    int priority,
    TaskStatus status,
    String assignee,
    String parentTaskId,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,
    boolean archived
) {
}
