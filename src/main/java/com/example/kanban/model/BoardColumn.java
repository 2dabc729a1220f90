package com.example.kanban.model;

import java.time.Instant;

/**
 * A stage of work on a board, ordered by {@code position}.
 */
public record BoardColumn(
    String id,
    String boardId,
    String name,
    int position,
    Integer wipLimit,
    Instant createdAt,
    Instant updatedAt
) {
}
