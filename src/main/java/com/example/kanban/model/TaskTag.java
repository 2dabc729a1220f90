package com.example.kanban.model;

import java.time.Instant;

public record TaskTag(
    String id,
    String taskId,
    String tagId,
    Instant createdAt
) {
}
