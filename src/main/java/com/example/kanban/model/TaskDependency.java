package com.example.kanban.model;

import java.time.Instant;

/**
 * Directed link: {@code taskId} depends on {@code dependsOnTaskId}.
 */
public record TaskDependency(
    String id,
    String taskId,
    String dependsOnTaskId,
    DependencyType dependencyType,
    Instant createdAt
) {
}
