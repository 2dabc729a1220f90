package com.example.kanban.model;

/**
 * Input for creating a task.
 * 
 * @param position Position in the column, {@code null} to append after the last task
 * @param priority Priority from 0 to 10, {@code null} for 0
 * @param status Initial status, {@code null} for {@link TaskStatus#TODO}
 */
public record TaskDraft(
    String title,
    String description,
    String boardId,
    String columnId,
    Integer position,
    Integer priority,
    TaskStatus status,
    String assignee,
    String parentTaskId
) {

    public static TaskDraft titled(String title) {
        return new TaskDraft(title, null, null, null, null, null, null, null, null);
    }

    public TaskDraft placedIn(String newBoardId, String newColumnId) {
        return new TaskDraft(title, description, newBoardId, newColumnId, position, priority, status,
                             assignee, parentTaskId);
    }
}
