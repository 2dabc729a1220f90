package com.example.kanban.model;

public record NoteDraft(String taskId, String content, NoteCategory category, boolean pinned) {
}
