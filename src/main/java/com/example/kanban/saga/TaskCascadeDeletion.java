package com.example.kanban.saga;

import com.example.kanban.model.Note;
import com.example.kanban.model.Task;
import com.example.kanban.model.TaskDependency;
import com.example.kanban.model.TaskTag;

import java.util.List;

/**
 * @param deletedTask The task as it was before deletion
 * @param orphanedSubtasks Former subtasks, now top-level tasks
 * @param removedDependencies Dependencies removed in either direction
 * @param deletedNotes Notes deleted with the task
 * @param detachedTags Tag links removed from the task
 */
public record TaskCascadeDeletion(
    Task deletedTask,
    List<Task> orphanedSubtasks,
    List<TaskDependency> removedDependencies,
    List<Note> deletedNotes,
    List<TaskTag> detachedTags
) {

    public TaskCascadeDeletion {
        orphanedSubtasks = List.copyOf(orphanedSubtasks);
        removedDependencies = List.copyOf(removedDependencies);
        deletedNotes = List.copyOf(deletedNotes);
        detachedTags = List.copyOf(detachedTags);
    }
}
