package com.example.kanban.saga;

import com.example.kanban.model.Task;
import com.example.kanban.model.TaskDependency;
import com.example.kanban.model.TaskTag;

import java.util.List;

public record BulkTaskCreation(List<Task> tasks, List<TaskTag> assignedTags, List<TaskDependency> createdDependencies) {

    public BulkTaskCreation {
        tasks = List.copyOf(tasks);
        assignedTags = List.copyOf(assignedTags);
        createdDependencies = List.copyOf(createdDependencies);
    }
}
