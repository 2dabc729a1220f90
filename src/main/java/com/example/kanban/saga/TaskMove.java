package com.example.kanban.saga;

import com.example.kanban.model.Task;

import java.util.List;

/**
 * @param movedTask The task after the move
 * @param updatedDependencies Dependent tasks whose status changed because of the move
 */
public record TaskMove(Task movedTask, List<Task> updatedDependencies) {

    public TaskMove {
        updatedDependencies = List.copyOf(updatedDependencies);
    }
}
