package com.example.kanban.saga;

import com.example.kanban.model.Board;
import com.example.kanban.model.Tag;
import com.example.kanban.model.Task;

import java.util.List;

public record BoardCreation(Board board, List<Task> tasks, List<Tag> tags) {

    public BoardCreation {
        tasks = List.copyOf(tasks);
        tags = List.copyOf(tags);
    }
}
