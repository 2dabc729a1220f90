package com.example.kanban.controller.dto;

import com.example.kanban.model.TagDraft;
import com.example.kanban.model.TaskDraft;

import java.util.List;

/**
 * Board to create, with optional initial tasks and tags.
 */
public class CreateBoardRequest {
    
    private String name;
    private String description;
    private String color;
    private List<TaskDraft> tasks;
    private List<TagDraft> tags;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public List<TaskDraft> getTasks() {
        return tasks;
    }

    public void setTasks(List<TaskDraft> tasks) {
        this.tasks = tasks;
    }

    public List<TagDraft> getTags() {
        return tags;
    }

    public void setTags(List<TagDraft> tags) {
        this.tags = tags;
    }

    @Override
    public String toString() {
        return "CreateBoardRequest{" +
                "name='" + name + '\'' +
                ", tasks=" + (tasks != null ? tasks.size() : 0) + " items" +
                ", tags=" + (tags != null ? tags.size() : 0) + " items" +
                '}';
    }
}
