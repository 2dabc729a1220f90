package com.example.kanban.controller.dto;

import com.example.kanban.model.TaskDraft;

import java.util.List;

public class BulkCreateTasksRequest {
    
    private List<TaskDraft> tasks;
    private List<String> assignTags;
    private boolean createDependencies;

    public List<TaskDraft> getTasks() {
        return tasks;
    }

    public void setTasks(List<TaskDraft> tasks) {
        this.tasks = tasks;
    }

    /**
     * @return ids of existing tags to link to every created task
     */
    public List<String> getAssignTags() {
        return assignTags;
    }

    public void setAssignTags(List<String> assignTags) {
        this.assignTags = assignTags;
    }

    public boolean isCreateDependencies() {
        return createDependencies;
    }

    public void setCreateDependencies(boolean createDependencies) {
        this.createDependencies = createDependencies;
    }

    @Override
    public String toString() {
        return "BulkCreateTasksRequest{" +
                "tasks=" + (tasks != null ? tasks.size() : 0) + " items" +
                ", assignTags=" + assignTags +
                ", createDependencies=" + createDependencies +
                '}';
    }
}
