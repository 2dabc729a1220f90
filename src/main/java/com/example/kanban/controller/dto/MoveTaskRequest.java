package com.example.kanban.controller.dto;

public class MoveTaskRequest {
    
    private String columnId;
    private Integer position; // null = append

    public String getColumnId() {
        return columnId;
    }

    public void setColumnId(String columnId) {
        this.columnId = columnId;
    }

    public Integer getPosition() {
        return position;
    }

    public void setPosition(Integer position) {
        this.position = position;
    }

    @Override
    public String toString() {
        return "MoveTaskRequest{columnId='" + columnId + "', position=" + position + '}';
    }
}
