package com.example.kanban.controller;

import com.example.kanban.controller.dto.BulkCreateTasksRequest;
import com.example.kanban.controller.dto.CreateBoardRequest;
import com.example.kanban.controller.dto.MoveTaskRequest;
import com.example.kanban.model.BoardDraft;
import com.example.kanban.saga.BoardCreation;
import com.example.kanban.saga.BulkCreateOptions;
import com.example.kanban.saga.BulkTaskCreation;
import com.example.kanban.saga.ServiceTransactionCoordinator;
import com.example.kanban.saga.TaskCascadeDeletion;
import com.example.kanban.saga.TaskMove;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Composite kanban operations, each run as one compensated transaction.
 */
@RestController
@RequestMapping("/api/kanban")
public class KanbanOperationsController {

    private static final Logger logger = LoggerFactory.getLogger(KanbanOperationsController.class);

    @Autowired
    private ServiceTransactionCoordinator coordinator;

    @PostMapping("/boards")
    public ResponseEntity<?> createBoard(@RequestBody CreateBoardRequest request) {
        logger.debug("Create board request: {}", request);
        try {
            BoardCreation creation = coordinator.createBoard(
                new BoardDraft(request.getName(), request.getDescription(), request.getColor()),
                request.getTasks(), request.getTags());
            return ResponseEntity.status(HttpStatus.CREATED).body(creation);
        } catch (Exception e) {
            logger.error("Board creation failed", e);
            return ErrorResponses.from("Board creation failed", e);
        }
    }

    @PostMapping("/tasks/{taskId}/move")
    public ResponseEntity<?> moveTask(@PathVariable String taskId, @RequestBody MoveTaskRequest request) {
        logger.debug("Move task request: taskId={}, {}", taskId, request);
        try {
            if (request.getColumnId() == null || request.getColumnId().isBlank()) {
                throw new IllegalArgumentException("columnId is required");
            }
            TaskMove move = coordinator.moveTaskWithDependencies(taskId, request.getColumnId(), request.getPosition());
            return ResponseEntity.ok(move);
        } catch (Exception e) {
            logger.error("Task move failed: taskId={}", taskId, e);
            return ErrorResponses.from("Task move failed", e);
        }
    }

    @DeleteMapping("/tasks/{taskId}")
    public ResponseEntity<?> deleteTask(@PathVariable String taskId) {
        try {
            TaskCascadeDeletion deletion = coordinator.deleteTaskCascade(taskId);
            return ResponseEntity.ok(deletion);
        } catch (Exception e) {
            logger.error("Task deletion failed: taskId={}", taskId, e);
            return ErrorResponses.from("Task deletion failed", e);
        }
    }

    @PostMapping("/tasks/bulk")
    public ResponseEntity<?> bulkCreateTasks(@RequestBody BulkCreateTasksRequest request) {
        logger.debug("Bulk create request: {}", request);
        try {
            if (request.getTasks() == null || request.getTasks().isEmpty()) {
                throw new IllegalArgumentException("At least one task is required");
            }
            BulkTaskCreation creation = coordinator.bulkCreateTasks(request.getTasks(),
                new BulkCreateOptions(request.getAssignTags(), request.isCreateDependencies()));
            return ResponseEntity.status(HttpStatus.CREATED).body(creation);
        } catch (Exception e) {
            logger.error("Bulk task creation failed", e);
            return ErrorResponses.from("Bulk task creation failed", e);
        }
    }
}
