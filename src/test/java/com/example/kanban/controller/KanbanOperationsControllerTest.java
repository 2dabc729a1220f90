package com.example.kanban.controller;

import com.example.kanban.model.Board;
import com.example.kanban.model.BoardDraft;
import com.example.kanban.model.Task;
import com.example.kanban.model.TaskStatus;
import com.example.kanban.saga.BoardCreation;
import com.example.kanban.saga.BulkCreateOptions;
import com.example.kanban.saga.BulkTaskCreation;
import com.example.kanban.saga.ServiceTransactionCoordinator;
import com.example.kanban.saga.TaskMove;
import com.example.kanban.service.EntityNotFoundException;
import com.example.kanban.transaction.TransactionFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class KanbanOperationsControllerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private ServiceTransactionCoordinator coordinator;
    
    @InjectMocks
    private KanbanOperationsController controller;
    
    private MockMvc mockMvc;
    
    @BeforeEach
    public void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }
    
    @Test
    public void testCreateBoard() throws Exception {
        Board board = new Board("board-1", "Sprint 1", null, "#2196F3", NOW, NOW, false);
        when(coordinator.createBoard(any(BoardDraft.class), anyList(), anyList()))
            .thenReturn(new BoardCreation(board, List.of(task("task-1", TaskStatus.TODO)), List.of()));
        
        mockMvc.perform(post("/api/kanban/boards")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Sprint 1\",\"tasks\":[{\"title\":\"T1\"}],\"tags\":[]}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.board.id").value("board-1"))
            .andExpect(jsonPath("$.tasks[0].status").value("todo"));
        
        ArgumentCaptor<BoardDraft> draft = ArgumentCaptor.forClass(BoardDraft.class);
        verify(coordinator).createBoard(draft.capture(), anyList(), anyList());
        assertEquals("Sprint 1", draft.getValue().name());
    }
    
    @Test
    public void testCreateBoard_FailureReportsTransaction() throws Exception {
        TransactionFailureException failure = new TransactionFailureException("tx-1", List.of(),
            new IllegalArgumentException("Board name is required"));
        when(coordinator.createBoard(any(BoardDraft.class), any(), any())).thenThrow(failure);
        
        mockMvc.perform(post("/api/kanban/boards")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Board creation failed"))
            .andExpect(jsonPath("$.message").value("Board name is required"))
            .andExpect(jsonPath("$.transactionId").value("tx-1"))
            .andExpect(jsonPath("$.timeout").value(false));
    }
    
    @Test
    public void testMoveTask() throws Exception {
        when(coordinator.moveTaskWithDependencies("task-1", "col-2", 3))
            .thenReturn(new TaskMove(task("task-1", TaskStatus.IN_PROGRESS), List.of()));
        
        mockMvc.perform(post("/api/kanban/tasks/task-1/move")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"columnId\":\"col-2\",\"position\":3}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.movedTask.status").value("in_progress"));
    }
    
    @Test
    public void testMoveTask_MissingColumn() throws Exception {
        mockMvc.perform(post("/api/kanban/tasks/task-1/move")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("columnId is required"));
        
        verifyNoInteractions(coordinator);
    }
    
    @Test
    public void testDeleteTask_NotFound() throws Exception {
        when(coordinator.deleteTaskCascade("missing")).thenThrow(new TransactionFailureException("tx-2", List.of(),
            new EntityNotFoundException("Task", "missing")));
        
        mockMvc.perform(delete("/api/kanban/tasks/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Task not found: missing"));
    }
    
    @Test
    public void testBulkCreateTasks() throws Exception {
        when(coordinator.bulkCreateTasks(anyList(), any(BulkCreateOptions.class)))
            .thenReturn(new BulkTaskCreation(List.of(task("task-1", TaskStatus.TODO)), List.of(), List.of()));
        
        mockMvc.perform(post("/api/kanban/tasks/bulk")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tasks\":[{\"title\":\"A\",\"boardId\":\"board-1\"}],\"assignTags\":[\"tag-1\"],"
                         + "\"createDependencies\":true}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.tasks[0].id").value("task-1"));
        
        ArgumentCaptor<BulkCreateOptions> options = ArgumentCaptor.forClass(BulkCreateOptions.class);
        verify(coordinator).bulkCreateTasks(anyList(), options.capture());
        assertEquals(List.of("tag-1"), options.getValue().assignTags());
        assertTrue(options.getValue().createDependencies());
    }
    
    @Test
    public void testBulkCreateTasks_Empty() throws Exception {
        mockMvc.perform(post("/api/kanban/tasks/bulk")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tasks\":[]}"))
            .andExpect(status().isBadRequest());
        
        verifyNoInteractions(coordinator);
    }
    
    private static Task task(String id, TaskStatus status) {
        return new Task(id, "Task " + id, null, "board-1", "col-1", 0, 0, status, null, null, NOW, NOW, null, false);
    }
}
