package com.example.kanban.service;

import com.example.kanban.model.Board;
import com.example.kanban.model.BoardDraft;
import com.example.kanban.model.DependencyType;
import com.example.kanban.model.Note;
import com.example.kanban.model.NoteCategory;
import com.example.kanban.model.NoteDraft;
import com.example.kanban.model.Task;
import com.example.kanban.model.TaskDraft;
import com.example.kanban.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests of the domain services against the SQLite store, focused on validation and on the
 * restore operations used as compensations.
 */
@SpringBootTest
@ActiveProfiles("test")
public class KanbanServicesTest {

    @Autowired
    private JdbcTemplate jdbcTemplate;
    
    @Autowired
    private BoardService boardService;
    
    @Autowired
    private TaskService taskService;
    
    @Autowired
    private TaskDependencyService dependencyService;
    
    @Autowired
    private NoteService noteService;
    
    private Board board;
    
    @BeforeEach
    public void setUp() {
        for (String table : List.of("task_tags", "task_dependencies", "notes", "tasks", "tags", "columns", "boards")) {
            jdbcTemplate.update("DELETE FROM " + table);
        }
        board = boardService.createBoard(BoardDraft.named("Services"));
    }
    
    @Test
    public void testCreateTask_Validation() {
        assertThrows(IllegalArgumentException.class,
            () -> taskService.createTask(TaskDraft.titled(" ").placedIn(board.id(), null)));
        assertThrows(IllegalArgumentException.class, () -> taskService.createTask(
            new TaskDraft("Too important", null, board.id(), null, null, 11, null, null, null)));
        assertThrows(EntityNotFoundException.class, () -> taskService.createTask(
            new TaskDraft("Orphan", null, board.id(), null, null, null, null, null, "no-such-parent")));
    }
    
    @Test
    public void testCreateTask_AppendsToFirstColumn() {
        Task first = taskService.createTask(TaskDraft.titled("First").placedIn(board.id(), null));
        Task second = taskService.createTask(TaskDraft.titled("Second").placedIn(board.id(), null));
        
        assertEquals(boardService.getColumns(board.id()).get(0).id(), first.columnId());
        assertTrue(second.position() > first.position(), "New tasks should be appended");
        assertEquals(TaskStatus.TODO, first.status());
    }
    
    @Test
    public void testAddDependency_RejectsCycles() {
        Task a = taskService.createTask(TaskDraft.titled("A").placedIn(board.id(), null));
        Task b = taskService.createTask(TaskDraft.titled("B").placedIn(board.id(), null));
        Task c = taskService.createTask(TaskDraft.titled("C").placedIn(board.id(), null));
        
        dependencyService.addDependency(b.id(), a.id(), DependencyType.BLOCKS);
        dependencyService.addDependency(c.id(), b.id(), null);
        
        IllegalArgumentException cycle = assertThrows(IllegalArgumentException.class,
            () -> dependencyService.addDependency(a.id(), c.id(), DependencyType.BLOCKS));
        assertTrue(cycle.getMessage().contains("circular dependency"));
        assertThrows(IllegalArgumentException.class,
            () -> dependencyService.addDependency(a.id(), a.id(), DependencyType.RELATES_TO));
        
        assertEquals(DependencyType.BLOCKS, dependencyService.getDependencies(c.id()).get(0).dependencyType());
        assertEquals(1, dependencyService.getDependents(a.id()).size());
    }
    
    @Test
    public void testRestoreTask_IsIdempotent() {
        Task task = taskService.createTask(TaskDraft.titled("Restore me").placedIn(board.id(), null));
        
        taskService.restoreTask(task);
        assertTrue(taskService.deleteTask(task.id()));
        assertFalse(taskService.deleteTask(task.id()), "Deleting an absent task is a no-op");
        
        taskService.restoreTask(task);
        taskService.restoreTask(task);
        
        Task restored = taskService.getTask(task.id());
        assertEquals(task.title(), restored.title());
        assertEquals(task.columnId(), restored.columnId());
        assertEquals(task.createdAt(), restored.createdAt());
    }
    
    @Test
    public void testUpdateStatus_TracksCompletion() {
        Task task = taskService.createTask(TaskDraft.titled("Finish").placedIn(board.id(), null));
        
        Task done = taskService.updateStatus(task.id(), TaskStatus.DONE);
        assertNotNull(done.completedAt());
        
        taskService.revertTask(task);
        Task reverted = taskService.getTask(task.id());
        assertEquals(TaskStatus.TODO, reverted.status());
        assertNull(reverted.completedAt());
    }
    
    @Test
    public void testNotes_PinnedFirstAndRestorable() {
        Task task = taskService.createTask(TaskDraft.titled("Noted").placedIn(board.id(), null));
        noteService.createNote(new NoteDraft(task.id(), "Plain note", null, false));
        Note pinned = noteService.createNote(new NoteDraft(task.id(), "Decision made", NoteCategory.DECISION, true));
        
        List<Note> notes = noteService.getTaskNotes(task.id());
        assertEquals(pinned.id(), notes.get(0).id());
        assertEquals(NoteCategory.GENERAL, notes.get(1).category());
        
        List<Note> deleted = noteService.deleteTaskNotes(task.id());
        assertEquals(2, deleted.size());
        assertTrue(noteService.getTaskNotes(task.id()).isEmpty());
        
        deleted.forEach(noteService::restoreNote);
        assertEquals(2, noteService.getTaskNotes(task.id()).size());
    }
    
    @Test
    public void testDeleteBoard_RemovesEverythingOnIt() {
        taskService.createTask(TaskDraft.titled("On board").placedIn(board.id(), null));
        
        assertTrue(boardService.deleteBoard(board.id()));
        assertTrue(boardService.findBoard(board.id()).isEmpty());
        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tasks", Integer.class));
        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM columns", Integer.class));
    }
}
