package com.example.kanban.integration;

import com.example.kanban.model.BoardColumn;
import com.example.kanban.model.BoardDraft;
import com.example.kanban.model.DependencyType;
import com.example.kanban.model.NoteCategory;
import com.example.kanban.model.NoteDraft;
import com.example.kanban.model.Tag;
import com.example.kanban.model.TagDraft;
import com.example.kanban.model.Task;
import com.example.kanban.model.TaskDraft;
import com.example.kanban.model.TaskStatus;
import com.example.kanban.saga.BoardCreation;
import com.example.kanban.saga.BulkCreateOptions;
import com.example.kanban.saga.BulkTaskCreation;
import com.example.kanban.saga.ServiceTransactionCoordinator;
import com.example.kanban.saga.TaskCascadeDeletion;
import com.example.kanban.saga.TaskMove;
import com.example.kanban.service.BoardService;
import com.example.kanban.service.NoteService;
import com.example.kanban.service.TagService;
import com.example.kanban.service.TaskDependencyService;
import com.example.kanban.service.TaskService;
import com.example.kanban.transaction.KanbanTransactionManager;
import com.example.kanban.transaction.TransactionFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the compensated kanban operations against the SQLite store.
 * 
 * Each scenario checks both the returned result and what is left in the store afterwards,
 * since a failed operation must leave no partial state behind.
 */
@SpringBootTest
@ActiveProfiles("test")
public class KanbanSagaIntegrationTest {

    private static final List<String> TABLES_CHILD_FIRST =
        List.of("task_tags", "task_dependencies", "notes", "tasks", "tags", "columns", "boards");

    @Autowired
    private JdbcTemplate jdbcTemplate;
    
    @Autowired
    private ServiceTransactionCoordinator coordinator;
    
    @Autowired
    private KanbanTransactionManager transactionManager;
    
    @Autowired
    private BoardService boardService;
    
    @Autowired
    private TaskService taskService;
    
    @Autowired
    private TagService tagService;
    
    @Autowired
    private TaskDependencyService dependencyService;
    
    @Autowired
    private NoteService noteService;
    
    @BeforeEach
    public void cleanStore() {
        for (String table : TABLES_CHILD_FIRST) {
            jdbcTemplate.update("DELETE FROM " + table);
        }
    }
    
    @Test
    public void testCreateBoard_WithTasksAndTags() {
        BoardCreation creation = coordinator.createBoard(BoardDraft.named("Sprint 1"),
            List.of(TaskDraft.titled("T1"), TaskDraft.titled("T2")), List.of(TagDraft.named("urgent")));
        
        List<BoardColumn> columns = boardService.getColumns(creation.board().id());
        assertEquals(BoardService.DEFAULT_COLUMNS, columns.stream().map(BoardColumn::name).toList());
        
        assertEquals(2, creation.tasks().size());
        for (Task task : creation.tasks()) {
            assertEquals(columns.get(0).id(), task.columnId(), "Initial tasks should land in the first column");
            assertEquals(TaskStatus.TODO, task.status());
        }
        assertEquals("urgent", creation.tags().get(0).name());
        
        assertEquals(1, count("boards"));
        assertEquals(2, count("tasks"));
        assertEquals(1, count("tags"));
        assertEquals(0, transactionManager.getActiveTransactionCount());
    }
    
    @Test
    public void testCreateBoard_DuplicateTagLeavesNoTrace() {
        tagService.createTag(TagDraft.named("urgent"));
        
        TransactionFailureException exception = assertThrows(TransactionFailureException.class,
            () -> coordinator.createBoard(BoardDraft.named("Sprint 2"),
                List.of(TaskDraft.titled("T1")), List.of(TagDraft.named("urgent"))));
        
        assertFalse(exception.isTimeout());
        assertEquals(0, count("boards"), "The board should be gone after the failure");
        assertEquals(0, count("columns"));
        assertEquals(0, count("tasks"));
        assertEquals(1, count("tags"), "The pre-existing tag should be untouched");
    }
    
    @Test
    public void testDeleteTaskCascade() {
        BoardCreation board = coordinator.createBoard(BoardDraft.named("Cascade"),
            List.of(TaskDraft.titled("Parent"), TaskDraft.titled("Other")), List.of(TagDraft.named("backend")));
        Task parent = board.tasks().get(0);
        Task other = board.tasks().get(1);
        Tag tag = board.tags().get(0);
        
        Task subtask = taskService.createTask(new TaskDraft("Child", null, parent.boardId(), null, null, null,
                                                            null, null, parent.id()));
        noteService.createNote(new NoteDraft(parent.id(), "Waiting on review", NoteCategory.BLOCKER, true));
        tagService.addTagToTask(parent.id(), tag.id());
        dependencyService.addDependency(other.id(), parent.id(), DependencyType.BLOCKS);
        
        TaskCascadeDeletion deletion = coordinator.deleteTaskCascade(parent.id());
        
        assertEquals(parent.id(), deletion.deletedTask().id());
        assertEquals(1, deletion.deletedNotes().size());
        assertEquals(1, deletion.removedDependencies().size());
        assertEquals(1, deletion.detachedTags().size());
        assertEquals(List.of(subtask.id()), deletion.orphanedSubtasks().stream().map(Task::id).toList());
        
        assertTrue(taskService.findTask(parent.id()).isEmpty());
        assertNull(taskService.getTask(subtask.id()).parentTaskId(), "Subtasks should become top-level tasks");
        assertEquals(0, count("notes"));
        assertEquals(0, count("task_dependencies"));
        assertEquals(0, count("task_tags"));
        assertEquals(1, count("tags"), "Tags themselves survive");
    }
    
    @Test
    public void testDeleteTaskCascade_MissingTask() {
        TransactionFailureException exception = assertThrows(TransactionFailureException.class,
            () -> coordinator.deleteTaskCascade("no-such-task"));
        
        assertEquals("Task not found: no-such-task", exception.getCause().getMessage());
    }
    
    @Test
    public void testMoveTaskWithDependencies_UnblocksDependent() {
        BoardCreation board = coordinator.createBoard(BoardDraft.named("Flow"), List.of(), List.of());
        List<BoardColumn> columns = boardService.getColumns(board.board().id());
        BoardColumn todo = columns.get(0);
        BoardColumn done = columns.get(2);
        
        Task blocker = taskService.createTask(TaskDraft.titled("API").placedIn(board.board().id(), todo.id()));
        Task dependent = taskService.createTask(new TaskDraft("UI", null, board.board().id(), todo.id(), null,
                                                              null, TaskStatus.BLOCKED, null, null));
        dependencyService.addDependency(dependent.id(), blocker.id(), DependencyType.BLOCKS);
        
        TaskMove move = coordinator.moveTaskWithDependencies(blocker.id(), done.id(), null);
        
        assertEquals(done.id(), move.movedTask().columnId());
        assertEquals(TaskStatus.DONE, move.movedTask().status());
        assertNotNull(move.movedTask().completedAt());
        assertEquals(1, move.updatedDependencies().size());
        assertEquals(TaskStatus.TODO, taskService.getTask(dependent.id()).status());
    }
    
    @Test
    public void testMoveTaskWithDependencies_UnknownColumnChangesNothing() {
        BoardCreation board = coordinator.createBoard(BoardDraft.named("Flow"),
            List.of(TaskDraft.titled("API")), List.of());
        Task task = board.tasks().get(0);
        
        assertThrows(TransactionFailureException.class,
            () -> coordinator.moveTaskWithDependencies(task.id(), "no-such-column", null));
        
        Task reloaded = taskService.getTask(task.id());
        assertEquals(task.columnId(), reloaded.columnId());
        assertEquals(task.position(), reloaded.position());
    }
    
    @Test
    public void testBulkCreateTasks_WithTagsAndDependencies() {
        BoardCreation board = coordinator.createBoard(BoardDraft.named("Bulk"), List.of(),
            List.of(TagDraft.named("frontend")));
        String boardId = board.board().id();
        String tagId = board.tags().get(0).id();
        
        BulkTaskCreation creation = coordinator.bulkCreateTasks(List.of(
                TaskDraft.titled("Step 1").placedIn(boardId, null),
                TaskDraft.titled("Step 2").placedIn(boardId, null),
                TaskDraft.titled("Step 3").placedIn(boardId, null)),
            new BulkCreateOptions(List.of(tagId), true));
        
        assertEquals(3, creation.tasks().size());
        assertEquals(3, creation.assignedTags().size());
        assertEquals(2, creation.createdDependencies().size());
        
        Task second = creation.tasks().get(1);
        assertEquals(creation.tasks().get(0).id(),
                    dependencyService.getDependencies(second.id()).get(0).dependsOnTaskId());
        assertEquals(3, count("task_tags"));
        assertEquals(2, count("task_dependencies"));
    }
    
    @Test
    public void testBulkCreateTasks_InvalidTaskCreatesNothing() {
        BoardCreation board = coordinator.createBoard(BoardDraft.named("Bulk"), List.of(), List.of());
        String boardId = board.board().id();
        
        TaskDraft invalid = new TaskDraft("Step 3", null, boardId, null, null, 11, null, null, null);
        
        TransactionFailureException exception = assertThrows(TransactionFailureException.class,
            () -> coordinator.bulkCreateTasks(List.of(
                    TaskDraft.titled("Step 1").placedIn(boardId, null),
                    TaskDraft.titled("Step 2").placedIn(boardId, null),
                    invalid),
                new BulkCreateOptions(List.of(), true)));
        
        assertInstanceOf(IllegalArgumentException.class, exception.getCause());
        assertEquals(0, count("tasks"));
        assertEquals(0, count("task_dependencies"));
    }
    
    @Test
    public void testStoreRollbackWithoutCompensation() {
        BoardCreation board = coordinator.createBoard(BoardDraft.named("Plain"), List.of(), List.of());
        
        assertThrows(TransactionFailureException.class, () -> transactionManager.executeTransaction(context -> {
            taskService.createTask(TaskDraft.titled("Lost").placedIn(board.board().id(), null));
            throw new IllegalStateException("abort");
        }));
        
        assertEquals(0, count("tasks"), "Writes inside the store transaction should be rolled back");
    }
    
    private int count(String table) {
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return rows != null ? rows : 0;
    }
}
