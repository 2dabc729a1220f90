package com.example.kanban.service;

import com.example.kanban.model.BoardColumn;
import com.example.kanban.model.Task;
import com.example.kanban.model.TaskDraft;
import com.example.kanban.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Tasks, their placement on boards and their parent/subtask links.
 * 
 * Positions are sort keys within a column; new and moved tasks are appended after the last task
 * unless an explicit position is given.
 */
@Service
public class TaskService {

    private static final Logger logger = LoggerFactory.getLogger(TaskService.class);

    private static final int MIN_PRIORITY = 0;
    private static final int MAX_PRIORITY = 10;

    private static final String INSERT_TASK =
        "INSERT %s INTO tasks (id, title, description, board_id, column_id, position, priority, status, "
        + "assignee, parent_task_id, created_at, updated_at, completed_at, archived) "
        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final RowMapper<Task> TASK_MAPPER = (rs, rowNum) -> new Task(
        rs.getString("id"),
        rs.getString("title"),
        rs.getString("description"),
        rs.getString("board_id"),
        rs.getString("column_id"),
        rs.getInt("position"),
        rs.getInt("priority"),
        TaskStatus.fromValue(rs.getString("status")),
        rs.getString("assignee"),
        rs.getString("parent_task_id"),
        Timestamps.fromDb(rs.getString("created_at")),
        Timestamps.fromDb(rs.getString("updated_at")),
        Timestamps.fromDb(rs.getString("completed_at")),
        rs.getBoolean("archived")
    );

    private final JdbcTemplate jdbcTemplate;
    private final BoardService boardService;

    public TaskService(JdbcTemplate jdbcTemplate, BoardService boardService) {
        this.jdbcTemplate = jdbcTemplate;
        this.boardService = boardService;
    }

    /**
     * Create a task. Without a column the task goes to the first column of its board.
     */
    @Transactional
    public Task createTask(TaskDraft draft) {
        if (draft == null || draft.title() == null || draft.title().isBlank()) {
            throw new IllegalArgumentException("Task title is required");
        }
        int priority = draft.priority() != null ? draft.priority() : MIN_PRIORITY;
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Task priority must be between 0 and 10: " + priority);
        }

        BoardColumn column = resolveColumn(draft.boardId(), draft.columnId());
        if (draft.parentTaskId() != null && findTask(draft.parentTaskId()).isEmpty()) {
            throw new EntityNotFoundException("Parent task", draft.parentTaskId());
        }

        Instant now = Timestamps.now();
        TaskStatus status = draft.status() != null ? draft.status() : TaskStatus.TODO;
        int position = draft.position() != null ? draft.position() : nextPosition(column.id());

        Task task = new Task(UUID.randomUUID().toString(), draft.title().trim(), draft.description(),
            column.boardId(), column.id(), position, priority, status, draft.assignee(),
            draft.parentTaskId(), now, now, status == TaskStatus.DONE ? now : null, false);
        insert(task, false);

        logger.info("Task created: taskId={}, boardId={}, columnId={}", task.id(), task.boardId(), task.columnId());
        return task;
    }

    public Optional<Task> findTask(String taskId) {
        return jdbcTemplate.query("SELECT * FROM tasks WHERE id = ?", TASK_MAPPER, taskId)
            .stream().findFirst();
    }

    public Task getTask(String taskId) {
        return findTask(taskId).orElseThrow(() -> new EntityNotFoundException("Task", taskId));
    }

    public List<Task> getTasksInColumn(String columnId) {
        return jdbcTemplate.query("SELECT * FROM tasks WHERE column_id = ? ORDER BY position, created_at",
            TASK_MAPPER, columnId);
    }

    /**
     * Move a task to a column, possibly on another board.
     * 
     * @param position Target position, {@code null} to append
     */
    @Transactional
    public Task moveTask(String taskId, String columnId, Integer position) {
        Task task = getTask(taskId);
        BoardColumn column = boardService.getColumn(columnId);
        int targetPosition = position != null ? position : nextPosition(column.id());
        if (targetPosition < 0) {
            throw new IllegalArgumentException("Task position must not be negative: " + targetPosition);
        }

        Instant now = Timestamps.now();
        jdbcTemplate.update(
            "UPDATE tasks SET column_id = ?, board_id = ?, position = ?, updated_at = ? WHERE id = ?",
            column.id(), column.boardId(), targetPosition, Timestamps.toDb(now), taskId);

        logger.info("Task moved: taskId={}, fromColumn={}, toColumn={}, position={}",
                   taskId, task.columnId(), column.id(), targetPosition);
        return getTask(taskId);
    }

    /**
     * Change the status of a task, keeping {@code completed_at} in line with it.
     */
    public Task updateStatus(String taskId, TaskStatus status) {
        Task task = getTask(taskId);
        if (task.status() == status) {
            return task;
        }
        Instant now = Timestamps.now();
        Instant completedAt = status == TaskStatus.DONE ? now : null;
        jdbcTemplate.update("UPDATE tasks SET status = ?, completed_at = ?, updated_at = ? WHERE id = ?",
            status.value(), Timestamps.toDb(completedAt), Timestamps.toDb(now), taskId);

        logger.debug("Task status updated: taskId={}, from={}, to={}", taskId, task.status(), status);
        return getTask(taskId);
    }

    /**
     * Put placement and status of a task back to a previous snapshot. Absent tasks are ignored.
     */
    public void revertTask(Task snapshot) {
        jdbcTemplate.update(
            "UPDATE tasks SET board_id = ?, column_id = ?, position = ?, status = ?, completed_at = ?, "
            + "updated_at = ? WHERE id = ?",
            snapshot.boardId(), snapshot.columnId(), snapshot.position(), snapshot.status().value(),
            Timestamps.toDb(snapshot.completedAt()), Timestamps.toDb(snapshot.updatedAt()), snapshot.id());
    }

    public List<Task> getSubtasks(String parentTaskId) {
        return jdbcTemplate.query("SELECT * FROM tasks WHERE parent_task_id = ? ORDER BY position, created_at",
            TASK_MAPPER, parentTaskId);
    }

    /**
     * Turn all subtasks of a task into top-level tasks.
     * 
     * @return the subtasks as they were before being detached
     */
    @Transactional
    public List<Task> detachSubtasks(String parentTaskId) {
        List<Task> subtasks = getSubtasks(parentTaskId);
        if (!subtasks.isEmpty()) {
            jdbcTemplate.update("UPDATE tasks SET parent_task_id = NULL, updated_at = ? WHERE parent_task_id = ?",
                Timestamps.toDb(Timestamps.now()), parentTaskId);
            logger.info("Subtasks detached: parentTaskId={}, count={}", parentTaskId, subtasks.size());
        }
        return subtasks;
    }

    /**
     * Point the given tasks at a parent again.
     * 
     * @return number of tasks updated
     */
    @Transactional
    public int attachSubtasks(String parentTaskId, List<String> subtaskIds) {
        int updated = 0;
        for (String subtaskId : subtaskIds) {
            updated += jdbcTemplate.update("UPDATE tasks SET parent_task_id = ? WHERE id = ?", parentTaskId, subtaskId);
        }
        return updated;
    }

    /**
     * Delete a task. Notes, tag links and dependencies go with it. Deleting an absent task is a
     * no-op.
     * 
     * @return whether a task was deleted
     */
    public boolean deleteTask(String taskId) {
        int deleted = jdbcTemplate.update("DELETE FROM tasks WHERE id = ?", taskId);
        if (deleted > 0) {
            logger.info("Task deleted: taskId={}", taskId);
        }
        return deleted > 0;
    }

    /**
     * Re-insert a deleted task from its snapshot. A task that still exists is left untouched.
     */
    public void restoreTask(Task snapshot) {
        int restored = insert(snapshot, true);
        if (restored > 0) {
            logger.info("Task restored: taskId={}", snapshot.id());
        }
    }

    private BoardColumn resolveColumn(String boardId, String columnId) {
        if (columnId != null) {
            BoardColumn column = boardService.getColumn(columnId);
            if (boardId != null && !boardId.equals(column.boardId())) {
                throw new IllegalArgumentException("Column " + columnId + " does not belong to board " + boardId);
            }
            return column;
        }
        if (boardId == null) {
            throw new IllegalArgumentException("Task needs a board or a column");
        }
        return boardService.getColumns(boardId).stream()
            .findFirst()
            .orElseThrow(() -> new EntityNotFoundException("Column of board", boardId));
    }

    private int nextPosition(String columnId) {
        Integer next = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(position), -1) + 1 FROM tasks WHERE column_id = ? AND archived = 0",
            Integer.class, columnId);
        return next != null ? next : 0;
    }

    private int insert(Task task, boolean ignoreExisting) {
        return jdbcTemplate.update(String.format(INSERT_TASK, ignoreExisting ? "OR IGNORE" : ""),
            task.id(), task.title(), task.description(), task.boardId(), task.columnId(), task.position(),
            task.priority(), task.status().value(), task.assignee(), task.parentTaskId(),
            Timestamps.toDb(task.createdAt()), Timestamps.toDb(task.updatedAt()),
            Timestamps.toDb(task.completedAt()), task.archived());
    }
}
