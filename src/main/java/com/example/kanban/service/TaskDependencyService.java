package com.example.kanban.service;

import com.example.kanban.model.DependencyType;
import com.example.kanban.model.TaskDependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Directed dependencies between tasks. The dependency graph is kept acyclic.
 */
@Service
public class TaskDependencyService {

    private static final Logger logger = LoggerFactory.getLogger(TaskDependencyService.class);

    private static final RowMapper<TaskDependency> DEPENDENCY_MAPPER = (rs, rowNum) -> new TaskDependency(
        rs.getString("id"),
        rs.getString("task_id"),
        rs.getString("depends_on_task_id"),
        DependencyType.fromValue(rs.getString("dependency_type")),
        Timestamps.fromDb(rs.getString("created_at"))
    );

    private final JdbcTemplate jdbcTemplate;
    private final TaskService taskService;

    public TaskDependencyService(JdbcTemplate jdbcTemplate, TaskService taskService) {
        this.jdbcTemplate = jdbcTemplate;
        this.taskService = taskService;
    }

    /**
     * Record that {@code taskId} depends on {@code dependsOnTaskId}.
     * 
     * @param type Dependency type, {@code null} for {@link DependencyType#BLOCKS}
     */
    @Transactional
    public TaskDependency addDependency(String taskId, String dependsOnTaskId, DependencyType type) {
        if (taskId == null || taskId.equals(dependsOnTaskId)) {
            throw new IllegalArgumentException("A task cannot depend on itself: " + taskId);
        }
        taskService.getTask(taskId);
        taskService.getTask(dependsOnTaskId);
        if (wouldCreateCycle(taskId, dependsOnTaskId)) {
            throw new IllegalArgumentException(
                "Dependency " + taskId + " -> " + dependsOnTaskId + " would create a circular dependency");
        }

        TaskDependency dependency = new TaskDependency(UUID.randomUUID().toString(), taskId, dependsOnTaskId,
            type != null ? type : DependencyType.BLOCKS, Timestamps.now());
        jdbcTemplate.update(
            "INSERT INTO task_dependencies (id, task_id, depends_on_task_id, dependency_type, created_at) "
            + "VALUES (?, ?, ?, ?, ?)",
            dependency.id(), taskId, dependsOnTaskId, dependency.dependencyType().value(),
            Timestamps.toDb(dependency.createdAt()));

        logger.info("Task dependency added: taskId={}, dependsOnTaskId={}, type={}",
                   taskId, dependsOnTaskId, dependency.dependencyType());
        return dependency;
    }

    public boolean removeDependency(String taskId, String dependsOnTaskId) {
        return jdbcTemplate.update("DELETE FROM task_dependencies WHERE task_id = ? AND depends_on_task_id = ?",
            taskId, dependsOnTaskId) > 0;
    }

    /**
     * Dependencies the task waits on.
     */
    public List<TaskDependency> getDependencies(String taskId) {
        return jdbcTemplate.query("SELECT * FROM task_dependencies WHERE task_id = ? ORDER BY created_at",
            DEPENDENCY_MAPPER, taskId);
    }

    /**
     * Dependencies of other tasks waiting on this one.
     */
    public List<TaskDependency> getDependents(String taskId) {
        return jdbcTemplate.query("SELECT * FROM task_dependencies WHERE depends_on_task_id = ? ORDER BY created_at",
            DEPENDENCY_MAPPER, taskId);
    }

    /**
     * Remove every dependency the task takes part in, in either direction.
     * 
     * @return the removed dependencies
     */
    @Transactional
    public List<TaskDependency> removeAllForTask(String taskId) {
        List<TaskDependency> removed = jdbcTemplate.query(
            "SELECT * FROM task_dependencies WHERE task_id = ? OR depends_on_task_id = ? ORDER BY created_at",
            DEPENDENCY_MAPPER, taskId, taskId);
        if (!removed.isEmpty()) {
            jdbcTemplate.update("DELETE FROM task_dependencies WHERE task_id = ? OR depends_on_task_id = ?",
                taskId, taskId);
            logger.info("Task dependencies removed: taskId={}, count={}", taskId, removed.size());
        }
        return removed;
    }

    /**
     * Re-insert a removed dependency. A dependency that still exists is left untouched.
     */
    public void restoreDependency(TaskDependency dependency) {
        jdbcTemplate.update(
            "INSERT OR IGNORE INTO task_dependencies (id, task_id, depends_on_task_id, dependency_type, created_at) "
            + "VALUES (?, ?, ?, ?, ?)",
            dependency.id(), dependency.taskId(), dependency.dependsOnTaskId(),
            dependency.dependencyType().value(), Timestamps.toDb(dependency.createdAt()));
    }

    private boolean wouldCreateCycle(String taskId, String dependsOnTaskId) {
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(dependsOnTaskId);

        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (current.equals(taskId)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            pending.addAll(jdbcTemplate.queryForList(
                "SELECT depends_on_task_id FROM task_dependencies WHERE task_id = ?", String.class, current));
        }
        return false;
    }
}
