package com.example.kanban.saga;

import com.example.kanban.model.Board;
import com.example.kanban.model.BoardColumn;
import com.example.kanban.model.BoardDraft;
import com.example.kanban.model.DependencyType;
import com.example.kanban.model.Note;
import com.example.kanban.model.Tag;
import com.example.kanban.model.TagDraft;
import com.example.kanban.model.Task;
import com.example.kanban.model.TaskDependency;
import com.example.kanban.model.TaskDraft;
import com.example.kanban.model.TaskStatus;
import com.example.kanban.model.TaskTag;
import com.example.kanban.service.BoardService;
import com.example.kanban.service.NoteService;
import com.example.kanban.service.TagService;
import com.example.kanban.service.TaskDependencyService;
import com.example.kanban.service.TaskService;
import com.example.kanban.transaction.KanbanTransactionManager;
import com.example.kanban.transaction.OperationRecord;
import com.example.kanban.transaction.TransactionCallback;
import com.example.kanban.transaction.TransactionContext;
import com.example.kanban.transaction.TransactionOptions;
import com.example.kanban.transaction.TransactionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs sequences of service calls as one transaction and builds the composite kanban
 * operations on top of that.
 * 
 * Every step is recorded on the transaction and registers its compensation before it runs, so
 * a failing step compensates itself and every step before it. Steps that need the output of an
 * earlier step read it from a holder written by that step.
 */
public class ServiceTransactionCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ServiceTransactionCoordinator.class);

    private final KanbanTransactionManager transactionManager;
    private final BoardService boardService;
    private final TaskService taskService;
    private final TagService tagService;
    private final TaskDependencyService dependencyService;
    private final NoteService noteService;

    public ServiceTransactionCoordinator(KanbanTransactionManager transactionManager,
                                         BoardService boardService,
                                         TaskService taskService,
                                         TagService tagService,
                                         TaskDependencyService dependencyService,
                                         NoteService noteService) {
        this.transactionManager = transactionManager;
        this.boardService = boardService;
        this.taskService = taskService;
        this.tagService = tagService;
        this.dependencyService = dependencyService;
        this.noteService = noteService;
    }

    public List<Object> coordinateMultiServiceOperation(List<? extends ServiceOperation<?>> operations) {
        return coordinateMultiServiceOperation(operations, transactionManager.getDefaultOptions());
    }

    /**
     * Run the operations in order inside one transaction.
     * 
     * @return one result per operation, in input order
     * @throws com.example.kanban.transaction.TransactionFailureException if any operation fails;
     *         registered compensations have run by then, except after a fired deadline where they
     *         run once the abandoned steps return
     */
    public List<Object> coordinateMultiServiceOperation(List<? extends ServiceOperation<?>> operations,
                                                        TransactionOptions options) {
        List<ServiceOperation<?>> steps = List.copyOf(Objects.requireNonNull(operations, "operations"));
        return transactionManager.executeTransaction(context -> {
            List<Object> results = new ArrayList<>(steps.size());
            for (ServiceOperation<?> step : steps) {
                results.add(runStep(context, step));
            }
            return Collections.unmodifiableList(results);
        }, options);
    }

    /**
     * Run arbitrary work in a new transaction with the default options.
     */
    public <T> T runInTransaction(TransactionCallback<T> work) {
        return transactionManager.executeTransaction(work, transactionManager.getDefaultOptions());
    }

    /**
     * Create a board with its default columns, then the initial tasks in its first column, then
     * the initial tags.
     */
    public BoardCreation createBoard(BoardDraft boardData, List<TaskDraft> initialTasks, List<TagDraft> initialTags) {
        List<TaskDraft> taskDrafts = initialTasks != null ? initialTasks : List.of();
        List<TagDraft> tagDrafts = initialTags != null ? initialTags : List.of();

        AtomicReference<Board> board = new AtomicReference<>();
        List<Task> tasks = new ArrayList<>();
        List<Tag> tags = new ArrayList<>();
        List<ServiceOperation<?>> operations = new ArrayList<>();

        operations.add(ServiceOperation.of("BoardService", "createBoard",
            () -> {
                Board created = boardService.createBoard(boardData);
                board.set(created);
                return created;
            },
            () -> {
                if (board.get() != null) {
                    boardService.deleteBoard(board.get().id());
                }
            }));

        for (TaskDraft taskDraft : taskDrafts) {
            AtomicReference<Task> task = new AtomicReference<>();
            operations.add(ServiceOperation.of("TaskService", "createTask",
                () -> {
                    Task created = taskService.createTask(taskDraft.placedIn(board.get().id(), null));
                    task.set(created);
                    tasks.add(created);
                    return created;
                },
                () -> {
                    if (task.get() != null) {
                        taskService.deleteTask(task.get().id());
                    }
                }));
        }

        for (TagDraft tagDraft : tagDrafts) {
            AtomicReference<Tag> tag = new AtomicReference<>();
            operations.add(ServiceOperation.of("TagService", "createTag",
                () -> {
                    Tag created = tagService.createTag(tagDraft);
                    tag.set(created);
                    tags.add(created);
                    return created;
                },
                () -> {
                    if (tag.get() != null) {
                        tagService.deleteTag(tag.get().id());
                    }
                }));
        }

        coordinateMultiServiceOperation(operations);
        logger.info("Board created with saga: boardId={}, tasks={}, tags={}",
                   board.get().id(), tasks.size(), tags.size());
        return new BoardCreation(board.get(), tasks, tags);
    }

    /**
     * Move a task to another column and re-evaluate the tasks it blocks.
     * 
     * Moving into a column whose name implies a status (Todo, In Progress, Done) updates the
     * task's status. A dependent is blocked while any of its blockers is not done and goes back
     * to todo once all of them are.
     * 
     * @param position Target position, {@code null} to append
     */
    public TaskMove moveTaskWithDependencies(String taskId, String targetColumnId, Integer position) {
        AtomicReference<Task> original = new AtomicReference<>();
        AtomicReference<BoardColumn> targetColumn = new AtomicReference<>();
        AtomicReference<Task> moved = new AtomicReference<>();
        List<Task> dependentSnapshots = Collections.synchronizedList(new ArrayList<>());
        List<Task> updatedDependents = new ArrayList<>();

        List<ServiceOperation<?>> operations = List.of(
            ServiceOperation.of("TaskService", "getTask", () -> {
                Task task = taskService.getTask(taskId);
                original.set(task);
                return task;
            }),
            ServiceOperation.of("BoardService", "getColumn", () -> {
                BoardColumn column = boardService.getColumn(targetColumnId);
                targetColumn.set(column);
                return column;
            }),
            ServiceOperation.of("TaskService", "moveTask",
                () -> {
                    Task task = taskService.moveTask(taskId, targetColumnId, position);
                    Optional<TaskStatus> impliedStatus = TaskStatus.forColumnName(targetColumn.get().name());
                    if (impliedStatus.isPresent() && impliedStatus.get() != task.status()) {
                        task = taskService.updateStatus(taskId, impliedStatus.get());
                    }
                    moved.set(task);
                    return task;
                },
                () -> {
                    if (original.get() != null) {
                        taskService.revertTask(original.get());
                    }
                }),
            ServiceOperation.of("TaskService", "updateStatus",
                () -> {
                    for (TaskDependency dependency : dependencyService.getDependents(taskId)) {
                        if (dependency.dependencyType() != DependencyType.BLOCKS) {
                            continue;
                        }
                        Task dependent = taskService.getTask(dependency.taskId());
                        Optional<TaskStatus> next = reevaluate(dependent);
                        if (next.isPresent()) {
                            dependentSnapshots.add(dependent);
                            updatedDependents.add(taskService.updateStatus(dependent.id(), next.get()));
                        }
                    }
                    return List.copyOf(updatedDependents);
                },
                () -> {
                    List<Task> snapshots = new ArrayList<>(dependentSnapshots);
                    Collections.reverse(snapshots);
                    for (Task snapshot : snapshots) {
                        taskService.revertTask(snapshot);
                    }
                })
        );

        coordinateMultiServiceOperation(operations);
        logger.info("Task moved with saga: taskId={}, columnId={}, updatedDependents={}",
                   taskId, targetColumnId, updatedDependents.size());
        return new TaskMove(moved.get(), updatedDependents);
    }

    /**
     * Delete a task together with its notes, dependencies and tag links. Subtasks are kept and
     * become top-level tasks.
     */
    public TaskCascadeDeletion deleteTaskCascade(String taskId) {
        AtomicReference<Task> task = new AtomicReference<>();
        List<Note> deletedNotes = Collections.synchronizedList(new ArrayList<>());
        List<TaskDependency> removedDependencies = Collections.synchronizedList(new ArrayList<>());
        List<TaskTag> detachedTags = Collections.synchronizedList(new ArrayList<>());
        List<Task> orphanedSubtasks = Collections.synchronizedList(new ArrayList<>());

        List<ServiceOperation<?>> operations = List.of(
            ServiceOperation.of("TaskService", "getTask", () -> {
                Task existing = taskService.getTask(taskId);
                task.set(existing);
                return existing;
            }),
            ServiceOperation.of("NoteService", "deleteTaskNotes",
                () -> {
                    deletedNotes.addAll(noteService.deleteTaskNotes(taskId));
                    return List.copyOf(deletedNotes);
                },
                () -> {
                    for (Note note : List.copyOf(deletedNotes)) {
                        noteService.restoreNote(note);
                    }
                }),
            ServiceOperation.of("TaskDependencyService", "removeAllForTask",
                () -> {
                    removedDependencies.addAll(dependencyService.removeAllForTask(taskId));
                    return List.copyOf(removedDependencies);
                },
                () -> {
                    for (TaskDependency dependency : List.copyOf(removedDependencies)) {
                        dependencyService.restoreDependency(dependency);
                    }
                }),
            ServiceOperation.of("TagService", "removeAllFromTask",
                () -> {
                    detachedTags.addAll(tagService.removeAllFromTask(taskId));
                    return List.copyOf(detachedTags);
                },
                () -> {
                    for (TaskTag link : List.copyOf(detachedTags)) {
                        tagService.restoreTaskTag(link);
                    }
                }),
            ServiceOperation.of("TaskService", "detachSubtasks",
                () -> {
                    orphanedSubtasks.addAll(taskService.detachSubtasks(taskId));
                    return List.copyOf(orphanedSubtasks);
                },
                () -> {
                    List<Task> subtasks = List.copyOf(orphanedSubtasks);
                    if (!subtasks.isEmpty()) {
                        taskService.attachSubtasks(taskId, subtasks.stream().map(Task::id).toList());
                    }
                }),
            ServiceOperation.of("TaskService", "deleteTask",
                () -> taskService.deleteTask(taskId),
                () -> {
                    if (task.get() != null) {
                        taskService.restoreTask(task.get());
                    }
                })
        );

        coordinateMultiServiceOperation(operations);
        logger.info("Task deleted with saga: taskId={}, notes={}, dependencies={}, tags={}, subtasks={}",
                   taskId, deletedNotes.size(), removedDependencies.size(), detachedTags.size(),
                   orphanedSubtasks.size());
        return new TaskCascadeDeletion(task.get(), orphanedSubtasks, removedDependencies, deletedNotes, detachedTags);
    }

    /**
     * Create tasks, link the given tags to each of them and optionally chain them so that every
     * task depends on the one created before it.
     */
    public BulkTaskCreation bulkCreateTasks(List<TaskDraft> tasksData, BulkCreateOptions options) {
        Objects.requireNonNull(tasksData, "tasksData");
        BulkCreateOptions bulkOptions = options != null ? options : BulkCreateOptions.none();
        int taskCount = tasksData.size();

        // One slot per draft, filled by its create step and read by later steps and compensations
        List<AtomicReference<Task>> tasks = new ArrayList<>(taskCount);
        List<ServiceOperation<?>> operations = new ArrayList<>();

        for (TaskDraft taskDraft : tasksData) {
            AtomicReference<Task> task = new AtomicReference<>();
            tasks.add(task);
            operations.add(ServiceOperation.of("TaskService", "createTask",
                () -> {
                    Task created = taskService.createTask(taskDraft);
                    task.set(created);
                    return created;
                },
                () -> {
                    if (task.get() != null) {
                        taskService.deleteTask(task.get().id());
                    }
                }));
        }

        for (String tagId : bulkOptions.assignTags()) {
            for (int i = 0; i < taskCount; i++) {
                int index = i;
                operations.add(ServiceOperation.of("TagService", "addTagToTask",
                    () -> tagService.addTagToTask(tasks.get(index).get().id(), tagId),
                    () -> {
                        Task task = tasks.get(index).get();
                        if (task != null) {
                            tagService.removeTagFromTask(task.id(), tagId);
                        }
                    }));
            }
        }

        if (bulkOptions.createDependencies()) {
            for (int i = 1; i < taskCount; i++) {
                int index = i;
                operations.add(ServiceOperation.of("TaskDependencyService", "addDependency",
                    () -> dependencyService.addDependency(tasks.get(index).get().id(),
                                                          tasks.get(index - 1).get().id(), DependencyType.BLOCKS),
                    () -> {
                        Task task = tasks.get(index).get();
                        Task blocker = tasks.get(index - 1).get();
                        if (task != null && blocker != null) {
                            dependencyService.removeDependency(task.id(), blocker.id());
                        }
                    }));
            }
        }

        List<Object> results = coordinateMultiServiceOperation(operations);

        int tagLinkCount = bulkOptions.assignTags().size() * taskCount;
        List<Task> createdTasks = slice(results, 0, taskCount, Task.class);
        List<TaskTag> assignedTags = slice(results, taskCount, taskCount + tagLinkCount, TaskTag.class);
        List<TaskDependency> createdDependencies =
            slice(results, taskCount + tagLinkCount, results.size(), TaskDependency.class);

        logger.info("Tasks bulk created with saga: tasks={}, tagLinks={}, dependencies={}",
                   createdTasks.size(), assignedTags.size(), createdDependencies.size());
        return new BulkTaskCreation(createdTasks, assignedTags, createdDependencies);
    }

    /**
     * Metrics derived from the transactions active right now.
     */
    public TransactionMetrics getTransactionMetrics() {
        List<TransactionSnapshot> active = transactionManager.getActiveTransactions();
        int totalOperations = active.stream().mapToInt(snapshot -> snapshot.operations().size()).sum();
        double average = active.isEmpty() ? 0.0 : (double) totalOperations / active.size();
        return new TransactionMetrics(active.size(), totalOperations, average);
    }

    public List<TransactionSnapshot> getActiveTransactions() {
        return transactionManager.getActiveTransactions();
    }

    private Object runStep(TransactionContext context, ServiceOperation<?> step) throws Exception {
        OperationRecord record = transactionManager.addOperation(context, step.serviceName(), step.methodName());
        if (step.hasRollback()) {
            transactionManager.addRollbackAction(context, step.rollbackAction());
        }
        try {
            Object result = step.execute().call();
            transactionManager.completeOperation(record);
            return result;
        } catch (Exception e) {
            logger.error("Coordinated step failed: transactionId={}, service={}, method={}, error={}",
                        context.getId(), step.serviceName(), step.methodName(), e.getMessage());
            throw e;
        }
    }

    /**
     * New status of a dependent after one of its blockers changed, empty when it stays as is.
     */
    private Optional<TaskStatus> reevaluate(Task dependent) {
        boolean allBlockersDone = dependencyService.getDependencies(dependent.id()).stream()
            .filter(dependency -> dependency.dependencyType() == DependencyType.BLOCKS)
            .map(dependency -> taskService.getTask(dependency.dependsOnTaskId()))
            .allMatch(blocker -> blocker.status() == TaskStatus.DONE);

        if (allBlockersDone && dependent.status() == TaskStatus.BLOCKED) {
            return Optional.of(TaskStatus.TODO);
        }
        if (!allBlockersDone && dependent.status() == TaskStatus.TODO) {
            return Optional.of(TaskStatus.BLOCKED);
        }
        return Optional.empty();
    }

    private static <T> List<T> slice(List<Object> results, int from, int to, Class<T> type) {
        return results.subList(from, to).stream().map(type::cast).toList();
    }
}
