package com.example.kanban.service;

import com.example.kanban.model.Note;
import com.example.kanban.model.NoteCategory;
import com.example.kanban.model.NoteDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class NoteService {

    private static final Logger logger = LoggerFactory.getLogger(NoteService.class);

    private static final String INSERT_NOTE =
        "INSERT %s INTO notes (id, task_id, content, category, pinned, created_at, updated_at) "
        + "VALUES (?, ?, ?, ?, ?, ?, ?)";

    private static final RowMapper<Note> NOTE_MAPPER = (rs, rowNum) -> new Note(
        rs.getString("id"),
        rs.getString("task_id"),
        rs.getString("content"),
        NoteCategory.fromValue(rs.getString("category")),
        rs.getBoolean("pinned"),
        Timestamps.fromDb(rs.getString("created_at")),
        Timestamps.fromDb(rs.getString("updated_at"))
    );

    private final JdbcTemplate jdbcTemplate;

    public NoteService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Note createNote(NoteDraft draft) {
        if (draft == null || draft.content() == null || draft.content().isBlank()) {
            throw new IllegalArgumentException("Note content is required");
        }
        Instant now = Timestamps.now();
        Note note = new Note(UUID.randomUUID().toString(), draft.taskId(), draft.content(),
            draft.category() != null ? draft.category() : NoteCategory.GENERAL, draft.pinned(), now, now);
        insert(note, false);

        logger.debug("Note created: noteId={}, taskId={}", note.id(), note.taskId());
        return note;
    }

    /**
     * Notes of a task, pinned notes first.
     */
    public List<Note> getTaskNotes(String taskId) {
        return jdbcTemplate.query("SELECT * FROM notes WHERE task_id = ? ORDER BY pinned DESC, created_at",
            NOTE_MAPPER, taskId);
    }

    /**
     * Delete all notes of a task.
     * 
     * @return the deleted notes
     */
    @Transactional
    public List<Note> deleteTaskNotes(String taskId) {
        List<Note> notes = getTaskNotes(taskId);
        if (!notes.isEmpty()) {
            jdbcTemplate.update("DELETE FROM notes WHERE task_id = ?", taskId);
            logger.info("Task notes deleted: taskId={}, count={}", taskId, notes.size());
        }
        return notes;
    }

    /**
     * Re-insert a deleted note. A note that still exists is left untouched.
     */
    public void restoreNote(Note note) {
        insert(note, true);
    }

    private void insert(Note note, boolean ignoreExisting) {
        jdbcTemplate.update(String.format(INSERT_NOTE, ignoreExisting ? "OR IGNORE" : ""),
            note.id(), note.taskId(), note.content(), note.category().value(), note.pinned(),
            Timestamps.toDb(note.createdAt()), Timestamps.toDb(note.updatedAt()));
    }
}
