package com.example.kanban.service;

import com.example.kanban.model.Tag;
import com.example.kanban.model.TagDraft;
import com.example.kanban.model.TaskTag;
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
 * Tags and their links to tasks. Tag names are unique.
 */
@Service
public class TagService {

    private static final Logger logger = LoggerFactory.getLogger(TagService.class);

    private static final String DEFAULT_COLOR = "#9E9E9E";

    private static final RowMapper<Tag> TAG_MAPPER = (rs, rowNum) -> new Tag(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("color"),
        rs.getString("description"),
        rs.getString("parent_tag_id"),
        Timestamps.fromDb(rs.getString("created_at"))
    );

    private static final RowMapper<TaskTag> TASK_TAG_MAPPER = (rs, rowNum) -> new TaskTag(
        rs.getString("id"),
        rs.getString("task_id"),
        rs.getString("tag_id"),
        Timestamps.fromDb(rs.getString("created_at"))
    );

    private final JdbcTemplate jdbcTemplate;

    public TagService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Tag createTag(TagDraft draft) {
        if (draft == null || draft.name() == null || draft.name().isBlank()) {
            throw new IllegalArgumentException("Tag name is required");
        }

        Instant now = Timestamps.now();
        Tag tag = new Tag(UUID.randomUUID().toString(), draft.name().trim(),
            draft.color() != null ? draft.color() : DEFAULT_COLOR, draft.description(), draft.parentTagId(), now);

        jdbcTemplate.update(
            "INSERT INTO tags (id, name, color, description, parent_tag_id, created_at) VALUES (?, ?, ?, ?, ?, ?)",
            tag.id(), tag.name(), tag.color(), tag.description(), tag.parentTagId(), Timestamps.toDb(now));

        logger.info("Tag created: tagId={}, name={}", tag.id(), tag.name());
        return tag;
    }

    public Optional<Tag> findTag(String tagId) {
        return jdbcTemplate.query("SELECT * FROM tags WHERE id = ?", TAG_MAPPER, tagId).stream().findFirst();
    }

    public Tag getTag(String tagId) {
        return findTag(tagId).orElseThrow(() -> new EntityNotFoundException("Tag", tagId));
    }

    public Optional<Tag> findTagByName(String name) {
        return jdbcTemplate.query("SELECT * FROM tags WHERE name = ?", TAG_MAPPER, name).stream().findFirst();
    }

    /**
     * Delete a tag and its task links. Deleting an absent tag is a no-op.
     */
    public boolean deleteTag(String tagId) {
        int deleted = jdbcTemplate.update("DELETE FROM tags WHERE id = ?", tagId);
        if (deleted > 0) {
            logger.info("Tag deleted: tagId={}", tagId);
        }
        return deleted > 0;
    }

    public TaskTag addTagToTask(String taskId, String tagId) {
        getTag(tagId);
        TaskTag link = new TaskTag(UUID.randomUUID().toString(), taskId, tagId, Timestamps.now());
        jdbcTemplate.update("INSERT INTO task_tags (id, task_id, tag_id, created_at) VALUES (?, ?, ?, ?)",
            link.id(), link.taskId(), link.tagId(), Timestamps.toDb(link.createdAt()));

        logger.debug("Tag added to task: taskId={}, tagId={}", taskId, tagId);
        return link;
    }

    public boolean removeTagFromTask(String taskId, String tagId) {
        return jdbcTemplate.update("DELETE FROM task_tags WHERE task_id = ? AND tag_id = ?", taskId, tagId) > 0;
    }

    public List<TaskTag> getTaskTags(String taskId) {
        return jdbcTemplate.query("SELECT * FROM task_tags WHERE task_id = ? ORDER BY created_at",
            TASK_TAG_MAPPER, taskId);
    }

    /**
     * Remove every tag link of a task.
     * 
     * @return the removed links
     */
    @Transactional
    public List<TaskTag> removeAllFromTask(String taskId) {
        List<TaskTag> links = getTaskTags(taskId);
        if (!links.isEmpty()) {
            jdbcTemplate.update("DELETE FROM task_tags WHERE task_id = ?", taskId);
        }
        return links;
    }

    /**
     * Re-insert a removed tag link. A link that still exists is left untouched.
     */
    public void restoreTaskTag(TaskTag link) {
        jdbcTemplate.update("INSERT OR IGNORE INTO task_tags (id, task_id, tag_id, created_at) VALUES (?, ?, ?, ?)",
            link.id(), link.taskId(), link.tagId(), Timestamps.toDb(link.createdAt()));
    }
}
