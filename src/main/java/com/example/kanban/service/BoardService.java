package com.example.kanban.service;

import com.example.kanban.model.Board;
import com.example.kanban.model.BoardColumn;
import com.example.kanban.model.BoardDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Boards and their columns.
 */
@Service
public class BoardService {

    private static final Logger logger = LoggerFactory.getLogger(BoardService.class);

    public static final List<String> DEFAULT_COLUMNS = List.of("Todo", "In Progress", "Done");
    private static final String DEFAULT_COLOR = "#2196F3";

    private static final RowMapper<Board> BOARD_MAPPER = (rs, rowNum) -> new Board(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("color"),
        Timestamps.fromDb(rs.getString("created_at")),
        Timestamps.fromDb(rs.getString("updated_at")),
        rs.getBoolean("archived")
    );

    private static final RowMapper<BoardColumn> COLUMN_MAPPER = (rs, rowNum) -> new BoardColumn(
        rs.getString("id"),
        rs.getString("board_id"),
        rs.getString("name"),
        rs.getInt("position"),
        nullableInt(rs, "wip_limit"),
        Timestamps.fromDb(rs.getString("created_at")),
        Timestamps.fromDb(rs.getString("updated_at"))
    );

    private final JdbcTemplate jdbcTemplate;

    public BoardService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Create a board together with its default columns.
     */
    @Transactional
    public Board createBoard(BoardDraft draft) {
        if (draft == null || draft.name() == null || draft.name().isBlank()) {
            throw new IllegalArgumentException("Board name is required");
        }

        Instant now = Timestamps.now();
        Board board = new Board(UUID.randomUUID().toString(), draft.name().trim(), draft.description(),
            draft.color() != null ? draft.color() : DEFAULT_COLOR, now, now, false);

        jdbcTemplate.update(
            "INSERT INTO boards (id, name, description, color, created_at, updated_at, archived) VALUES (?, ?, ?, ?, ?, ?, ?)",
            board.id(), board.name(), board.description(), board.color(),
            Timestamps.toDb(now), Timestamps.toDb(now), false);

        for (int position = 0; position < DEFAULT_COLUMNS.size(); position++) {
            jdbcTemplate.update(
                "INSERT INTO columns (id, board_id, name, position, wip_limit, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?)",
                UUID.randomUUID().toString(), board.id(), DEFAULT_COLUMNS.get(position), position, null,
                Timestamps.toDb(now), Timestamps.toDb(now));
        }

        logger.info("Board created: boardId={}, name={}", board.id(), board.name());
        return board;
    }

    public Optional<Board> findBoard(String boardId) {
        return jdbcTemplate.query("SELECT * FROM boards WHERE id = ?", BOARD_MAPPER, boardId)
            .stream().findFirst();
    }

    public Board getBoard(String boardId) {
        return findBoard(boardId).orElseThrow(() -> new EntityNotFoundException("Board", boardId));
    }

    /**
     * Columns of a board ordered by position.
     */
    public List<BoardColumn> getColumns(String boardId) {
        return jdbcTemplate.query("SELECT * FROM columns WHERE board_id = ? ORDER BY position",
            COLUMN_MAPPER, boardId);
    }

    public Optional<BoardColumn> findColumn(String columnId) {
        return jdbcTemplate.query("SELECT * FROM columns WHERE id = ?", COLUMN_MAPPER, columnId)
            .stream().findFirst();
    }

    public BoardColumn getColumn(String columnId) {
        return findColumn(columnId).orElseThrow(() -> new EntityNotFoundException("Column", columnId));
    }

    /**
     * Delete a board with everything on it. Deleting an absent board is a no-op.
     * 
     * @return whether a board was deleted
     */
    public boolean deleteBoard(String boardId) {
        int deleted = jdbcTemplate.update("DELETE FROM boards WHERE id = ?", boardId);
        if (deleted > 0) {
            logger.info("Board deleted: boardId={}", boardId);
        }
        return deleted > 0;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
