package com.stemtutor.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link BaseCheckpointSaver} that persists the latest LangGraph4j
 * checkpoint of each session to a PostgreSQL table.
 * <p>
 * The table holds one row per session ({@code thread_id}), overwritten on
 * every step completion, so a session's history is its current state plus
 * the last completed and next step. State is stored as JSON; records come
 * back as maps, which {@link com.stemtutor.core.state.TutorState} accepts.
 * <p>
 * Unlike an in-memory saver, every database failure is raised as
 * {@link CheckpointStoreException} so that a run never continues without
 * its checkpoints.
 */
public class JdbcCheckpointSaver implements BaseCheckpointSaver {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointSaver.class);

    private static final String TABLE_NAME = "tutor_checkpoints";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                thread_id     VARCHAR(255) PRIMARY KEY,
                checkpoint_id VARCHAR(255) NOT NULL,
                node_id       VARCHAR(255),
                next_node_id  VARCHAR(255),
                state         TEXT NOT NULL,
                updated_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (thread_id, checkpoint_id, node_id, next_node_id, state)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (thread_id)
            DO UPDATE SET checkpoint_id = EXCLUDED.checkpoint_id,
                          node_id = EXCLUDED.node_id,
                          next_node_id = EXCLUDED.next_node_id,
                          state = EXCLUDED.state,
                          updated_at = CURRENT_TIMESTAMP
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_THREAD_SQL = """
            SELECT checkpoint_id, node_id, next_node_id, state
            FROM %s
            WHERE thread_id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_BY_THREAD_SQL = """
            DELETE FROM %s WHERE thread_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcCheckpointSaver(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        return load(resolveThreadId(config)).map(List::of).orElseGet(List::of);
    }

    /**
     * Returns the session's checkpoint. A requested checkpoint id that is no
     * longer the latest yields empty, since only the latest is kept.
     */
    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        var latest = load(resolveThreadId(config));
        var requested = config.checkPointId();
        if (requested.isPresent()) {
            return latest.filter(cp -> requested.get().equals(cp.getId()));
        }
        return latest;
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) throws Exception {
        String threadId = resolveThreadId(config);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, threadId);
            stmt.setString(2, checkpoint.getId());
            stmt.setString(3, checkpoint.getNodeId());
            stmt.setString(4, checkpoint.getNextNodeId());
            stmt.setString(5, serializeState(checkpoint.getState()));
            stmt.executeUpdate();

            log.debug("Saved checkpoint '{}' for session '{}' after {}",
                    checkpoint.getId(), threadId, checkpoint.getNodeId());
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to save checkpoint for session '" + threadId + "'", e);
        }

        return RunnableConfig.builder(config)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) throws Exception {
        String threadId = resolveThreadId(config);
        Collection<Checkpoint> released = list(config);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_BY_THREAD_SQL)) {
            stmt.setString(1, threadId);
            int deleted = stmt.executeUpdate();
            log.debug("Released {} checkpoint(s) for session '{}'", deleted, threadId);
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to release checkpoints for session '" + threadId + "'", e);
        }

        return new Tag(threadId, released);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Optional<Checkpoint> load(String threadId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_THREAD_SQL)) {
            stmt.setString(1, threadId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to load checkpoint for session '" + threadId + "'", e);
        }
        return Optional.empty();
    }

    private String resolveThreadId(RunnableConfig config) {
        return config.threadId().orElse(THREAD_ID_DEFAULT);
    }

    private String serializeState(Map<String, Object> state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new CheckpointStoreException("Failed to serialize checkpoint state", e);
        }
    }

    private Map<String, Object> deserializeState(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (IOException e) {
            throw new CheckpointStoreException("Failed to deserialize checkpoint state", e);
        }
    }

    private Checkpoint fromResultSet(ResultSet rs) throws SQLException {
        String id = rs.getString("checkpoint_id");
        String nodeId = rs.getString("node_id");
        String nextNodeId = rs.getString("next_node_id");
        Map<String, Object> state = deserializeState(rs.getString("state"));

        var builder = Checkpoint.builder()
                .id(id)
                .state(state);

        if (nodeId != null) {
            builder.nodeId(nodeId);
        }
        if (nextNodeId != null) {
            builder.nextNodeId(nextNodeId);
        }

        return builder.build();
    }
}
