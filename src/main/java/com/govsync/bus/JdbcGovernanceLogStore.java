package com.govsync.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.govsync.contract.EntryType;
import com.govsync.persistence.ImportTransaction;
import com.govsync.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Repository
public class JdbcGovernanceLogStore implements GovernanceLogStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcGovernanceLogStore.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String COLUMNS = """
            log_id, entry_type, logged_at, actor, summary, details,
            project_id, phase_id, step_id, memory_anchor_id, entry_source
            """;

    private static final String SELECT_BY_ID_SQL =
        "SELECT " + COLUMNS + " FROM governance_logs WHERE log_id = ?";

    private static final String INSERT_SQL = """
            INSERT INTO governance_logs (log_id, entry_type, logged_at, actor, summary, details,
                                         project_id, phase_id, step_id, memory_anchor_id, entry_source)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPDATE_SQL = """
            UPDATE governance_logs
               SET entry_type = ?, logged_at = ?, actor = ?, summary = ?, details = ?,
                   project_id = ?, phase_id = ?, step_id = ?, memory_anchor_id = ?, entry_source = ?
             WHERE log_id = ?
            """;

    private static final String DELETE_SQL = "DELETE FROM governance_logs WHERE log_id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final ObjectWriter canonicalWriter;
    private final RowMapper<GovernanceLogEntry> rowMapper;

    public JdbcGovernanceLogStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.canonicalWriter = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.rowMapper = (rs, rowNum) -> new GovernanceLogEntry(
            rs.getString("log_id"),
            EntryType.fromValue(rs.getString("entry_type")),
            rs.getTimestamp("logged_at").toInstant(),
            rs.getString("actor"),
            rs.getString("summary"),
            readDetails(rs.getString("details")),
            rs.getString("project_id"),
            rs.getString("phase_id"),
            rs.getString("step_id"),
            rs.getString("memory_anchor_id"),
            rs.getString("entry_source")
        );
    }

    @Override
    public UpsertOutcome upsert(ImportTransaction tx, GovernanceLogEntry entry) {
        tx.requireActive();
        String details = writeDetails(entry.details());
        Timestamp loggedAt = Timestamp.from(entry.timestamp() != null ? entry.timestamp() : Instant.now());
        try {
            Optional<GovernanceLogEntry> existing = findById(entry.id());
            if (existing.isPresent()) {
                if (sameContent(existing.get(), entry)) {
                    log.debug("Governance log {} unchanged", entry.id());
                    return UpsertOutcome.UNCHANGED;
                }
                jdbcTemplate.update(UPDATE_SQL,
                    entry.entryType().getValue(), loggedAt, entry.actor(), entry.summary(), details,
                    entry.projectId(), entry.phaseId(), entry.stepId(), entry.memoryAnchorId(),
                    entry.source(), entry.id());
                log.debug("Replaced governance log {}", entry.id());
                return UpsertOutcome.UPDATED;
            }
            jdbcTemplate.update(INSERT_SQL,
                entry.id(), entry.entryType().getValue(), loggedAt, entry.actor(), entry.summary(),
                details, entry.projectId(), entry.phaseId(), entry.stepId(), entry.memoryAnchorId(),
                entry.source());
            log.debug("Inserted governance log {}", entry.id());
            return UpsertOutcome.CREATED;
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to write governance log " + entry.id() + ": "
                + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean delete(ImportTransaction tx, String id) {
        tx.requireActive();
        try {
            return jdbcTemplate.update(DELETE_SQL, id) > 0;
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to delete governance log " + id + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public Optional<GovernanceLogEntry> findById(String id) {
        try {
            return jdbcTemplate.query(SELECT_BY_ID_SQL, rowMapper, id).stream().findFirst();
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to read governance log " + id + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public List<GovernanceLogEntry> query(GovernanceLogQuery query) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM governance_logs WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        appendFilter(sql, args, "project_id", query.projectId());
        appendFilter(sql, args, "phase_id", query.phaseId());
        appendFilter(sql, args, "step_id", query.stepId());
        appendFilter(sql, args, "entry_type", query.entryType() != null ? query.entryType().getValue() : null);
        appendFilter(sql, args, "actor", query.actor());
        sql.append(" ORDER BY logged_at DESC, log_id ASC LIMIT ?");
        args.add(Math.max(query.limit(), 0));
        try {
            return jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to query governance logs: " + ex.getMessage(), ex);
        }
    }

    private static void appendFilter(StringBuilder sql, List<Object> args, String column, String value) {
        if (value != null && !value.isBlank()) {
            sql.append(" AND ").append(column).append(" = ?");
            args.add(value);
        }
    }

    private boolean sameContent(GovernanceLogEntry stored, GovernanceLogEntry incoming) {
        return stored.entryType() == incoming.entryType()
            && Objects.equals(stored.timestamp(), incoming.timestamp())
            && Objects.equals(stored.actor(), incoming.actor())
            && Objects.equals(stored.summary(), incoming.summary())
            && Objects.equals(writeDetails(stored.details()), writeDetails(incoming.details()))
            && Objects.equals(stored.projectId(), incoming.projectId())
            && Objects.equals(stored.phaseId(), incoming.phaseId())
            && Objects.equals(stored.stepId(), incoming.stepId())
            && Objects.equals(stored.memoryAnchorId(), incoming.memoryAnchorId())
            && Objects.equals(stored.source(), incoming.source());
    }

    private String writeDetails(Map<String, Object> details) {
        try {
            return canonicalWriter.writeValueAsString(details);
        } catch (JsonProcessingException ex) {
            throw new PersistenceException("governance log details are not serializable", ex);
        }
    }

    private Map<String, Object> readDetails(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException ex) {
            throw new PersistenceException("stored governance log details are not valid JSON", ex);
        }
    }
}
