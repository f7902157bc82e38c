package com.govsync.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsync.contract.QaStatus;
import com.govsync.contract.StepStatus;
import com.govsync.contract.WorkStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC access to the project hierarchy and memory anchors.
 *
 * Upserts are portable: an {@code UPDATE} keyed by primary key, followed by an
 * {@code INSERT} when no row was touched. Every call takes the open
 * {@link ImportTransaction} so that it runs on the transaction's connection.
 */
@Repository
public class GovernanceRepository {

    private static final Logger log = LoggerFactory.getLogger(GovernanceRepository.class);

    private static final Set<String> COUNTABLE_TABLES =
        Set.of("projects", "phases", "steps", "governance_logs", "memory_anchors");

    private static final String UPDATE_PROJECT_SQL = """
            UPDATE projects
               SET name = ?, description = ?, program_type = ?, status = ?,
                   completion_percentage = ?, metadata = ?,
                   created_at = COALESCE(CAST(? AS TIMESTAMP(9)), created_at), last_updated = ?,
                   submitted_by = ?, imported_at = ?
             WHERE project_id = ?
            """;

    private static final String INSERT_PROJECT_SQL = """
            INSERT INTO projects (project_id, name, description, program_type, status,
                                  completion_percentage, metadata, created_at, last_updated,
                                  submitted_by, imported_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String UPDATE_PHASE_SQL = """
            UPDATE phases
               SET project_id = ?, name = ?, status = ?,
                   started_at = COALESCE(CAST(? AS TIMESTAMP(9)), started_at),
                   completed_at = COALESCE(CAST(? AS TIMESTAMP(9)), completed_at)
             WHERE phase_id = ?
            """;

    private static final String INSERT_PHASE_SQL = """
            INSERT INTO phases (phase_id, project_id, name, status, started_at, completed_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    // SDLC columns merge: an absent value keeps what is stored
    private static final String UPDATE_STEP_SQL = """
            UPDATE steps
               SET phase_id = ?, project_id = ?, name = ?, status = ?, progress = ?,
                   started_at   = COALESCE(CAST(? AS TIMESTAMP(9)), started_at),
                   completed_at = COALESCE(CAST(? AS TIMESTAMP(9)), completed_at),
                   sdlc_stage   = COALESCE(CAST(? AS VARCHAR), sdlc_stage),
                   branch_name  = COALESCE(CAST(? AS VARCHAR), branch_name),
                   commit_id    = COALESCE(CAST(? AS VARCHAR), commit_id),
                   ci_status    = COALESCE(CAST(? AS VARCHAR), ci_status),
                   qa_status    = COALESCE(CAST(? AS VARCHAR), qa_status),
                   debug_branch = COALESCE(CAST(? AS VARCHAR), debug_branch),
                   issue_link   = COALESCE(CAST(? AS VARCHAR), issue_link),
                   pull_request = COALESCE(CAST(? AS VARCHAR), pull_request)
             WHERE step_id = ?
            """;

    private static final String INSERT_STEP_SQL = """
            INSERT INTO steps (step_id, phase_id, project_id, name, status, progress,
                               started_at, completed_at, sdlc_stage, branch_name, commit_id,
                               ci_status, qa_status, debug_branch, issue_link, pull_request)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_STEP_SQL = """
            SELECT step_id, phase_id, project_id, status, qa_status
              FROM steps
             WHERE step_id = ?
            """;

    private static final String UPDATE_ANCHOR_STATUS_SQL = """
            UPDATE memory_anchors SET status = ? WHERE anchor_id = ?
            """;

    private static final String INSERT_ANCHOR_SQL = """
            INSERT INTO memory_anchors (anchor_id, linked_step_id, status, anchor_type,
                                        content, tags, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String ANCHORED_STEPS_SQL = """
            SELECT linked_step_id AS step_id FROM memory_anchors WHERE linked_step_id IN (:ids)
            UNION
            SELECT step_id FROM governance_logs
             WHERE step_id IN (:ids) AND memory_anchor_id IS NOT NULL AND memory_anchor_id <> ''
            """;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final ObjectMapper objectMapper;

    public GovernanceRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.objectMapper = objectMapper;
    }

    /** @return {@code true} when the project row was created, {@code false} when updated */
    public boolean upsertProject(ImportTransaction tx, ProjectRow row) {
        tx.requireActive();
        String metadata = toJson(row.metadata());
        Timestamp importedAt = ts(Instant.now());
        return write("project " + row.projectId(), () -> {
            int updated = jdbcTemplate.update(UPDATE_PROJECT_SQL,
                row.name(), row.description(), row.programType(), row.status().getValue(),
                row.completionPercentage(), metadata, ts(row.createdAt()), ts(row.lastUpdated()),
                row.submittedBy(), importedAt, row.projectId());
            if (updated > 0) {
                return false;
            }
            jdbcTemplate.update(INSERT_PROJECT_SQL,
                row.projectId(), row.name(), row.description(), row.programType(),
                row.status().getValue(), row.completionPercentage(), metadata,
                ts(row.createdAt()), ts(row.lastUpdated()), row.submittedBy(), importedAt);
            return true;
        });
    }

    public boolean upsertPhase(ImportTransaction tx, PhaseRow row) {
        tx.requireActive();
        return write("phase " + row.phaseId(), () -> {
            int updated = jdbcTemplate.update(UPDATE_PHASE_SQL,
                row.projectId(), row.name(), row.status().getValue(),
                ts(row.startedAt()), ts(row.completedAt()), row.phaseId());
            if (updated > 0) {
                return false;
            }
            jdbcTemplate.update(INSERT_PHASE_SQL,
                row.phaseId(), row.projectId(), row.name(), row.status().getValue(),
                ts(row.startedAt()), ts(row.completedAt()));
            return true;
        });
    }

    public boolean upsertStep(ImportTransaction tx, StepRow row) {
        tx.requireActive();
        String qa = row.qaStatus() != null ? row.qaStatus().getValue() : null;
        return write("step " + row.stepId(), () -> {
            int updated = jdbcTemplate.update(UPDATE_STEP_SQL,
                row.phaseId(), row.projectId(), row.name(), row.status().getValue(),
                row.status().progress(), ts(row.startedAt()), ts(row.completedAt()),
                row.sdlcStage(), row.branchName(), row.commitId(), row.ciStatus(), qa,
                row.debugBranch(), row.issueLink(), row.pullRequest(), row.stepId());
            if (updated > 0) {
                return false;
            }
            jdbcTemplate.update(INSERT_STEP_SQL,
                row.stepId(), row.phaseId(), row.projectId(), row.name(), row.status().getValue(),
                row.status().progress(), ts(row.startedAt()), ts(row.completedAt()),
                row.sdlcStage(), row.branchName(), row.commitId(), row.ciStatus(),
                qa != null ? qa : QaStatus.NOT_RUN.getValue(),
                row.debugBranch(), row.issueLink(), row.pullRequest());
            return true;
        });
    }

    public boolean projectExists(ImportTransaction tx, String projectId) {
        tx.requireActive();
        return exists("SELECT COUNT(*) FROM projects WHERE project_id = ?", projectId);
    }

    public boolean phaseExists(ImportTransaction tx, String projectId, String phaseId) {
        tx.requireActive();
        return exists("SELECT COUNT(*) FROM phases WHERE project_id = ? AND phase_id = ?",
            projectId, phaseId);
    }

    /**
     * Reads a step on the transaction's connection, so steps written earlier in the same
     * import are visible.
     */
    public Optional<StepState> findStep(ImportTransaction tx, String stepId) {
        tx.requireActive();
        try {
            List<StepState> rows = jdbcTemplate.query(SELECT_STEP_SQL, (rs, i) -> new StepState(
                rs.getString("step_id"),
                rs.getString("phase_id"),
                rs.getString("project_id"),
                stepStatus(rs.getString("status")),
                qaStatus(rs.getString("qa_status"))
            ), stepId);
            return rows.stream().findFirst();
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to read step " + stepId + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Inserts a new anchor, or updates only the status of an existing one.
     *
     * @return {@code true} when the anchor row was created
     */
    public boolean upsertAnchor(ImportTransaction tx, AnchorRow row) {
        tx.requireActive();
        String tags = toJson(row.tags());
        return write("memory anchor " + row.anchorId(), () -> {
            int updated = jdbcTemplate.update(UPDATE_ANCHOR_STATUS_SQL, row.status(), row.anchorId());
            if (updated > 0) {
                return false;
            }
            jdbcTemplate.update(INSERT_ANCHOR_SQL,
                row.anchorId(), row.linkedStepId(), row.status(), row.anchorType(), row.content(),
                tags, ts(row.createdAt() != null ? row.createdAt() : Instant.now()));
            return true;
        });
    }

    /**
     * Steps among {@code stepIds} that carry a memory anchor, either as an anchor row or
     * through a governance log naming one.
     */
    public Set<String> anchoredStepIds(ImportTransaction tx, Collection<String> stepIds) {
        tx.requireActive();
        if (stepIds.isEmpty()) {
            return Set.of();
        }
        try {
            List<String> ids = namedJdbcTemplate.queryForList(ANCHORED_STEPS_SQL,
                new MapSqlParameterSource("ids", stepIds), String.class);
            return new HashSet<>(ids);
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to read memory anchors: " + ex.getMessage(), ex);
        }
    }

    /** Row count of one of the governance tables, outside any import transaction. */
    public long countRows(String table) {
        if (!COUNTABLE_TABLES.contains(table)) {
            throw new IllegalArgumentException("unknown table: " + table);
        }
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count != null ? count : 0L;
    }

    private boolean exists(String sql, Object... args) {
        try {
            Long count = jdbcTemplate.queryForObject(sql, Long.class, args);
            return count != null && count > 0;
        } catch (DataAccessException ex) {
            throw new PersistenceException("existence check failed: " + ex.getMessage(), ex);
        }
    }

    private boolean write(String what, WriteAction action) {
        try {
            boolean created = action.run();
            log.debug("{} {}", created ? "Inserted" : "Updated", what);
            return created;
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to write " + what + ": " + ex.getMessage(), ex);
        }
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new PersistenceException("value is not serializable: " + ex.getMessage(), ex);
        }
    }

    private static Timestamp ts(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static StepStatus stepStatus(String stored) {
        for (StepStatus status : StepStatus.values()) {
            if (status.getValue().equals(stored)) {
                return status;
            }
        }
        return StepStatus.NOT_STARTED;
    }

    private static QaStatus qaStatus(String stored) {
        for (QaStatus status : QaStatus.values()) {
            if (status.getValue().equals(stored)) {
                return status;
            }
        }
        return QaStatus.NOT_RUN;
    }

    @FunctionalInterface
    private interface WriteAction {
        boolean run();
    }

    public record ProjectRow(
        String projectId,
        String name,
        String description,
        String programType,
        WorkStatus status,
        int completionPercentage,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant lastUpdated,
        String submittedBy
    ) {
    }

    public record PhaseRow(
        String phaseId,
        String projectId,
        String name,
        WorkStatus status,
        Instant startedAt,
        Instant completedAt
    ) {
    }

    public record StepRow(
        String stepId,
        String phaseId,
        String projectId,
        String name,
        StepStatus status,
        Instant startedAt,
        Instant completedAt,
        String sdlcStage,
        String branchName,
        String commitId,
        String ciStatus,
        QaStatus qaStatus,
        String debugBranch,
        String issueLink,
        String pullRequest
    ) {
    }

    public record AnchorRow(
        String anchorId,
        String linkedStepId,
        String status,
        String anchorType,
        String content,
        List<String> tags,
        Instant createdAt
    ) {
    }

    /** Persisted state of a step as seen inside the current transaction. */
    public record StepState(
        String stepId,
        String phaseId,
        String projectId,
        StepStatus status,
        QaStatus qaStatus
    ) {

        public boolean isCompletedWithQaPassed() {
            return status == StepStatus.COMPLETED && qaStatus == QaStatus.PASSED;
        }
    }
}
