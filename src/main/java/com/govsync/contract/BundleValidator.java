package com.govsync.contract;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Structural validation of inbound import requests.
 *
 * Pure function over the JSON tree: required fields present and typed, arrays present,
 * timestamps parseable. Cross-entity existence is checked later by the importer because
 * it needs database state. Every failure names the field path and the offending value.
 */
@Component
public class BundleValidator {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    // strictest first; offset-less values are read as UTC
    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
        Instant::parse,
        raw -> OffsetDateTime.parse(raw).toInstant(),
        raw -> LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC),
        raw -> LocalDate.parse(raw).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    private final ObjectMapper objectMapper;

    public BundleValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ProjectBundle validateProjectBundle(JsonNode payload) {
        requireObject(payload, "", "payload must be a JSON object");

        JsonNode project = payload.get("project");
        if (project == null || project.isNull()) {
            throw new ImportValidationException("missing required field: project", "project", null);
        }
        requireObject(project, "project", "project must be an object");

        List<PhaseData> phases = new ArrayList<>();
        JsonNode phaseNodes = requireArray(project, "phases", "project");
        for (int i = 0; i < phaseNodes.size(); i++) {
            phases.add(phase(phaseNodes.get(i), "project.phases[" + i + "]"));
        }

        ProjectData projectData = new ProjectData(
            requireString(project, "projectId", "project"),
            requireString(project, "name", "project"),
            optionalString(project, "description", "project"),
            optionalString(project, "programType", "project"),
            requireString(project, "status", "project"),
            optionalTimestamp(project, "createdAt", "project"),
            optionalTimestamp(project, "lastUpdated", "project"),
            optionalObject(project, "metadata", "project"),
            phases
        );

        // "oAppMeta" is the legacy name of the submission envelope
        JsonNode metaNode = payload.hasNonNull("meta") ? payload.get("meta") : payload.get("oAppMeta");
        String metaPath = payload.hasNonNull("meta") ? "meta" : "oAppMeta";
        SubmissionMeta meta = metaNode == null || metaNode.isNull() ? null : meta(metaNode, metaPath);

        List<MemoryAnchorData> anchors = new ArrayList<>();
        if (payload.hasNonNull("memoryAnchors")) {
            JsonNode anchorNodes = requireArray(payload, "memoryAnchors", "");
            for (int i = 0; i < anchorNodes.size(); i++) {
                anchors.add(memoryAnchor(anchorNodes.get(i), "memoryAnchors[" + i + "]"));
            }
        }

        return new ProjectBundle(projectData, meta, anchors);
    }

    public PhaseBatch validatePhaseBatch(JsonNode payload) {
        requireObject(payload, "", "payload must be a JSON object");
        String projectId = requireString(payload, "projectId", "");
        JsonNode phaseNodes = requireNonEmptyArray(payload, "phases", "");
        List<PhaseData> phases = new ArrayList<>();
        for (int i = 0; i < phaseNodes.size(); i++) {
            phases.add(phase(phaseNodes.get(i), "phases[" + i + "]"));
        }
        return new PhaseBatch(projectId, phases, optionalString(payload, "submittedBy", ""));
    }

    public StepBatch validateStepBatch(JsonNode payload) {
        requireObject(payload, "", "payload must be a JSON object");
        String projectId = requireString(payload, "projectId", "");
        String phaseId = requireString(payload, "phaseId", "");
        JsonNode stepNodes = requireNonEmptyArray(payload, "phaseSteps", "");
        List<StepData> steps = new ArrayList<>();
        for (int i = 0; i < stepNodes.size(); i++) {
            steps.add(step(stepNodes.get(i), "phaseSteps[" + i + "]"));
        }
        return new StepBatch(projectId, phaseId, steps, optionalString(payload, "submittedBy", ""));
    }

    public GovernanceLogBatch validateGovernanceLogBatch(JsonNode payload) {
        requireObject(payload, "", "payload must be a JSON object");
        String projectId = requireString(payload, "projectId", "");
        String stepId = requireString(payload, "phaseStepId", "");
        JsonNode logNodes = requireNonEmptyArray(payload, "governanceLogs", "");
        List<GovernanceLogData> logs = new ArrayList<>();
        for (int i = 0; i < logNodes.size(); i++) {
            logs.add(governanceLog(logNodes.get(i), "governanceLogs[" + i + "]"));
        }
        return new GovernanceLogBatch(projectId, stepId, logs, optionalString(payload, "submittedBy", ""));
    }

    public MemoryAnchorBatch validateMemoryAnchorBatch(JsonNode payload) {
        requireObject(payload, "", "payload must be a JSON object");
        JsonNode anchorNodes = requireNonEmptyArray(payload, "memoryAnchors", "");
        List<MemoryAnchorData> anchors = new ArrayList<>();
        for (int i = 0; i < anchorNodes.size(); i++) {
            anchors.add(memoryAnchor(anchorNodes.get(i), "memoryAnchors[" + i + "]"));
        }
        return new MemoryAnchorBatch(anchors, optionalString(payload, "submittedBy", ""));
    }

    private PhaseData phase(JsonNode node, String path) {
        requireObject(node, path, "phase must be an object");
        JsonNode stepNodes = requireArray(node, "phaseSteps", path);
        List<StepData> steps = new ArrayList<>();
        for (int i = 0; i < stepNodes.size(); i++) {
            steps.add(step(stepNodes.get(i), path + ".phaseSteps[" + i + "]"));
        }
        return new PhaseData(
            requireString(node, "phaseId", path),
            requireString(node, "name", path),
            requireString(node, "status", path),
            optionalTimestamp(node, "startedAt", path),
            optionalTimestamp(node, "completedAt", path),
            steps
        );
    }

    private StepData step(JsonNode node, String path) {
        requireObject(node, path, "phase step must be an object");
        JsonNode logNodes = requireArray(node, "governanceLogs", path);
        List<GovernanceLogData> logs = new ArrayList<>();
        for (int i = 0; i < logNodes.size(); i++) {
            logs.add(governanceLog(logNodes.get(i), path + ".governanceLogs[" + i + "]"));
        }
        return new StepData(
            requireString(node, "stepId", path),
            requireString(node, "name", path),
            requireString(node, "status", path),
            optionalTimestamp(node, "startedAt", path),
            optionalTimestamp(node, "completedAt", path),
            optionalString(node, "sdlcStage", path),
            optionalString(node, "branchName", path),
            optionalString(node, "commitId", path),
            optionalString(node, "ciStatus", path),
            optionalString(node, "qaStatus", path),
            optionalString(node, "debugBranch", path),
            optionalString(node, "issueLink", path),
            optionalString(node, "pullRequest", path),
            logs
        );
    }

    private GovernanceLogData governanceLog(JsonNode node, String path) {
        requireObject(node, path, "governance log must be an object");
        return new GovernanceLogData(
            requireString(node, "logId", path),
            requireString(node, "entryType", path),
            requireString(node, "summary", path),
            requireTimestamp(node, "timestamp", path),
            optionalString(node, "memoryAnchor", path),
            optionalObject(node, "details", path)
        );
    }

    private MemoryAnchorData memoryAnchor(JsonNode node, String path) {
        requireObject(node, path, "memory anchor must be an object");
        return new MemoryAnchorData(
            requireString(node, "anchorId", path),
            requireString(node, "linkedPhaseStepId", path),
            requireString(node, "status", path),
            optionalString(node, "anchorType", path),
            optionalString(node, "content", path),
            optionalStringList(node, "tags", path),
            optionalTimestamp(node, "createdAt", path)
        );
    }

    private SubmissionMeta meta(JsonNode node, String path) {
        requireObject(node, path, path + " must be an object");
        JsonNode tags = requireArray(node, "tags", path);
        List<String> tagValues = new ArrayList<>();
        for (int i = 0; i < tags.size(); i++) {
            JsonNode tag = tags.get(i);
            if (!tag.isTextual()) {
                throw new ImportValidationException(path + ".tags must contain strings",
                    path + ".tags[" + i + "]", tag.toString());
            }
            tagValues.add(tag.asText());
        }
        return new SubmissionMeta(
            optionalString(node, "submissionType", path),
            requireString(node, "submittedBy", path),
            requireTimestamp(node, "submissionTimestamp", path),
            optionalString(node, "targetSystem", path),
            optionalString(node, "priority", path),
            tagValues
        );
    }

    private void requireObject(JsonNode node, String path, String message) {
        if (node == null || !node.isObject()) {
            throw new ImportValidationException(message, path.isEmpty() ? null : path, render(node));
        }
    }

    private String requireString(JsonNode parent, String field, String path) {
        JsonNode value = parent.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ImportValidationException(
                fieldPath(path, field) + " is required and must be a non-blank string",
                fieldPath(path, field), render(value));
        }
        return value.asText();
    }

    private String optionalString(JsonNode parent, String field, String path) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ImportValidationException(fieldPath(path, field) + " must be a string",
                fieldPath(path, field), render(value));
        }
        return value.asText().isBlank() ? null : value.asText();
    }

    private JsonNode requireArray(JsonNode parent, String field, String path) {
        JsonNode value = parent.get(field);
        if (value == null || !value.isArray()) {
            throw new ImportValidationException(fieldPath(path, field) + " must be an array",
                fieldPath(path, field), render(value));
        }
        return value;
    }

    private JsonNode requireNonEmptyArray(JsonNode parent, String field, String path) {
        JsonNode value = requireArray(parent, field, path);
        if (value.isEmpty()) {
            throw new ImportValidationException(fieldPath(path, field) + " must contain at least 1 entry",
                fieldPath(path, field), render(value));
        }
        return value;
    }

    private Map<String, Object> optionalObject(JsonNode parent, String field, String path) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) {
            return Map.of();
        }
        if (!value.isObject()) {
            throw new ImportValidationException(fieldPath(path, field) + " must be an object",
                fieldPath(path, field), render(value));
        }
        return objectMapper.convertValue(value, MAP_TYPE);
    }

    private List<String> optionalStringList(JsonNode parent, String field, String path) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new ImportValidationException(fieldPath(path, field) + " must be an array",
                fieldPath(path, field), render(value));
        }
        List<String> result = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new ImportValidationException(fieldPath(path, field) + " must contain strings",
                    fieldPath(path, field), render(value));
            }
            result.add(item.asText());
        }
        return result;
    }

    private Instant requireTimestamp(JsonNode parent, String field, String path) {
        String raw = requireString(parent, field, path);
        return parseTimestamp(raw, fieldPath(path, field));
    }

    private Instant optionalTimestamp(JsonNode parent, String field, String path) {
        String raw = optionalString(parent, field, path);
        return raw == null ? null : parseTimestamp(raw, fieldPath(path, field));
    }

    static Instant parseTimestamp(String raw, String fieldPath) {
        DateTimeParseException lastFailure = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(raw);
            } catch (DateTimeParseException ex) {
                lastFailure = ex;
            }
        }
        ImportValidationException invalid = new ImportValidationException(
            fieldPath + " must be a valid ISO-8601 timestamp", fieldPath, raw);
        invalid.initCause(lastFailure);
        throw invalid;
    }

    private static String fieldPath(String path, String field) {
        return path.isEmpty() ? field : path + "." + field;
    }

    private static String render(JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return null;
        }
        return value.isTextual() ? value.asText() : value.toString();
    }
}
