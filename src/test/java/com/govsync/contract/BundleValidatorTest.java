package com.govsync.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class BundleValidatorTest {

    private ObjectMapper mapper;
    private BundleValidator validator;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        validator = new BundleValidator(mapper);
    }

    @Nested
    @DisplayName("Project bundle")
    class ProjectBundles {

        @Test
        void minimalBundle_isAccepted() throws Exception {
            ProjectBundle bundle = validator.validateProjectBundle(mapper.readTree(minimalBundle()));

            assertEquals("P1", bundle.project().projectId());
            assertEquals(1, bundle.project().phases().size());
            assertEquals(1, bundle.stepCount());
            assertEquals("alice", bundle.submittedBy());
            assertEquals(Instant.parse("2024-01-01T00:00:00Z"), bundle.meta().submissionTimestamp());
            GovernanceLogData log = bundle.project().phases().get(0).phaseSteps().get(0).governanceLogs().get(0);
            assertEquals("Review", log.entryType());
        }

        @Test
        void missingProject_namesTheField() throws Exception {
            ImportValidationException ex = assertThrows(ImportValidationException.class,
                () -> validator.validateProjectBundle(mapper.readTree("{\"meta\":null}")));
            assertEquals("project", ex.getField());
            assertEquals("validation", ex.kind());
        }

        @Test
        void nestedMissingField_reportsFullPath() throws Exception {
            ObjectNode root = (ObjectNode) mapper.readTree(minimalBundle());
            ((ObjectNode) root.at("/project/phases/0/phaseSteps/0")).remove("stepId");

            ImportValidationException ex = assertThrows(ImportValidationException.class,
                () -> validator.validateProjectBundle(root));
            assertEquals("project.phases[0].phaseSteps[0].stepId", ex.getField());
        }

        @Test
        void badTimestamp_reportsFieldAndValue() throws Exception {
            ObjectNode root = (ObjectNode) mapper.readTree(minimalBundle());
            ((ObjectNode) root.at("/project/phases/0/phaseSteps/0/governanceLogs/0")).put("timestamp", "yesterday");

            ImportValidationException ex = assertThrows(ImportValidationException.class,
                () -> validator.validateProjectBundle(root));
            assertEquals("project.phases[0].phaseSteps[0].governanceLogs[0].timestamp", ex.getField());
            assertEquals("yesterday", ex.getValue());
        }

        @Test
        void metaWithoutTags_isRejected() throws Exception {
            ObjectNode root = (ObjectNode) mapper.readTree(minimalBundle());
            ((ObjectNode) root.get("meta")).remove("tags");

            ImportValidationException ex = assertThrows(ImportValidationException.class,
                () -> validator.validateProjectBundle(root));
            assertEquals("meta.tags", ex.getField());
        }

        @Test
        void legacyMetaName_isAccepted() throws Exception {
            ObjectNode root = (ObjectNode) mapper.readTree(minimalBundle());
            root.set("oAppMeta", root.remove("meta"));

            ProjectBundle bundle = validator.validateProjectBundle(root);
            assertEquals("alice", bundle.submittedBy());
        }

        @Test
        void absentMeta_isAllowed() throws Exception {
            ObjectNode root = (ObjectNode) mapper.readTree(minimalBundle());
            root.remove("meta");

            ProjectBundle bundle = validator.validateProjectBundle(root);
            assertNull(bundle.meta());
            assertNull(bundle.submittedBy());
        }

        @Test
        void blankOptionalStrings_becomeNull() throws Exception {
            ObjectNode root = (ObjectNode) mapper.readTree(minimalBundle());
            ((ObjectNode) root.at("/project/phases/0/phaseSteps/0")).put("branchName", "  ");

            ProjectBundle bundle = validator.validateProjectBundle(root);
            assertNull(bundle.project().phases().get(0).phaseSteps().get(0).branchName());
        }

        @Test
        void nonArrayPhases_isRejected() throws Exception {
            ObjectNode root = (ObjectNode) mapper.readTree(minimalBundle());
            ((ObjectNode) root.get("project")).put("phases", "none");

            ImportValidationException ex = assertThrows(ImportValidationException.class,
                () -> validator.validateProjectBundle(root));
            assertEquals("project.phases", ex.getField());
            assertEquals("none", ex.getValue());
        }
    }

    @Nested
    @DisplayName("Batches")
    class Batches {

        @Test
        void emptyPhaseBatch_isRejected() throws Exception {
            JsonNode payload = mapper.readTree("{\"projectId\":\"P1\",\"phases\":[]}");
            ImportValidationException ex = assertThrows(ImportValidationException.class,
                () -> validator.validatePhaseBatch(payload));
            assertEquals("phases", ex.getField());
        }

        @Test
        void stepBatch_requiresPhaseId() throws Exception {
            JsonNode payload = mapper.readTree("""
                {"projectId":"P1","phaseSteps":[{"stepId":"S1","name":"s","status":"Active","governanceLogs":[]}]}
                """);
            ImportValidationException ex = assertThrows(ImportValidationException.class,
                () -> validator.validateStepBatch(payload));
            assertEquals("phaseId", ex.getField());
        }

        @Test
        void governanceLogBatch_parsesEntries() throws Exception {
            JsonNode payload = mapper.readTree("""
                {"projectId":"P1","phaseStepId":"S1","submittedBy":"bob",
                 "governanceLogs":[{"logId":"L9","entryType":"Decision","summary":"go",
                                    "timestamp":"2024-02-01T10:00:00","details":{"k":"v"}}]}
                """);
            GovernanceLogBatch batch = validator.validateGovernanceLogBatch(payload);
            assertEquals("S1", batch.phaseStepId());
            assertEquals("bob", batch.submittedBy());
            assertEquals(Instant.parse("2024-02-01T10:00:00Z"), batch.governanceLogs().get(0).timestamp());
            assertEquals("v", batch.governanceLogs().get(0).details().get("k"));
        }

        @Test
        void anchorBatch_rejectsNonStringTags() throws Exception {
            JsonNode payload = mapper.readTree("""
                {"memoryAnchors":[{"anchorId":"A1","linkedPhaseStepId":"S1","status":"active","tags":[1]}]}
                """);
            ImportValidationException ex = assertThrows(ImportValidationException.class,
                () -> validator.validateMemoryAnchorBatch(payload));
            assertEquals("memoryAnchors[0].tags", ex.getField());
        }
    }

    @Nested
    @DisplayName("Timestamps")
    class Timestamps {

        @Test
        void acceptsIsoShapes() {
            Instant expected = Instant.parse("2024-03-01T12:00:00Z");
            assertEquals(expected, BundleValidator.parseTimestamp("2024-03-01T12:00:00Z", "t"));
            assertEquals(expected, BundleValidator.parseTimestamp("2024-03-01T14:00:00+02:00", "t"));
            assertEquals(expected, BundleValidator.parseTimestamp("2024-03-01T12:00:00", "t"));
            assertEquals(Instant.parse("2024-03-01T00:00:00Z"), BundleValidator.parseTimestamp("2024-03-01", "t"));
        }

        @Test
        void rejectsGarbage() {
            ImportValidationException ex = assertThrows(ImportValidationException.class,
                () -> BundleValidator.parseTimestamp("03/01/2024", "meta.submissionTimestamp"));
            assertEquals("meta.submissionTimestamp", ex.getField());
            assertNotNull(ex.getCause());
        }
    }

    static String minimalBundle() {
        return """
            {
              "project": {
                "projectId": "P1",
                "name": "Project One",
                "status": "Active",
                "phases": [{
                  "phaseId": "PH1",
                  "name": "Build",
                  "status": "Active",
                  "phaseSteps": [{
                    "stepId": "S1",
                    "name": "Implement",
                    "status": "Complete",
                    "qaStatus": "Pass",
                    "governanceLogs": [{
                      "logId": "L1",
                      "entryType": "Review",
                      "summary": "Reviewed",
                      "timestamp": "2024-01-01T00:00:00Z"
                    }]
                  }]
                }]
              },
              "meta": {
                "submittedBy": "alice",
                "submissionTimestamp": "2024-01-01T00:00:00Z",
                "tags": ["sync"]
              }
            }
            """;
    }
}
