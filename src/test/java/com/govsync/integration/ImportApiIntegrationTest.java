package com.govsync.integration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static com.govsync.integration.ImportFixtures.*;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP surface: status codes, response bodies and the error envelope.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ImportApiIntegrationTest {

    @Autowired MockMvc mvc;

    @Test
    @DisplayName("Project import returns 201 with counts and trigger outcomes")
    void projectImportCreated() throws Exception {
        String s = suffix();
        mvc.perform(post("/v1/import/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content(readyProject(s).toString()))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.projectId").value("P-" + s))
            .andExpect(jsonPath("$.recordsImported.total").value(2))
            .andExpect(jsonPath("$.agentTriggers", hasSize(3)))
            .andExpect(jsonPath("$.payloadHash").isString())
            .andExpect(jsonPath("$.anchorIds").doesNotExist());
    }

    @Test
    @DisplayName("Validation failure returns 400 with field path and payload hash")
    void validationFailure() throws Exception {
        ObjectNode bundle = (ObjectNode) readyProject(suffix());
        ((ObjectNode) bundle.get("project")).remove("name");

        mvc.perform(post("/v1/import/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content(bundle.toString()))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error.kind").value("validation"))
            .andExpect(jsonPath("$.error.field").value("project.name"))
            .andExpect(jsonPath("$.payloadHash").isString());
    }

    @Test
    @DisplayName("Unparseable body returns 400 validation")
    void malformedJson() throws Exception {
        mvc.perform(post("/v1/import/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.kind").value("validation"));
    }

    @Test
    @DisplayName("Anchor on a missing step returns 422 precondition")
    void anchorPrecondition() throws Exception {
        String s = suffix();
        mvc.perform(post("/v1/import/memory-anchors")
                .contentType(MediaType.APPLICATION_JSON)
                .content(anchors("A-" + s, "MISSING-" + s).toString()))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error.kind").value("precondition"))
            .andExpect(jsonPath("$.error.value").value("MISSING-" + s));
    }

    @Test
    @DisplayName("Audit trail lists recent records and verifies the chain")
    void auditEndpoints() throws Exception {
        mvc.perform(post("/v1/import/projects")
                .contentType(MediaType.APPLICATION_JSON)
                .content(readyProject(suffix()).toString()))
            .andExpect(status().isCreated());

        mvc.perform(get("/v1/imports/audit").param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].operation").value("project-import"))
            .andExpect(jsonPath("$[0].status").value("success"));

        mvc.perform(get("/v1/imports/audit/verify"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true));
    }

    @Test
    @DisplayName("Governance log CRUD over HTTP")
    void governanceLogCrud() throws Exception {
        String body = """
            {"entryType":"Decision","summary":"Adopt H2 for tests","actor":"carol","projectId":"P-crud"}
            """;
        String created = mvc.perform(post("/v1/governance-logs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.entryType").value("decision"))
            .andExpect(jsonPath("$.source").value("api"))
            .andReturn().getResponse().getContentAsString();
        String id = json(created).get("id").asText();

        mvc.perform(put("/v1/governance-logs/" + id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body.replace("Adopt H2 for tests", "Adopt H2 everywhere")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary").value("Adopt H2 everywhere"));

        mvc.perform(get("/v1/governance-logs").param("projectId", "P-crud"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value(id));

        mvc.perform(delete("/v1/governance-logs/" + id))
            .andExpect(status().isNoContent());

        mvc.perform(get("/v1/governance-logs/" + id))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.kind").value("not-found"));
    }

    @Test
    @DisplayName("Change feed reports committed mutations after a cursor")
    void changeFeed() throws Exception {
        String created = mvc.perform(post("/v1/governance-logs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"entryType\":\"Review\",\"summary\":\"feed check\"}"))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        String id = json(created).get("id").asText();

        String page = mvc.perform(get("/v1/governance-logs/changes").param("after", "0").param("limit", "1000"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        long latest = json(page).get("latestSequence").asLong();

        mvc.perform(get("/v1/governance-logs/changes").param("after", String.valueOf(latest - 1)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.events", hasSize(1)))
            .andExpect(jsonPath("$.events[0].type").value("created"))
            .andExpect(jsonPath("$.events[0].log.id").value(id));
    }
}
