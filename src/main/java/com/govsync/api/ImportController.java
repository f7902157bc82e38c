package com.govsync.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.govsync.importer.ImportResult;
import com.govsync.importer.ImportService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/import")
public class ImportController {

    private final ImportService importService;

    public ImportController(ImportService importService) {
        this.importService = importService;
    }

    @PostMapping("/projects")
    @ResponseStatus(HttpStatus.CREATED)
    public ImportResult importProject(@RequestBody JsonNode payload) {
        return importService.importProject(payload);
    }

    @PostMapping("/memory-anchors")
    @ResponseStatus(HttpStatus.CREATED)
    public ImportResult importMemoryAnchors(@RequestBody JsonNode payload) {
        return importService.importMemoryAnchors(payload);
    }

    @PostMapping("/phases")
    @ResponseStatus(HttpStatus.CREATED)
    public ImportResult importPhases(@RequestBody JsonNode payload) {
        return importService.importPhases(payload);
    }

    @PostMapping("/steps")
    @ResponseStatus(HttpStatus.CREATED)
    public ImportResult importSteps(@RequestBody JsonNode payload) {
        return importService.importSteps(payload);
    }

    @PostMapping("/governance-logs")
    @ResponseStatus(HttpStatus.CREATED)
    public ImportResult importGovernanceLogs(@RequestBody JsonNode payload) {
        return importService.importGovernanceLogs(payload);
    }
}
