package com.govsync.api;

import com.govsync.bus.ChangeFeedPage;
import com.govsync.bus.GovernanceLogBus;
import com.govsync.bus.GovernanceLogDraft;
import com.govsync.bus.GovernanceLogEntry;
import com.govsync.bus.GovernanceLogNotFoundException;
import com.govsync.bus.GovernanceLogQuery;
import com.govsync.bus.GovernanceLogService;
import com.govsync.contract.StatusMapper;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

@RestController
@RequestMapping("/v1/governance-logs")
public class GovernanceLogController {

    private final GovernanceLogService service;
    private final GovernanceLogBus bus;
    private final GovernanceLogStreamService streamService;

    public GovernanceLogController(GovernanceLogService service,
                                   GovernanceLogBus bus,
                                   GovernanceLogStreamService streamService) {
        this.service = service;
        this.bus = bus;
        this.streamService = streamService;
    }

    @GetMapping
    public List<GovernanceLogEntry> list(@RequestParam(required = false) String projectId,
                                         @RequestParam(required = false) String phaseId,
                                         @RequestParam(required = false) String stepId,
                                         @RequestParam(required = false) String entryType,
                                         @RequestParam(required = false) String actor,
                                         @RequestParam(defaultValue = "100") int limit) {
        return service.list(new GovernanceLogQuery(
            projectId,
            phaseId,
            stepId,
            entryType != null ? StatusMapper.entryType(entryType) : null,
            actor,
            Math.min(limit, 1000)
        ));
    }

    @GetMapping("/{id}")
    public GovernanceLogEntry get(@PathVariable String id) {
        return service.find(id).orElseThrow(() -> new GovernanceLogNotFoundException(id));
    }

    /** Polling feed: committed mutations with a sequence above {@code after}. */
    @GetMapping("/changes")
    public ChangeFeedPage changes(@RequestParam(defaultValue = "0") long after,
                                  @RequestParam(defaultValue = "500") int limit) {
        return new ChangeFeedPage(bus.since(after, Math.min(limit, 1000)),
            bus.latestSequence(), bus.oldestRetainedSequence());
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestHeader(value = "Last-Event-ID", required = false) Long lastEventId,
                             @RequestParam(required = false) Long after) {
        long cursor = lastEventId != null ? lastEventId : after != null ? after : bus.latestSequence();
        return streamService.createEmitter(cursor);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public GovernanceLogEntry create(@RequestBody GovernanceLogDraft draft) {
        return service.create(draft);
    }

    @PutMapping("/{id}")
    public GovernanceLogEntry update(@PathVariable String id, @RequestBody GovernanceLogDraft draft) {
        return service.update(id, draft);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        service.delete(id);
    }
}
