package com.govsync.api;

import com.govsync.audit.ChainVerification;
import com.govsync.audit.ImportAuditLog;
import com.govsync.audit.ImportRecord;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Read-only view of the import audit trail. */
@RestController
@RequestMapping("/v1/imports/audit")
public class AuditController {

    private final ImportAuditLog auditLog;

    public AuditController(ImportAuditLog auditLog) {
        this.auditLog = auditLog;
    }

    @GetMapping
    public List<ImportRecord> recent(@RequestParam(defaultValue = "20") int limit) {
        return auditLog.recent(limit);
    }

    @GetMapping("/verify")
    public ChainVerification verify() {
        return auditLog.verifyChain();
    }
}
