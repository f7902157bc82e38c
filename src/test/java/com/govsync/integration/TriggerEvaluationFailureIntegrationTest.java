package com.govsync.integration;

import com.govsync.audit.ImportAuditLog;
import com.govsync.audit.ImportRecord;
import com.govsync.audit.ImportStatus;
import com.govsync.importer.ImportResult;
import com.govsync.importer.ImportService;
import com.govsync.persistence.GovernanceRepository;
import com.govsync.persistence.TransactionCoordinator;
import com.govsync.trigger.AutomationTriggerEvaluator;
import com.govsync.trigger.TriggerOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static com.govsync.integration.ImportFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Trigger evaluation that blows up as a whole after commit: the import still reports success,
 * every agent carries the error and exactly one partial audit record is written.
 */
@SpringBootTest
class TriggerEvaluationFailureIntegrationTest {

    @MockBean AutomationTriggerEvaluator triggers;

    @Autowired ImportService importService;
    @Autowired GovernanceRepository repository;
    @Autowired TransactionCoordinator transactions;
    @Autowired ImportAuditLog auditLog;

    @Test
    @DisplayName("Rejected trigger evaluation keeps the committed import and audits it as partial")
    void rejectedEvaluationIsContained() {
        when(triggers.evaluate(any(), anyString()))
            .thenThrow(new RejectedExecutionException("automation queue full"));
        when(triggers.agents()).thenReturn(List.of("SideQuestDetector", "AutoAuditAgent", "MemoryAnchorAgent"));
        String s = suffix();

        ImportResult result = importService.importProject(readyProject(s));

        assertTrue(result.success());
        assertEquals(3, result.agentTriggers().size());
        assertTrue(result.agentTriggers().stream().allMatch(TriggerOutcome::failed));
        assertEquals("automation queue full", result.agentTriggers().get(0).error());
        assertTrue(transactions.inTransaction(tx -> repository.findStep(tx, "S-" + s)).isPresent());

        List<ImportRecord> records = auditLog.recent(50).stream()
            .filter(record -> record.fingerprint().equals(result.payloadHash()))
            .toList();
        assertEquals(1, records.size());
        assertEquals(ImportStatus.PARTIAL, records.get(0).status());
    }
}
