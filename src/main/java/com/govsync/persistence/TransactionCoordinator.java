package com.govsync.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.util.UUID;
import java.util.function.Function;

/**
 * Opens, commits and rolls back the single transaction that spans one import.
 *
 * Each handle gets its own connection (REQUIRES_NEW) at READ_COMMITTED, so concurrent
 * imports never share a transaction while reads inside one import see its own writes.
 */
@Component
public class TransactionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TransactionCoordinator.class);

    private final PlatformTransactionManager transactionManager;

    public TransactionCoordinator(PlatformTransactionManager transactionManager) {
        this.transactionManager = transactionManager;
    }

    public ImportTransaction begin() {
        DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
        definition.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        definition.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        try {
            TransactionStatus status = transactionManager.getTransaction(definition);
            ImportTransaction tx = new ImportTransaction(UUID.randomUUID().toString(), status);
            log.debug("Began transaction {}", tx.id());
            return tx;
        } catch (TransactionException ex) {
            throw new PersistenceException("could not open transaction: " + ex.getMessage(), ex);
        }
    }

    public void commit(ImportTransaction tx) {
        tx.requireActive();
        tx.markCompleted();
        try {
            transactionManager.commit(tx.status());
            log.debug("Committed transaction {}", tx.id());
        } catch (TransactionException ex) {
            throw new PersistenceException("commit failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Rolls back an open handle. A handle that already completed (including one whose
     * commit failed, which Spring rolls back itself) is left alone.
     */
    public void rollback(ImportTransaction tx) {
        if (!tx.markCompleted()) {
            log.debug("Rollback skipped, transaction {} already completed", tx.id());
            return;
        }
        try {
            transactionManager.rollback(tx.status());
            log.info("Rolled back transaction {}", tx.id());
        } catch (TransactionException ex) {
            throw new PersistenceException("rollback failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Runs {@code work} in a fresh transaction: commit on normal return, rollback on any
     * runtime exception, which is then rethrown unchanged.
     */
    public <T> T inTransaction(Function<ImportTransaction, T> work) {
        ImportTransaction tx = begin();
        T result;
        try {
            result = work.apply(tx);
        } catch (RuntimeException ex) {
            rollbackAfterFailure(tx, ex);
            throw ex;
        }
        commit(tx);
        return result;
    }

    private void rollbackAfterFailure(ImportTransaction tx, RuntimeException cause) {
        try {
            rollback(tx);
        } catch (PersistenceException rollbackFailure) {
            log.error("Rollback of transaction {} failed", tx.id(), rollbackFailure);
            cause.addSuppressed(rollbackFailure);
        }
    }
}
