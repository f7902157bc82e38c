package com.govsync.persistence;

import org.springframework.transaction.TransactionStatus;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Opaque handle for one open database transaction.
 *
 * The underlying connection is bound to the thread that called
 * {@link TransactionCoordinator#begin()}, so the handle is only usable from that thread
 * and only until it is committed or rolled back.
 */
public final class ImportTransaction {

    private final String id;
    private final TransactionStatus status;
    private final Thread owner;
    private final AtomicBoolean completed = new AtomicBoolean(false);

    ImportTransaction(String id, TransactionStatus status) {
        this.id = id;
        this.status = status;
        this.owner = Thread.currentThread();
    }

    public String id() {
        return id;
    }

    TransactionStatus status() {
        return status;
    }

    public boolean isActive() {
        return !completed.get();
    }

    /**
     * Guards every repository call: writes against a finished handle, or from a thread
     * that does not hold the connection, are rejected.
     */
    public void requireActive() {
        if (completed.get()) {
            throw new IllegalStateException("transaction " + id + " is already completed");
        }
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("transaction " + id + " belongs to thread " + owner.getName());
        }
    }

    boolean markCompleted() {
        return completed.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "ImportTransaction[" + id + (isActive() ? ", active" : ", completed") + "]";
    }
}
