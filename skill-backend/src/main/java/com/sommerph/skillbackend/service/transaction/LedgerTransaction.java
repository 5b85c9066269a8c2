package com.sommerph.skillbackend.service.transaction;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Undo journal for one atomic ledger change. Every store write registers the write that reverses
 * it; rollback replays those in reverse order. Entity locks taken through the transaction stay
 * held until it completes, so no other writer observes or builds on a change that may still be
 * rolled back. Events are queued and only handed out on commit.
 * <p>
 * Confined to the thread that created it.
 */
@Slf4j
public class LedgerTransaction {

    private final EntityLockManager lockManager;
    private final Deque<Runnable> undoLog = new ArrayDeque<>();
    private final Deque<String> heldLocks = new ArrayDeque<>();
    private final List<Object> pendingEvents = new ArrayList<>();
    private boolean completed;

    LedgerTransaction(EntityLockManager lockManager) {
        this.lockManager = lockManager;
    }

    public void lock(String key) {
        ensureOpen();
        lockManager.lock(key);
        heldLocks.push(key);
    }

    public void onRollback(Runnable undo) {
        ensureOpen();
        undoLog.push(undo);
    }

    public void publishOnCommit(Object event) {
        ensureOpen();
        pendingEvents.add(event);
    }

    List<Object> commit() {
        ensureOpen();
        completed = true;
        undoLog.clear();
        return Collections.unmodifiableList(pendingEvents);
    }

    /**
     * Reverts every registered write. Failures of individual undo steps are attached to
     * {@code cause} as suppressed exceptions and do not stop the remaining steps.
     */
    void rollback(Throwable cause) {
        ensureOpen();
        completed = true;
        log.warn("Roll back ledger transaction ({} undo steps): {}", undoLog.size(), cause.toString());
        while (!undoLog.isEmpty()) {
            Runnable undo = undoLog.pop();
            try {
                undo.run();
            } catch (RuntimeException e) {
                log.error("Undo step failed during rollback", e);
                cause.addSuppressed(e);
            }
        }
        pendingEvents.clear();
    }

    void releaseLocks() {
        while (!heldLocks.isEmpty()) {
            lockManager.unlock(heldLocks.pop());
        }
    }

    private void ensureOpen() {
        if (completed) {
            throw new IllegalStateException("Ledger transaction already completed");
        }
    }

}
