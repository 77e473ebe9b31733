package com.omniva.dbnotifier.engine.memory;

import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * One in-memory transaction: an undo log replayed on rollback and the notifications
 * buffered until commit.
 */
public class InMemoryTransaction {

    public enum State {
        ACTIVE, COMMITTED, ROLLED_BACK
    }

    /**
     * A notification waiting for its transaction to commit
     */
    public record PendingNotification(String channel, String payload) {
    }

    @Getter
    private final long transactionId;

    /**
     * Fixed for the whole transaction, like the engine's CURRENT_TIMESTAMP
     */
    @Getter
    private final OffsetDateTime startedAt;

    private final Deque<Runnable> undoLog = new ArrayDeque<>();
    private final List<PendingNotification> pendingNotifications = new ArrayList<>();

    @Getter
    private volatile State state = State.ACTIVE;

    // Set when a participating scope failed; the outermost scope must roll back
    @Getter
    private volatile boolean rollbackOnly;

    InMemoryTransaction(long transactionId, OffsetDateTime startedAt) {
        this.transactionId = transactionId;
        this.startedAt = startedAt;
    }

    /**
     * Register the compensation for a change just applied
     */
    public synchronized void onRollback(Runnable undo) {
        requireActive();
        undoLog.push(undo);
    }

    public synchronized void enqueueNotification(String channel, String payload) {
        requireActive();
        pendingNotifications.add(new PendingNotification(channel, payload));
    }

    synchronized List<PendingNotification> commit() {
        requireActive();
        state = State.COMMITTED;
        undoLog.clear();
        List<PendingNotification> committed = List.copyOf(pendingNotifications);
        pendingNotifications.clear();
        return committed;
    }

    synchronized void rollback() {
        if (state != State.ACTIVE) {
            return;
        }
        state = State.ROLLED_BACK;
        pendingNotifications.clear();
        while (!undoLog.isEmpty()) {
            undoLog.pop().run();
        }
    }

    void setRollbackOnly() {
        rollbackOnly = true;
    }

    public boolean isActive() {
        return state == State.ACTIVE;
    }

    private void requireActive() {
        if (state != State.ACTIVE) {
            throw new IllegalStateException("Transaction " + transactionId + " is " + state);
        }
    }

    @Override
    public String toString() {
        return "InMemoryTransaction{" + transactionId + ", " + state + "}";
    }
}
