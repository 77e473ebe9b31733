package com.omniva.dbnotifier.engine.memory;

import com.omniva.dbnotifier.engine.fault.DbNotifierRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Locks owned by transactions rather than threads. A lock is held until its transaction
 * completes; acquiring it again from the owning transaction is a no-op.
 * <p>
 * Exclusive holds conflict with every other transaction. Shared holds only conflict with an
 * exclusive hold, like row writes against DDL on the same table. A transaction that is the only
 * shared holder may upgrade to exclusive.
 */
public class InMemoryLockTable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLockTable.class);

    private final Map<Object, InMemoryTransaction> exclusiveOwners = new HashMap<>();
    private final Map<Object, Set<InMemoryTransaction>> sharedOwners = new HashMap<>();

    /**
     * Block until {@code transaction} holds the lock for {@code key} exclusively
     */
    public synchronized void acquire(Object key, InMemoryTransaction transaction) {
        if (exclusiveOwners.get(key) == transaction) {
            return;
        }
        while (exclusiveConflict(key, transaction)) {
            await(key, transaction);
        }
        exclusiveOwners.put(key, transaction);
    }

    /**
     * Block until {@code transaction} holds the lock for {@code key} at least in shared mode
     */
    public synchronized void acquireShared(Object key, InMemoryTransaction transaction) {
        InMemoryTransaction holder = exclusiveOwners.get(key);
        if (holder == transaction) {
            return;
        }
        while (holder != null) {
            await(key, transaction);
            holder = exclusiveOwners.get(key);
        }
        sharedOwners.computeIfAbsent(key, k -> new HashSet<>()).add(transaction);
    }

    /**
     * Release every lock held by the transaction and wake up waiters
     */
    public synchronized void releaseAll(InMemoryTransaction transaction) {
        boolean released = exclusiveOwners.values().removeIf(owner -> owner == transaction);
        for (Set<InMemoryTransaction> holders : sharedOwners.values()) {
            released |= holders.remove(transaction);
        }
        sharedOwners.values().removeIf(Set::isEmpty);
        if (released) {
            notifyAll();
        }
    }

    public synchronized boolean isHeld(Object key) {
        return exclusiveOwners.containsKey(key) || sharedOwners.containsKey(key);
    }

    public synchronized int heldCount(InMemoryTransaction transaction) {
        Set<Object> keys = new HashSet<>();
        exclusiveOwners.forEach((key, owner) -> {
            if (owner == transaction) {
                keys.add(key);
            }
        });
        sharedOwners.forEach((key, holders) -> {
            if (holders.contains(transaction)) {
                keys.add(key);
            }
        });
        return keys.size();
    }

    private boolean exclusiveConflict(Object key, InMemoryTransaction transaction) {
        InMemoryTransaction holder = exclusiveOwners.get(key);
        if (holder != null && holder != transaction) {
            return true;
        }
        Set<InMemoryTransaction> holders = sharedOwners.get(key);
        return holders != null && holders.stream().anyMatch(owner -> owner != transaction);
    }

    private void await(Object key, InMemoryTransaction transaction) {
        log.debug("{} waiting for lock {}", transaction, key);
        try {
            wait();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DbNotifierRuntimeException("Interrupted while waiting for lock " + key, e);
        }
    }
}
