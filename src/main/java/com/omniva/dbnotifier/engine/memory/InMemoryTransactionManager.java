package com.omniva.dbnotifier.engine.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;
import org.springframework.transaction.support.SmartTransactionObject;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;

/**
 * Spring transaction manager for the {@link InMemoryDatabase}. Binds one
 * {@link InMemoryTransaction} per thread, replays its undo log on rollback, and on completion
 * releases its locks and hands committed notifications to the {@link InMemoryChannelHub}.
 * Suspension (REQUIRES_NEW, NOT_SUPPORTED) is not supported.
 */
public class InMemoryTransactionManager extends AbstractPlatformTransactionManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransactionManager.class);

    private final InMemoryDatabase database;
    private final InMemoryChannelHub channelHub;

    public InMemoryTransactionManager(InMemoryDatabase database, InMemoryChannelHub channelHub) {
        this.database = database;
        this.channelHub = channelHub;
    }

    @Override
    protected Object doGetTransaction() {
        TransactionObject transactionObject = new TransactionObject();
        Object bound = TransactionSynchronizationManager.getResource(database);
        if (bound instanceof InMemoryTransaction transaction) {
            transactionObject.transaction = transaction;
        }
        return transactionObject;
    }

    @Override
    protected boolean isExistingTransaction(Object transaction) {
        return ((TransactionObject) transaction).transaction != null;
    }

    @Override
    protected void doBegin(Object transaction, TransactionDefinition definition) {
        TransactionObject transactionObject = (TransactionObject) transaction;
        InMemoryTransaction started = database.beginTransaction();
        transactionObject.transaction = started;
        TransactionSynchronizationManager.bindResource(database, started);
        log.debug("Began {}", started);
    }

    @Override
    protected void doCommit(DefaultTransactionStatus status) {
        TransactionObject transactionObject = (TransactionObject) status.getTransaction();
        transactionObject.committedNotifications = transactionObject.transaction.commit();
        log.debug("Committed {} with {} notification(s)",
                transactionObject.transaction, transactionObject.committedNotifications.size());
    }

    @Override
    protected void doRollback(DefaultTransactionStatus status) {
        TransactionObject transactionObject = (TransactionObject) status.getTransaction();
        transactionObject.transaction.rollback();
        log.debug("Rolled back {}", transactionObject.transaction);
    }

    @Override
    protected void doSetRollbackOnly(DefaultTransactionStatus status) {
        ((TransactionObject) status.getTransaction()).transaction.setRollbackOnly();
    }

    @Override
    protected void doCleanupAfterCompletion(Object transaction) {
        TransactionObject transactionObject = (TransactionObject) transaction;
        TransactionSynchronizationManager.unbindResourceIfPossible(database);
        database.getLockTable().releaseAll(transactionObject.transaction);

        // Listeners only ever see committed work
        if (!transactionObject.committedNotifications.isEmpty()) {
            channelHub.deliver(transactionObject.committedNotifications);
        }
    }

    private static class TransactionObject implements SmartTransactionObject {
        private InMemoryTransaction transaction;
        private List<InMemoryTransaction.PendingNotification> committedNotifications = List.of();

        @Override
        public boolean isRollbackOnly() {
            return transaction != null && transaction.isRollbackOnly();
        }

        @Override
        public void flush() {
            // Nothing buffered outside the transaction itself
        }
    }
}
