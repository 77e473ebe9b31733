package com.omniva.dbnotifier.registry;

import com.omniva.dbnotifier.engine.fault.DuplicateSubscriptionException;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of registry rows. Writes join the caller's transaction.
 */
public interface SubscriptionStore {

    /**
     * @return the stored row with its assigned id
     * @throws DuplicateSubscriptionException if the uniqueness key is already taken
     */
    Subscription insert(Subscription subscription);

    /**
     * @return whether a row with the subscription's id existed
     * @throws DuplicateSubscriptionException if the uniqueness key is already taken by another row
     */
    boolean update(Subscription subscription);

    boolean delete(long id);

    Optional<Subscription> find(long id);

    /**
     * Find a row and lock it until the current transaction completes
     */
    Optional<Subscription> findForUpdate(long id);

    List<Subscription> findByTable(String tableName);

    /**
     * Rows whose generated handler has this name, on any table
     */
    List<Subscription> findByHandlerName(String handlerName);

    List<Subscription> list();
}
