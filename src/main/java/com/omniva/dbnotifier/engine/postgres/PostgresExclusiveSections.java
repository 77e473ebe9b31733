package com.omniva.dbnotifier.engine.postgres;

import com.omniva.dbnotifier.engine.ExclusiveSectionProvider;
import com.omniva.dbnotifier.engine.fault.ArtifactOperationException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Exclusive sections as transaction-level advisory locks. They are released by PostgreSQL
 * itself at commit or rollback, so there is no unlock call.
 */
public class PostgresExclusiveSections implements ExclusiveSectionProvider {

    private final JdbcTemplate jdbcTemplate;

    public PostgresExclusiveSections(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void acquire(int sectionId) {
        // Outside a transaction the lock would be dropped as soon as the statement's connection is returned
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalTransactionStateException(
                    "Exclusive section " + sectionId + " requested outside of a transaction");
        }
        try {
            jdbcTemplate.queryForObject("SELECT 1 FROM pg_advisory_xact_lock(?)", Integer.class, sectionId);
        } catch (DataAccessException e) {
            throw new ArtifactOperationException(
                    "Failed to acquire exclusive section " + sectionId + ": " + e.getMessage(), e);
        }
    }
}
