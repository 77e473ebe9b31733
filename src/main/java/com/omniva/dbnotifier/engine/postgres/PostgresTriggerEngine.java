package com.omniva.dbnotifier.engine.postgres;

import com.omniva.dbnotifier.engine.TriggerEngine;
import com.omniva.dbnotifier.engine.fault.ArtifactOperationException;
import com.omniva.dbnotifier.messaging.model.ChangeType;
import com.omniva.dbnotifier.synthesis.HandlerPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Set;

/**
 * {@link TriggerEngine} issuing PL/pgSQL DDL through a {@link JdbcTemplate}.
 * The template must share the registry's transactional DataSource so DDL commits or rolls back
 * together with the registry row.
 */
public class PostgresTriggerEngine implements TriggerEngine {

    private static final Logger log = LoggerFactory.getLogger(PostgresTriggerEngine.class);

    private static final String TRIGGER_EXISTS_SQL = """
            SELECT EXISTS (
                SELECT 1 FROM pg_catalog.pg_trigger
                 WHERE tgrelid = to_regclass(?) AND tgname = ? AND NOT tgisinternal
            )""";

    private static final String TABLE_EXISTS_SQL = "SELECT to_regclass(?) IS NOT NULL";

    private final JdbcTemplate jdbcTemplate;
    private final PlpgsqlHandlerEmitter emitter;

    public PostgresTriggerEngine(JdbcTemplate jdbcTemplate, PlpgsqlHandlerEmitter emitter) {
        this.jdbcTemplate = jdbcTemplate;
        this.emitter = emitter;
    }

    @Override
    public void createOrReplaceHandler(String handlerName, HandlerPlan plan) {
        String ddl = emitter.createFunction(handlerName, plan);
        log.debug("Handler DDL for {}:\n{}", handlerName, ddl);
        execute("create function " + handlerName, ddl);
    }

    @Override
    public void dropHandlerIfExists(String handlerName) {
        execute("drop function " + handlerName, emitter.dropFunction(handlerName));
    }

    @Override
    public boolean triggerExists(String tableName, String triggerName) {
        try {
            Boolean exists = jdbcTemplate.queryForObject(TRIGGER_EXISTS_SQL, Boolean.class,
                    SqlQuoting.quoteQualified(tableName), triggerName);
            return Boolean.TRUE.equals(exists);
        } catch (DataAccessException e) {
            throw new ArtifactOperationException(
                    "Failed to look up trigger " + triggerName + " on " + tableName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void createTrigger(String tableName, String triggerName, String handlerName, Set<ChangeType> events) {
        execute("create trigger " + triggerName, emitter.createTrigger(tableName, triggerName, handlerName, events));
    }

    @Override
    public void dropTriggerIfExists(String tableName, String triggerName) {
        if (!tableExists(tableName)) {
            log.info("Table {} no longer exists, nothing to drop for trigger {}", tableName, triggerName);
            return;
        }
        execute("drop trigger " + triggerName, emitter.dropTrigger(tableName, triggerName));
    }

    private boolean tableExists(String tableName) {
        try {
            Boolean exists = jdbcTemplate.queryForObject(TABLE_EXISTS_SQL, Boolean.class,
                    SqlQuoting.quoteQualified(tableName));
            return Boolean.TRUE.equals(exists);
        } catch (DataAccessException e) {
            throw new ArtifactOperationException(
                    "Failed to resolve table " + tableName + ": " + e.getMessage(), e);
        }
    }

    private void execute(String operation, String sql) {
        try {
            jdbcTemplate.execute(sql);
        } catch (DataAccessException e) {
            throw new ArtifactOperationException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }
}
