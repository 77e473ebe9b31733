package com.omniva.dbnotifier.engine.ignition;

import com.omniva.dbnotifier.config.DbNotifierConfig;
import com.omniva.dbnotifier.engine.fault.DbNotifierFatalError;
import com.omniva.dbnotifier.engine.fault.ErrorTracker;
import com.omniva.dbnotifier.engine.postgres.SqlQuoting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Startup checks for the PostgreSQL backend: the server answers and the registry table exists.
 */
public class EnvironmentValidator {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private final JdbcTemplate jdbcTemplate;
    private final DbNotifierConfig config;
    private final ErrorTracker errorTracker;

    public EnvironmentValidator(JdbcTemplate jdbcTemplate,
                                DbNotifierConfig config,
                                ErrorTracker errorTracker) {
        this.jdbcTemplate = jdbcTemplate;
        this.config = config;
        this.errorTracker = errorTracker;
    }

    /**
     * Validates the database environment.
     *
     * @return true if the environment is valid, false otherwise
     * @throws DbNotifierFatalError if the configured registry table name is unusable
     */
    public boolean validateEnvironment() {
        try {
            String registryTable = config.getRegistryTableName();
            if (registryTable == null || registryTable.trim().isEmpty()) {
                throw new DbNotifierFatalError("Invalid registry table configuration: " + registryTable);
            }

            if (!isServerReachable()) {
                return false;
            }

            if (!registryTableExists(registryTable)) {
                log.error("Registry table {} does not exist; create it or set db-notifier.registry.initialize-schema=true",
                        registryTable);
                errorTracker.addError("Registry table " + registryTable + " does not exist");
                return false;
            }

            log.info("Environment validated: PostgreSQL {} reachable, registry table {} present",
                    serverVersion(), registryTable);
            return true;
        } catch (DbNotifierFatalError fatalError) {
            log.error("Fatal environment validation error: {}", fatalError.getMessage());
            throw fatalError;

        } catch (Exception e) {
            log.error("Environment validation failed: {}", e.getMessage(), e);
            errorTracker.addError("Environment validation failed", e);
            return false;
        }
    }

    boolean isServerReachable() {
        Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        if (one == null || one != 1) {
            log.error("Database did not answer the connectivity check");
            return false;
        }
        return true;
    }

    boolean registryTableExists(String registryTable) {
        Boolean exists = jdbcTemplate.queryForObject("SELECT to_regclass(?) IS NOT NULL", Boolean.class,
                SqlQuoting.quoteQualified(registryTable));
        return Boolean.TRUE.equals(exists);
    }

    private String serverVersion() {
        return jdbcTemplate.queryForObject("SHOW server_version", String.class);
    }
}
