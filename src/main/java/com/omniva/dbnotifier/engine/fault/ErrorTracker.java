package com.omniva.dbnotifier.engine.fault;

import com.omniva.dbnotifier.config.DbNotifierConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracks and manages failed registry mutations for diagnostics
 * Thread-safe implementation for concurrent access
 */
public class ErrorTracker {

    private static final Logger log = LoggerFactory.getLogger(ErrorTracker.class);
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // Thread-safe list for concurrent access from multiple writer threads
    private final List<String> recentErrors = new CopyOnWriteArrayList<>();

    private final DbNotifierConfig config;

    public ErrorTracker(DbNotifierConfig config) {
        this.config = config;
    }

    /**
     * Add an error with timestamp
     */
    public void addError(String errorMessage) {
        addError(errorMessage, null);
    }

    /**
     * Add an error with exception details
     */
    public void addError(String errorMessage, Throwable throwable) {
        String timestamp = LocalDateTime.now().format(TIMESTAMP_FORMAT);
        String formattedError;

        if (throwable != null) {
            formattedError = String.format("[%s] %s - %s: %s",
                    timestamp, errorMessage, throwable.getClass().getSimpleName(), throwable.getMessage());
        } else {
            formattedError = String.format("[%s] %s", timestamp, errorMessage);
        }

        recentErrors.add(formattedError);

        // Keep only the most recent errors
        while (recentErrors.size() > config.getMaxRecentErrors()) {
            recentErrors.remove(0);
        }
    }

    /**
     * Record a failed registry mutation. The caller rethrows the failure unchanged;
     * this only tracks and logs it at a level matching its category.
     *
     * @param operation the registry operation (create, update, delete, ...)
     * @param target    a short description of the subscription involved
     * @param failure   the failure that aborted the transaction
     */
    public void processRegistryFailure(String operation, String target, Throwable failure) {
        String errorMsg = String.format("Registry %s failed for %s", operation, target);
        addError(errorMsg, failure);

        if (failure instanceof SubscriptionValidationException) {
            log.warn("Rejected registry {} for {}: {}", operation, target, failure.getMessage());
        } else if (failure instanceof SubscriptionNotFoundException) {
            log.warn("Registry {} for {} found no row: {}", operation, target, failure.getMessage());
        } else if (failure instanceof DbNotifierFatalError) {
            log.error("INTERNAL CONTRACT VIOLATION during registry {} for {}: {}",
                    operation, target, failure.getMessage(), failure);
        } else {
            SQLException sqlError = findSqlException(failure);
            if (sqlError != null) {
                log.error("Registry {} for {} failed with SQL error: {} (SQLState: {}, permission problem: {})",
                        operation, target, sqlError.getMessage(), sqlError.getSQLState(),
                        isPermissionError(sqlError));
            } else {
                log.error("Registry {} for {} failed: {}", operation, target, failure.getMessage(), failure);
            }
        }
    }

    /**
     * Check if a SQL error is caused by missing privileges on the target table or schema
     */
    static boolean isPermissionError(SQLException e) {
        String sqlState = e.getSQLState();
        // 42501 insufficient_privilege, 28xxx invalid authorization
        return sqlState != null && (sqlState.equals("42501") || sqlState.startsWith("28"));
    }

    private SQLException findSqlException(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof SQLException sqlException) {
                return sqlException;
            }
            current = current.getCause();
        }
        return null;
    }

    // ========================================
    // MONITORING AND UTILITY METHODS
    // ========================================

    /**
     * Get count of recent errors
     */
    public int getRecentErrorCount() {
        return recentErrors.size();
    }

    /**
     * Get the most recent error
     */
    public String getLastError() {
        return recentErrors.isEmpty() ? null : recentErrors.get(recentErrors.size() - 1);
    }
}
