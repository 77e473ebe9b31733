package com.omniva.dbnotifier.config;

/**
 * Configuration interface for the DB Notifier registry
 * This interface abstracts the configuration details from the service implementation
 */
public interface DbNotifierConfig {

    // Naming of generated artifacts
    String getHandlerPrefix();
    String getTriggerPrefix();
    int getMaxIdentifierLength();

    // Per-table exclusive sections
    String getLockSuffix();

    // Registry storage
    String getRegistryTableName();

    // Diagnostics
    int getMaxRecentErrors();
}
