package com.flagship.token_ledger.archive;

/**
 * In-flight flag of the migration coordinator. Anything but IDLE means a batch is on its way.
 */
public enum MigrationState {
    IDLE,
    PROVISIONING,
    TRANSMITTING;

    public boolean isMigrating() {
        return this != IDLE;
    }
}
