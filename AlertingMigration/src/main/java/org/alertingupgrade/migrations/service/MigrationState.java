package org.alertingupgrade.migrations.service;

/**
 * Migration state of one org. {@link #MIGRATING} and {@link #REVERTING} only exist while an operation runs;
 * afterwards the state is read back from the ledger's migrated flag.
 */
public enum MigrationState {
    NOT_MIGRATED,
    MIGRATING,
    MIGRATED,
    REVERTING;

    public boolean canTransitionTo(MigrationState next) {
        switch (this) {
            case NOT_MIGRATED:
                // reverting an org that was never migrated removes leftovers of per-item operations
                return next == MIGRATING || next == REVERTING;
            case MIGRATING:
                return next == MIGRATED;
            case MIGRATED:
                return next == REVERTING;
            case REVERTING:
                return next == NOT_MIGRATED;
            default:
                return false;
        }
    }
}
