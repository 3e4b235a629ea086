package org.alertingupgrade.migrations;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** The list of supported commands for the alerting migration tool */
@AllArgsConstructor
public enum ToolCommands {
    /** Migrates every dashboard alert and notification channel of an org */
    MIGRATE_ORG("migrate-org"),
    /** Re-migrates the alerts of one dashboard */
    MIGRATE_DASHBOARD("migrate-dashboard"),
    /** Re-migrates the alert of one dashboard panel */
    MIGRATE_ALERT("migrate-alert"),
    /** Re-migrates one notification channel */
    MIGRATE_CHANNEL("migrate-channel"),
    /** Re-migrates every notification channel of an org */
    MIGRATE_CHANNELS("migrate-channels"),
    /** Prints the stored migration summary of an org */
    SUMMARY("summary"),
    /** Deletes the unified alerting data of an org */
    REVERT_ORG("revert-org"),
    /** Deletes the unified alerting data of every org */
    REVERT_ALL("revert-all"),
    /** Migrates or reverts all orgs depending on which alerting mode is enabled */
    RUN("run");

    @Getter
    private final String commandName;

    /** Per-item operations only make sense while legacy alerting is still in use */
    public boolean isPerItem() {
        return this == MIGRATE_DASHBOARD || this == MIGRATE_ALERT || this == MIGRATE_CHANNEL
            || this == MIGRATE_CHANNELS;
    }

    public static ToolCommands fromString(String s) {
        for (var command : values()) {
            if (command.commandName.equalsIgnoreCase(s)) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unable to find matching command for text:" + s);
    }
}
