package org.alertingupgrade.migrations.notifier;

/** Checks that an Alertmanager configuration could be loaded before it is persisted */
public interface NotifierValidator {
    /**
     * @throws AlertmanagerConfigException describing the first problem found
     */
    void validate(AlertmanagerConfiguration config);
}
