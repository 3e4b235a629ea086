package org.alertingupgrade.migrations.folders;

import java.util.Set;

import lombok.Value;

/** A non-user caller carrying an explicit set of allowed actions */
@Value
public class ServiceIdentity {
    public static final String FOLDERS_DELETE = "folders:delete";

    String name;
    Set<String> actions;

    /** Can delete folders and nothing else */
    public static ServiceIdentity folderDeleter() {
        return new ServiceIdentity("alerting-migration", Set.of(FOLDERS_DELETE));
    }

    public boolean can(String action) {
        return actions.contains(action);
    }
}
