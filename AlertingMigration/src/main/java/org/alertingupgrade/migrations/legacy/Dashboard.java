package org.alertingupgrade.migrations.legacy;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Dashboard {
    public static final long GENERAL_FOLDER_ID = 0L;

    long id;
    long orgId;
    String uid;
    String title;
    long folderId;
    boolean hasAcl;

    public boolean isInGeneralFolder() {
        return folderId == GENERAL_FOLDER_ID;
    }
}
