package org.alertingupgrade.migrations.folders;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Folder {
    /** Folder names are stored in a column of this width */
    public static final int MAX_TITLE_LENGTH = 255;

    long id;
    long orgId;
    String uid;
    String title;
    /** Null for top-level folders */
    String parentUid;
}
