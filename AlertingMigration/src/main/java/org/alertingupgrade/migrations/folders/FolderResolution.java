package org.alertingupgrade.migrations.folders;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FolderResolution {
    /** The folder the dashboard lives in; null for the General level and for orphans */
    Folder legacyFolder;
    /** Where the dashboard's rules go */
    Folder targetFolder;
    /** Set when the rules end up somewhere other than the dashboard's own folder */
    String warning;
}
