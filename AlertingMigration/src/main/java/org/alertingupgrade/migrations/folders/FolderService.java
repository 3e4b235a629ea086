package org.alertingupgrade.migrations.folders;

import java.util.List;
import java.util.Optional;

public interface FolderService {
    /** Legacy dashboards reference their folder by numeric id */
    Optional<Folder> getFolderById(long orgId, long folderId);

    Optional<Folder> getFolderByUid(long orgId, String uid);

    /** Looks among top-level folders only */
    Optional<Folder> getFolderByTitle(long orgId, String title);

    /** Every top-level folder with this title, oldest first; titles are not unique */
    List<Folder> getFoldersByTitle(long orgId, String title);

    /** Creates a top-level folder with a fresh uid */
    Folder createFolder(long orgId, String title);

    /**
     * @throws SecurityException when {@code identity} may not delete folders
     */
    void deleteFolder(ServiceIdentity identity, long orgId, String uid);
}
