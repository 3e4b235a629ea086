package org.alertingupgrade.migrations.folders;

import java.util.List;
import java.util.Optional;

/** ACLs of dashboards and folders, both addressed by their numeric id */
public interface PermissionService {
    /** Empty when the resource has no ACL of its own and inherits instead */
    Optional<List<ResourcePermission>> getAcl(long orgId, long resourceId);

    /** Replaces the ACL of the resource */
    void setAcl(long orgId, long resourceId, List<ResourcePermission> permissions);
}
