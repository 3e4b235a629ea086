package org.alertingupgrade.migrations.folders;

import lombok.Builder;
import lombok.Value;

/** One ACL entry granting a user, a team or an org role a permission level */
@Value
@Builder
public class ResourcePermission {
    Long userId;
    Long teamId;
    String role;
    PermissionLevel permission;

    public static ResourcePermission forRole(String role, PermissionLevel permission) {
        return ResourcePermission.builder().role(role).permission(permission).build();
    }

    /** Stable text form used for permission hashing */
    public String normalized() {
        String subject;
        if (userId != null) {
            subject = "user:" + userId;
        } else if (teamId != null) {
            subject = "team:" + teamId;
        } else {
            subject = "role:" + role;
        }
        return subject + "=" + permission.getDisplayName();
    }
}
