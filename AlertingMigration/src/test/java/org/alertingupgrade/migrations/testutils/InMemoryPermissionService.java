package org.alertingupgrade.migrations.testutils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.alertingupgrade.migrations.folders.PermissionService;
import org.alertingupgrade.migrations.folders.ResourcePermission;

public class InMemoryPermissionService implements PermissionService {
    private final Map<Long, List<ResourcePermission>> acls = new HashMap<>();

    @Override
    public Optional<List<ResourcePermission>> getAcl(long orgId, long resourceId) {
        return Optional.ofNullable(acls.get(resourceId));
    }

    @Override
    public void setAcl(long orgId, long resourceId, List<ResourcePermission> permissions) {
        acls.put(resourceId, List.copyOf(permissions));
    }
}
