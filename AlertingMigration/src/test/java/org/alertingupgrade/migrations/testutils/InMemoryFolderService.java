package org.alertingupgrade.migrations.testutils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.alertingupgrade.migrations.folders.Folder;
import org.alertingupgrade.migrations.folders.FolderService;
import org.alertingupgrade.migrations.folders.ServiceIdentity;

import lombok.Getter;

public class InMemoryFolderService implements FolderService {
    @Getter
    private final Map<String, Folder> folders = new LinkedHashMap<>();
    @Getter
    private final List<String> deletedUids = new ArrayList<>();
    private long nextId = 1000;

    public Folder addFolder(long id, long orgId, String uid, String title) {
        var folder = Folder.builder().id(id).orgId(orgId).uid(uid).title(title).build();
        folders.put(uid, folder);
        return folder;
    }

    @Override
    public Optional<Folder> getFolderById(long orgId, long folderId) {
        return folders.values().stream().filter(f -> f.getOrgId() == orgId && f.getId() == folderId).findFirst();
    }

    @Override
    public Optional<Folder> getFolderByUid(long orgId, String uid) {
        return Optional.ofNullable(folders.get(uid)).filter(f -> f.getOrgId() == orgId);
    }

    @Override
    public Optional<Folder> getFolderByTitle(long orgId, String title) {
        return folders.values().stream()
            .filter(f -> f.getOrgId() == orgId && f.getParentUid() == null && f.getTitle().equals(title))
            .findFirst();
    }

    @Override
    public List<Folder> getFoldersByTitle(long orgId, String title) {
        return folders.values().stream()
            .filter(f -> f.getOrgId() == orgId && f.getParentUid() == null && f.getTitle().equals(title))
            .collect(Collectors.toList());
    }

    @Override
    public Folder createFolder(long orgId, String title) {
        var id = nextId++;
        return addFolder(id, orgId, "folder-" + id, title);
    }

    @Override
    public void deleteFolder(ServiceIdentity identity, long orgId, String uid) {
        if (!identity.can(ServiceIdentity.FOLDERS_DELETE)) {
            throw new SecurityException(identity.getName() + " may not delete folders");
        }
        folders.remove(uid);
        deletedUids.add(uid);
    }
}
