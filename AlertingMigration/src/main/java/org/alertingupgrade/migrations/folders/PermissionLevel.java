package org.alertingupgrade.migrations.folders;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum PermissionLevel {
    VIEW(1, "View"),
    EDIT(2, "Edit"),
    ADMIN(4, "Admin");

    private final int value;
    private final String displayName;

    public static PermissionLevel fromValue(int value) {
        for (var level : values()) {
            if (level.value == value) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown permission level: " + value);
    }
}
