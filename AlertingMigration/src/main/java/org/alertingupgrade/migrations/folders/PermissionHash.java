package org.alertingupgrade.migrations.folders;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.TreeSet;

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import lombok.experimental.UtilityClass;

/** Order-insensitive fingerprint of a permission set; equal sets give equal hashes */
@UtilityClass
public class PermissionHash {
    static final int HASH_BYTES = 8;

    public static String of(Collection<ResourcePermission> permissions) {
        var entries = new TreeSet<String>();
        permissions.forEach(p -> entries.add(p.normalized()));
        var digest = Hashing.sha256().hashString(String.join("\n", entries), StandardCharsets.UTF_8).asBytes();
        return BaseEncoding.base16().lowerCase().encode(digest, 0, HASH_BYTES);
    }
}
