package org.alertingupgrade.migrations.store;

import java.util.Optional;

/** Namespaced key-value rows scoped to an org; org 0 holds values that are not org specific */
public interface KvStore {
    Optional<String> get(long orgId, String namespace, String key);

    void set(long orgId, String namespace, String key, String value);

    void deleteNamespace(long orgId, String namespace);
}
