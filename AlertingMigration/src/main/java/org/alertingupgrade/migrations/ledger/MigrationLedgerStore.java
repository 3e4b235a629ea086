package org.alertingupgrade.migrations.ledger;

import org.alertingupgrade.migrations.common.MigrationException;
import org.alertingupgrade.migrations.store.KvStore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;

/** Persists the per-org ledger and migrated flag as JSON in the key-value store */
@AllArgsConstructor
public class MigrationLedgerStore {
    public static final String MIGRATION_NAMESPACE = "ngalert.migration";
    public static final String ALERTMANAGER_NAMESPACE = "alertmanager";
    static final String MIGRATED_KEY = "migrated";
    static final String SUMMARY_KEY = "summary";
    /** Holds the flag that says whether the whole installation has been migrated */
    public static final long ANY_ORG = 0L;

    private final KvStore kvStore;
    private final ObjectMapper mapper;

    public boolean isMigrated(long orgId) {
        return kvStore.get(orgId, MIGRATION_NAMESPACE, MIGRATED_KEY).map(Boolean::parseBoolean).orElse(false);
    }

    public void setMigrated(long orgId, boolean migrated) {
        kvStore.set(orgId, MIGRATION_NAMESPACE, MIGRATED_KEY, Boolean.toString(migrated));
    }

    public OrgMigrationState getOrgMigrationState(long orgId) {
        var stored = kvStore.get(orgId, MIGRATION_NAMESPACE, SUMMARY_KEY);
        if (stored.isEmpty()) {
            return OrgMigrationState.empty(orgId);
        }
        try {
            var state = mapper.readValue(stored.get(), OrgMigrationState.class);
            state.setOrgId(orgId);
            return state;
        } catch (JsonProcessingException e) {
            throw new MigrationException("failed to read migration summary of org " + orgId, e);
        }
    }

    public void setOrgMigrationState(OrgMigrationState state) {
        try {
            kvStore.set(state.getOrgId(), MIGRATION_NAMESPACE, SUMMARY_KEY, mapper.writeValueAsString(state));
        } catch (JsonProcessingException e) {
            throw new MigrationException("failed to write migration summary of org " + state.getOrgId(), e);
        }
    }

    /** Drops the ledger and the Alertmanager key-value state of the org */
    public void deleteOrg(long orgId) {
        kvStore.deleteNamespace(orgId, ALERTMANAGER_NAMESPACE);
        kvStore.deleteNamespace(orgId, MIGRATION_NAMESPACE);
    }
}
