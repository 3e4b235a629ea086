package org.alertingupgrade.migrations.ledger;

import java.time.Duration;

import org.alertingupgrade.migrations.common.MigrationException;
import org.alertingupgrade.migrations.rules.AlertRule;
import org.alertingupgrade.migrations.rules.NoDataState;
import org.alertingupgrade.migrations.testutils.InMemoryKvStore;
import org.alertingupgrade.migrations.testutils.LegacyFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.alertingupgrade.migrations.testutils.LegacyFixtures.MAPPER;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationLedgerStoreTest {

    private InMemoryKvStore kvStore;
    private MigrationLedgerStore ledger;

    @BeforeEach
    void setUp() {
        kvStore = new InMemoryKvStore();
        ledger = new MigrationLedgerStore(kvStore, MAPPER);
    }

    private static OrgMigrationState sampleState() {
        var state = OrgMigrationState.empty(4);
        var du = DashboardUpgrade.forDashboard(10);
        du.setDashboardUid("dash");
        du.setNewFolderUid("new-folder");
        var pair = du.addAlert(LegacyFixtures.alert(1, 4, 10, 2, "cpu").forDuration(Duration.ofMinutes(90)).build());
        pair.setAlertRule(AlertRuleUpgrade.from(AlertRule.builder()
            .uid("r1")
            .title("cpu")
            .noDataState(NoDataState.OK)
            .forDuration(Duration.ofMinutes(90))
            .build()));
        du.addAlert(LegacyFixtures.alert(2, 4, 10, 3, "mem").build()).setError("broken");
        state.getMigratedDashboards().add(du);
        state.getMigratedChannels().add(ContactPair.builder()
            .legacyChannel(LegacyChannelSummary.from(LegacyFixtures.channel(5, 4, "c", "email").isDefault(true).build()))
            .build());
        state.getCreatedFolders().add("new-folder");
        return state;
    }

    @Test
    void unmigratedOrgHasEmptyState() {
        assertFalse(ledger.isMigrated(4));
        var state = ledger.getOrgMigrationState(4);
        assertThat(state.getOrgId(), equalTo(4L));
        assertTrue(state.getMigratedDashboards().isEmpty());
    }

    @Test
    void stateSurvivesStorage() throws Exception {
        var state = sampleState();
        ledger.setOrgMigrationState(state);

        var loaded = ledger.getOrgMigrationState(4);
        assertThat(loaded, equalTo(state));

        var json = MAPPER.readTree(kvStore.get(4, MigrationLedgerStore.MIGRATION_NAMESPACE, "summary").orElseThrow());
        var storedPair = json.get("migratedDashboards").get(0).get("migratedAlerts").get(0);
        assertThat(storedPair.get("alertRule").get("for").asText(), equalTo("1h30m"));
        assertThat(storedPair.get("alertRule").get("noDataState").asText(), equalTo("OK"));
        assertTrue(json.get("migratedChannels").get(0).get("legacyChannel").get("isDefault").asBoolean());
    }

    @Test
    void migratedFlagIsPerOrg() {
        ledger.setMigrated(4, true);
        assertTrue(ledger.isMigrated(4));
        assertFalse(ledger.isMigrated(MigrationLedgerStore.ANY_ORG));
        ledger.setMigrated(4, false);
        assertFalse(ledger.isMigrated(4));
    }

    @Test
    void deleteOrgClearsLedgerAndAlertmanagerState() {
        ledger.setOrgMigrationState(sampleState());
        ledger.setMigrated(4, true);
        kvStore.set(4, MigrationLedgerStore.ALERTMANAGER_NAMESPACE, "notifications", "x");
        kvStore.set(5, MigrationLedgerStore.MIGRATION_NAMESPACE, "migrated", "true");

        ledger.deleteOrg(4);

        assertFalse(ledger.isMigrated(4));
        assertTrue(ledger.getOrgMigrationState(4).getMigratedDashboards().isEmpty());
        assertThat(kvStore.size(), equalTo(1));
    }

    @Test
    void corruptSummaryFails() {
        kvStore.set(4, MigrationLedgerStore.MIGRATION_NAMESPACE, "summary", "{not json");
        assertThrows(MigrationException.class, () -> ledger.getOrgMigrationState(4));
    }

    @Test
    void errorsAreCountedAcrossLevels() {
        var state = sampleState();
        state.getErrors().add("top");
        state.getMigratedDashboards().get(0).getErrors().add("dash");
        state.getMigratedChannels().get(0).setError("chan");
        assertThat(state.countErrors(), equalTo(4));
    }

    @Test
    void folderUseAndPopping() {
        var state = sampleState();
        assertTrue(state.isFolderInUse("new-folder"));
        assertTrue(state.getMigratedDashboards().get(0).hasNewFolder());

        var du = state.popDashboardUpgrade(10).orElseThrow();
        assertFalse(state.isFolderInUse("new-folder"));
        assertThat(du.popAlertPair(3).orElseThrow().getError(), equalTo("broken"));
        assertThat(du.getMigratedAlerts().size(), equalTo(1));
        assertTrue(state.popContactPair(5).isPresent());
        assertFalse(state.getContactPair(5).isPresent());
    }
}
