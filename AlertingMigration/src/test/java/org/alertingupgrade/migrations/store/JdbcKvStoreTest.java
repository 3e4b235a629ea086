package org.alertingupgrade.migrations.store;

import org.alertingupgrade.migrations.testutils.PostgresTestBase;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;

class JdbcKvStoreTest extends PostgresTestBase {

    @Test
    void setOverwritesAndDeleteIsPerNamespace() {
        var kv = new JdbcKvStore(dbClient, testClock);
        kv.set(1, "alerting.migration", "migrated", "false");
        kv.set(1, "alerting.migration", "migrated", "true");
        kv.set(1, "other", "key", "value");
        kv.set(2, "alerting.migration", "migrated", "true");

        assertThat(kv.get(1, "alerting.migration", "migrated").orElseThrow(), equalTo("true"));

        kv.deleteNamespace(1, "alerting.migration");

        assertFalse(kv.get(1, "alerting.migration", "migrated").isPresent());
        assertThat(kv.get(1, "other", "key").orElseThrow(), equalTo("value"));
        assertThat(kv.get(2, "alerting.migration", "migrated").orElseThrow(), equalTo("true"));
    }
}
