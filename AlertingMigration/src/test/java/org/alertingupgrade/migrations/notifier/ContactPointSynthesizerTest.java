package org.alertingupgrade.migrations.notifier;

import java.time.Duration;

import org.alertingupgrade.migrations.dedup.Deduplicator;
import org.alertingupgrade.migrations.rules.MigrationLabels;
import org.alertingupgrade.migrations.testutils.LegacyFixtures;
import org.alertingupgrade.migrations.testutils.SecureSettings;

import org.junit.jupiter.api.Test;

import static org.alertingupgrade.migrations.testutils.LegacyFixtures.MAPPER;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasKey;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContactPointSynthesizerTest {

    private final ContactPointSynthesizer synthesizer = new ContactPointSynthesizer(SecureSettings.ENCRYPTION, MAPPER);

    @Test
    void channelBecomesReceiverAndLabelRoute() {
        var channel = LegacyFixtures.channel(1, 1, "email-uid", "email").build();
        channel.getSettings().put("addresses", "ops@example.com");

        var migrated = synthesizer.synthesize(channel, new Deduplicator(false, 0));

        assertThat(migrated.getReceiver().getName(), equalTo("email-uid-name"));
        var integration = migrated.getReceiver().getIntegrations().get(0);
        assertThat(integration.getUid(), equalTo("email-uid"));
        assertThat(integration.getType(), equalTo("email"));
        assertThat(integration.getSettings().get("addresses").asText(), equalTo("ops@example.com"));

        var route = migrated.getRoute();
        assertThat(route.getReceiver(), equalTo("email-uid-name"));
        assertThat(route.getObjectMatchers().get(0), equalTo(ObjectMatcher.equal(MigrationLabels.contactLabel("email-uid"), "true")));
        assertTrue(route.isContinueMatching());
        assertThat(route.getRepeatInterval(), equalTo("52w"));
    }

    @Test
    void defaultChannelMatchesEverything() {
        var channel = LegacyFixtures.channel(1, 1, "d", "email").isDefault(true).build();
        var route = synthesizer.synthesize(channel, new Deduplicator(false, 0)).getRoute();
        assertThat(route.getObjectMatchers().get(0), equalTo(ObjectMatcher.regex(AlertmanagerConfigs.ALERT_NAME_LABEL, ".+")));
    }

    @Test
    void remindersKeepTheirFrequency() {
        var channel = LegacyFixtures.channel(1, 1, "d", "email")
            .sendReminder(true)
            .frequency(Duration.ofHours(4))
            .build();
        assertThat(synthesizer.synthesize(channel, new Deduplicator(false, 0)).getRoute().getRepeatInterval(), equalTo("4h"));
    }

    @Test
    void plainTextSecretsMoveToSecureSettings() {
        var channel = LegacyFixtures.channel(1, 1, "s", "slack").build();
        channel.getSettings().put("url", "https://hooks.slack.com/x").put("recipient", "#ops");

        var integration = synthesizer.synthesize(channel, new Deduplicator(false, 0)).getReceiver().getIntegrations().get(0);

        assertFalse(integration.getSettings().has("url"));
        assertThat(integration.getSettings().get("recipient").asText(), equalTo("#ops"));
        assertThat(SecureSettings.decrypt(integration.getSecureSettings().get("url")), equalTo("https://hooks.slack.com/x"));
        // the legacy settings object is not modified
        assertTrue(channel.getSettings().has("url"));
    }

    @Test
    void onlyStringSecretsMoveToSecureSettings() {
        var channel = LegacyFixtures.channel(1, 1, "p", "pushover").build();
        channel.getSettings().put("apiToken", 12345).put("userKey", "user-key");

        var integration = synthesizer.synthesize(channel, new Deduplicator(false, 0)).getReceiver().getIntegrations().get(0);

        assertThat(integration.getSettings().get("apiToken").asInt(), equalTo(12345));
        assertThat(integration.getSecureSettings(), not(hasKey("apiToken")));
        assertThat(SecureSettings.decrypt(integration.getSecureSettings().get("userKey")), equalTo("user-key"));
        assertFalse(integration.getSettings().has("userKey"));
    }

    @Test
    void existingSecureSettingsWin() {
        var channel = LegacyFixtures.channel(1, 1, "s", "slack")
            .secureSetting("url", SecureSettings.encrypt("https://secure"))
            .build();
        channel.getSettings().put("url", "https://plain");

        var integration = synthesizer.synthesize(channel, new Deduplicator(false, 0)).getReceiver().getIntegrations().get(0);

        assertThat(SecureSettings.decrypt(integration.getSecureSettings().get("url")), equalTo("https://secure"));
        assertThat(integration.getSettings().get("url").asText(), equalTo("https://plain"));
    }

    @Test
    void collidingNamesAreRenamed() {
        var names = new Deduplicator(false, 0);
        names.add("email-uid-name");
        var migrated = synthesizer.synthesize(LegacyFixtures.channel(1, 1, "email-uid", "email").build(), names);
        assertThat(migrated.getReceiver().getName(), startsWith("email-uid-name_"));
        assertThat(migrated.getRoute().getReceiver(), equalTo(migrated.getReceiver().getName()));
        assertTrue(names.contains(migrated.getReceiver().getName()));
    }

    @Test
    void discontinuedAndUndecryptableChannelsFailWithoutTakingAName() {
        var names = new Deduplicator(false, 0);
        assertThrows(ContactPointException.class,
            () -> synthesizer.synthesize(LegacyFixtures.channel(1, 1, "h", "hipchat").build(), names));

        var broken = LegacyFixtures.channel(2, 1, "b", "slack").secureSetting("url", "bm90IGVuY3J5cHRlZA==").build();
        var e = assertThrows(ContactPointException.class, () -> synthesizer.synthesize(broken, names));
        assertThat(e.getMessage(), equalTo("failed to decrypt secure setting 'url'"));
        assertFalse(names.contains("b-name"));
    }

    @Test
    void routeLabelIsTheFirstMatcher() {
        var migrated = synthesizer.synthesize(LegacyFixtures.channel(1, 1, "x", "email").build(), new Deduplicator(false, 0));
        assertThat(migrated.getRouteLabel(), equalTo(MigrationLabels.contactLabel("x")));
        assertThat(migrated.getReceiver().getIntegrations().get(0).getSecureSettings(), not(hasKey("url")));
    }
}
