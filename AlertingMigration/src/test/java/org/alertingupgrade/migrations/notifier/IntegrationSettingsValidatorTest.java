package org.alertingupgrade.migrations.notifier;

import org.alertingupgrade.migrations.dedup.Deduplicator;
import org.alertingupgrade.migrations.legacy.LegacyNotificationChannel;
import org.alertingupgrade.migrations.testutils.LegacyFixtures;
import org.alertingupgrade.migrations.testutils.SecureSettings;

import org.junit.jupiter.api.Test;

import static org.alertingupgrade.migrations.testutils.LegacyFixtures.MAPPER;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IntegrationSettingsValidatorTest {

    private final IntegrationSettingsValidator validator = new IntegrationSettingsValidator(SecureSettings.ENCRYPTION);
    private final ContactPointSynthesizer synthesizer = new ContactPointSynthesizer(SecureSettings.ENCRYPTION, MAPPER);

    private AlertmanagerConfiguration configWith(LegacyNotificationChannel channel) {
        var config = AlertmanagerConfigs.baseConfig();
        AlertmanagerConfigs.addChannel(config, synthesizer.synthesize(channel, new Deduplicator(false, 0)));
        return config;
    }

    @Test
    void completeIntegrationsPass() {
        var email = LegacyFixtures.channel(1, 1, "e", "email").build();
        email.getSettings().put("addresses", "a@b.c");
        assertDoesNotThrow(() -> validator.validate(configWith(email)));

        var slack = LegacyFixtures.channel(2, 1, "s", "slack").build();
        slack.getSettings().put("token", "xoxb");
        assertDoesNotThrow(() -> validator.validate(configWith(slack)));
    }

    @Test
    void missingRequiredSettingFails() {
        var e = assertThrows(AlertmanagerConfigException.class,
            () -> validator.validate(configWith(LegacyFixtures.channel(1, 1, "e", "email").build())));
        assertThat(e.getMessage(), containsString("could not find addresses property in settings"));
        assertThat(e.getMessage(), containsString("(UID e)"));
    }

    @Test
    void unsupportedTypeFails() {
        var e = assertThrows(AlertmanagerConfigException.class,
            () -> validator.validate(configWith(LegacyFixtures.channel(1, 1, "x", "carrier-pigeon").build())));
        assertThat(e.getMessage(), containsString("notifier carrier-pigeon is not supported"));
    }

    @Test
    void danglingRouteReceiverFails() {
        var config = AlertmanagerConfigs.baseConfig();
        var route = new Route();
        route.setReceiver("ghost");
        AlertmanagerConfigs.getOrCreateLegacyRoute(config).getRoutes().add(route);
        var e = assertThrows(AlertmanagerConfigException.class, () -> validator.validate(config));
        assertThat(e.getMessage(), containsString("undefined receiver 'ghost'"));
    }

    @Test
    void duplicateReceiverFails() {
        var config = AlertmanagerConfigs.baseConfig();
        config.getAlertmanagerConfig().getReceivers().add(new Receiver(AlertmanagerConfigs.DEFAULT_RECEIVER));
        assertThrows(AlertmanagerConfigException.class, () -> validator.validate(config));
    }
}
