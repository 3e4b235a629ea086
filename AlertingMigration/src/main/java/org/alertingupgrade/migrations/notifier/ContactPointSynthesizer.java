package org.alertingupgrade.migrations.notifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.alertingupgrade.migrations.common.ModelDuration;
import org.alertingupgrade.migrations.dedup.Deduplicator;
import org.alertingupgrade.migrations.legacy.LegacyNotificationChannel;
import org.alertingupgrade.migrations.rules.MigrationLabels;
import org.alertingupgrade.migrations.secrets.EncryptionException;
import org.alertingupgrade.migrations.secrets.EncryptionService;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Turns a legacy notification channel into a receiver plus a route under the nested legacy route */
@Slf4j
@AllArgsConstructor
public class ContactPointSynthesizer {
    static final Set<String> DISCONTINUED_TYPES = Set.of("hipchat", "sensu");

    /** Settings that older releases stored in plain text before they became secure settings */
    static final Map<String, List<String>> SECURE_KEYS_TO_MIGRATE = Map.of(
        "slack", List.of("url", "token"),
        "pagerduty", List.of("integrationKey"),
        "webhook", List.of("password"),
        "prometheus-alertmanager", List.of("basicAuthPassword"),
        "opsgenie", List.of("apiKey"),
        "telegram", List.of("bottoken"),
        "line", List.of("token"),
        "pushover", List.of("apiToken", "userKey"),
        "threema", List.of("api_secret")
    );

    /** Long enough that a firing alert is effectively never re-sent */
    static final Duration DISABLED_REPEAT_INTERVAL = Duration.ofDays(7 * 52);

    private final EncryptionService encryptionService;
    private final ObjectMapper mapper;

    /**
     * @param receiverNames names already taken in the configuration; the new receiver's name is added
     * @throws ContactPointException for discontinued types and undecryptable secure settings
     */
    public MigratedChannel synthesize(LegacyNotificationChannel channel, Deduplicator receiverNames) {
        if (DISCONTINUED_TYPES.contains(channel.getType())) {
            throw new ContactPointException(channel.getType() + " is a discontinued integration");
        }

        var integration = createIntegration(channel);
        var receiverName = channel.getName();
        if (receiverNames.contains(receiverName)) {
            receiverName = receiverNames.deduplicate(receiverName);
            log.atWarn().setMessage("Receiver name '{}' is already used, renaming it to '{}'")
                .addArgument(channel.getName())
                .addArgument(receiverName)
                .log();
        }
        receiverNames.add(receiverName);

        var receiver = new Receiver(receiverName);
        receiver.getIntegrations().add(integration);
        return MigratedChannel.builder()
            .receiver(receiver)
            .route(createRoute(channel, receiverName))
            .build();
    }

    private GrafanaIntegration createIntegration(LegacyNotificationChannel channel) {
        var settings = channel.getSettings() == null ? mapper.createObjectNode() : channel.getSettings().deepCopy();
        var secureSettings = decryptAll(channel);

        for (var key : SECURE_KEYS_TO_MIGRATE.getOrDefault(channel.getType(), List.of())) {
            var existing = secureSettings.get(key);
            if (existing != null && !existing.isEmpty()) {
                continue;
            }
            var value = settings.path(key);
            // only strings move; other types stay in the plain settings
            var plain = value.isTextual() ? value.textValue() : "";
            if (!plain.isEmpty()) {
                secureSettings.put(key, plain);
                settings.remove(key);
            }
        }

        var integration = new GrafanaIntegration();
        integration.setUid(channel.getUid());
        integration.setName(channel.getName());
        integration.setType(channel.getType());
        integration.setDisableResolveMessage(channel.isDisableResolveMessage());
        integration.setSettings(settings);
        integration.setSecureSettings(encryptAll(secureSettings));
        return integration;
    }

    private Map<String, String> decryptAll(LegacyNotificationChannel channel) {
        var decrypted = new LinkedHashMap<String, String>();
        channel.getSecureSettings().forEach((key, value) -> {
            try {
                var plain = encryptionService.decrypt(Base64.getDecoder().decode(value));
                decrypted.put(key, new String(plain, StandardCharsets.UTF_8));
            } catch (EncryptionException | IllegalArgumentException e) {
                throw new ContactPointException("failed to decrypt secure setting '" + key + "'", e);
            }
        });
        return decrypted;
    }

    private Map<String, String> encryptAll(Map<String, String> plain) {
        var encrypted = new LinkedHashMap<String, String>();
        plain.forEach((key, value) -> {
            try {
                var cipher = encryptionService.encrypt(value.getBytes(StandardCharsets.UTF_8));
                encrypted.put(key, Base64.getEncoder().encodeToString(cipher));
            } catch (EncryptionException e) {
                throw new ContactPointException("failed to encrypt secure setting '" + key + "'", e);
            }
        });
        return encrypted;
    }

    /**
     * Default channels received every legacy alert, so their route matches everything. Other channels match the
     * per-channel label that migrated rules carry.
     */
    static Route createRoute(LegacyNotificationChannel channel, String receiverName) {
        var route = new Route();
        route.setReceiver(receiverName);
        if (channel.isDefault()) {
            route.getObjectMatchers().add(ObjectMatcher.regex(AlertmanagerConfigs.ALERT_NAME_LABEL, ".+"));
        } else {
            route.getObjectMatchers().add(ObjectMatcher.equal(MigrationLabels.contactLabel(channel.getUid()), "true"));
        }
        route.setContinueMatching(true);
        var repeatInterval = channel.isSendReminder() && channel.getFrequency() != null
            ? channel.getFrequency()
            : DISABLED_REPEAT_INTERVAL;
        route.setRepeatInterval(ModelDuration.format(repeatInterval));
        return route;
    }
}
