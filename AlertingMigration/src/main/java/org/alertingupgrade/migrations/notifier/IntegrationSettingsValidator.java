package org.alertingupgrade.migrations.notifier;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.alertingupgrade.migrations.secrets.EncryptionException;
import org.alertingupgrade.migrations.secrets.EncryptionService;

import lombok.AllArgsConstructor;

/**
 * Validates routing references and that each integration carries the settings its type needs. Every set of keys
 * listed for a type must be satisfied by at least one of its keys, found in settings or secure settings.
 */
@AllArgsConstructor
public class IntegrationSettingsValidator implements NotifierValidator {
    static final Map<String, List<List<String>>> REQUIRED_SETTINGS = Map.ofEntries(
        Map.entry("email", List.of(List.of("addresses"))),
        Map.entry("slack", List.of(List.of("url", "token"))),
        Map.entry("pagerduty", List.of(List.of("integrationKey"))),
        Map.entry("webhook", List.of(List.of("url"))),
        Map.entry("prometheus-alertmanager", List.of(List.of("url"))),
        Map.entry("opsgenie", List.of(List.of("apiKey"))),
        Map.entry("telegram", List.of(List.of("bottoken"), List.of("chatid"))),
        Map.entry("line", List.of(List.of("token"))),
        Map.entry("pushover", List.of(List.of("apiToken"), List.of("userKey"))),
        Map.entry("threema", List.of(List.of("gateway_id"), List.of("recipient_id"), List.of("api_secret"))),
        Map.entry("discord", List.of(List.of("url"))),
        Map.entry("googlechat", List.of(List.of("url"))),
        Map.entry("teams", List.of(List.of("url"))),
        Map.entry("victorops", List.of(List.of("url"))),
        Map.entry("kafka", List.of(List.of("kafkaRestProxy"), List.of("kafkaTopic"))),
        Map.entry("sensugo", List.of(List.of("url"), List.of("apikey"))),
        Map.entry("dingding", List.of(List.of("url"))),
        Map.entry("wecom", List.of(List.of("url", "secret")))
    );

    private final EncryptionService encryptionService;

    @Override
    public void validate(AlertmanagerConfiguration config) {
        var alerting = config.getAlertmanagerConfig();
        if (alerting == null || alerting.getRoute() == null) {
            throw new AlertmanagerConfigException("configuration has no root route");
        }
        var receiverNames = new HashSet<String>();
        for (var receiver : alerting.getReceivers()) {
            if (!receiverNames.add(receiver.getName())) {
                throw new AlertmanagerConfigException("receiver '" + receiver.getName() + "' is defined more than once");
            }
            for (var integration : receiver.getIntegrations()) {
                validateIntegration(receiver.getName(), integration);
            }
        }
        validateRoute(alerting.getRoute(), receiverNames);
    }

    private void validateRoute(Route route, Set<String> receiverNames) {
        if (route.getReceiver() != null && !receiverNames.contains(route.getReceiver())) {
            throw new AlertmanagerConfigException("route references undefined receiver '" + route.getReceiver() + "'");
        }
        for (var child : route.getRoutes()) {
            validateRoute(child, receiverNames);
        }
    }

    private void validateIntegration(String receiverName, GrafanaIntegration integration) {
        var prefix = "failed to validate integration \"" + integration.getName() + "\" (UID " + integration.getUid()
            + ") of receiver '" + receiverName + "': ";
        var required = REQUIRED_SETTINGS.get(integration.getType());
        if (required == null) {
            throw new AlertmanagerConfigException(prefix + "notifier " + integration.getType() + " is not supported");
        }
        if (integration.getSettings() == null) {
            throw new AlertmanagerConfigException(prefix + "settings must be a JSON object");
        }

        var secure = new HashMap<String, String>();
        integration.getSecureSettings().forEach((key, value) -> {
            try {
                var plain = encryptionService.decrypt(Base64.getDecoder().decode(value));
                secure.put(key, new String(plain, StandardCharsets.UTF_8));
            } catch (EncryptionException | IllegalArgumentException e) {
                throw new AlertmanagerConfigException(prefix + "failed to decrypt secure setting '" + key + "'", e);
            }
        });

        for (var alternatives : required) {
            var satisfied = alternatives.stream().anyMatch(key ->
                !integration.getSettings().path(key).asText("").isEmpty()
                    || !secure.getOrDefault(key, "").isEmpty());
            if (!satisfied) {
                throw new AlertmanagerConfigException(prefix + "could not find " + String.join(" or ", alternatives)
                    + " property in settings");
            }
        }
    }
}
