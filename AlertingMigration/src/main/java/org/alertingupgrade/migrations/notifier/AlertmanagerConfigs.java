package org.alertingupgrade.migrations.notifier;

import java.util.ArrayList;
import java.util.List;

import org.alertingupgrade.migrations.rules.MigrationLabels;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;

/** Building, parsing and editing of the migrated part of an Alertmanager configuration */
@UtilityClass
public class AlertmanagerConfigs {
    public static final String DEFAULT_RECEIVER = "autogen-contact-point-default";
    public static final String FOLDER_TITLE_LABEL = "grafana_folder";
    public static final String ALERT_NAME_LABEL = "alertname";

    /** A root route with the default receiver and an empty nested legacy route */
    public static AlertmanagerConfiguration baseConfig() {
        var root = new Route();
        root.setReceiver(DEFAULT_RECEIVER);
        root.setGroupBy(new ArrayList<>(List.of(FOLDER_TITLE_LABEL, ALERT_NAME_LABEL)));
        root.getRoutes().add(newLegacyRoute());

        var config = new AlertmanagerConfiguration();
        config.getAlertmanagerConfig().setRoute(root);
        config.getAlertmanagerConfig().getReceivers().add(new Receiver(DEFAULT_RECEIVER));
        return config;
    }

    /** The nested route holding migrated channel routes, inserted as the root's first child when missing */
    public static Route getOrCreateLegacyRoute(AlertmanagerConfiguration config) {
        var root = config.getAlertmanagerConfig().getRoute();
        if (root == null) {
            throw new AlertmanagerConfigException("alertmanager configuration has no root route");
        }
        for (var route : root.getRoutes()) {
            if (isLegacyRoute(route)) {
                return route;
            }
        }
        var legacyRoute = newLegacyRoute();
        root.getRoutes().add(0, legacyRoute);
        return legacyRoute;
    }

    public static boolean isLegacyRoute(Route route) {
        return route.getObjectMatchers().size() == 1
            && MigrationLabels.USE_LEGACY_CHANNELS_LABEL.equals(route.getObjectMatchers().get(0).getName());
    }

    public static void addChannel(AlertmanagerConfiguration config, MigratedChannel channel) {
        getOrCreateLegacyRoute(config).getRoutes().add(channel.getRoute());
        config.getAlertmanagerConfig().getReceivers().add(channel.getReceiver());
    }

    /** Drops the receiver with this name and every nested legacy route that delivers to it */
    public static void removeChannel(AlertmanagerConfiguration config, String receiverName) {
        config.getAlertmanagerConfig().getReceivers().removeIf(r -> receiverName.equals(r.getName()));
        getOrCreateLegacyRoute(config).getRoutes().removeIf(r -> receiverName.equals(r.getReceiver()));
    }

    public static List<String> receiverNames(AlertmanagerConfiguration config) {
        var names = new ArrayList<String>();
        config.getAlertmanagerConfig().getReceivers().forEach(r -> names.add(r.getName()));
        return names;
    }

    public static AlertmanagerConfiguration parse(ObjectMapper mapper, String json) {
        try {
            var config = mapper.readValue(json, AlertmanagerConfiguration.class);
            if (config.getAlertmanagerConfig() == null) {
                throw new AlertmanagerConfigException("stored alertmanager configuration has no alertmanager_config");
            }
            return config;
        } catch (JsonProcessingException e) {
            throw new AlertmanagerConfigException("failed to parse stored alertmanager configuration", e);
        }
    }

    public static String serialize(ObjectMapper mapper, AlertmanagerConfiguration config) {
        try {
            return mapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new AlertmanagerConfigException("failed to serialize alertmanager configuration", e);
        }
    }

    private static Route newLegacyRoute() {
        var route = new Route();
        route.getObjectMatchers().add(ObjectMatcher.equal(MigrationLabels.USE_LEGACY_CHANNELS_LABEL, "true"));
        route.setContinueMatching(true);
        return route;
    }
}
