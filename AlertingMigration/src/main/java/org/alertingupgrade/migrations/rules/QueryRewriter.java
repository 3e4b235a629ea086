package org.alertingupgrade.migrations.rules;

import java.util.List;
import java.util.stream.Collectors;

import org.alertingupgrade.migrations.datasources.Datasource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Adjusts legacy query models that unified alerting would evaluate differently or not at all.
 * Expression queries pass through untouched.
 */
@Slf4j
@AllArgsConstructor
public class QueryRewriter {
    static final String HIDE_FIELD = "hide";
    static final String TARGET_FIELD = "target";
    static final String TARGET_FULL_FIELD = "targetFull";
    static final String INSTANT_FIELD = "instant";
    static final String RANGE_FIELD = "range";
    static final String DATASOURCE_FIELD = "datasource";

    private final ObjectMapper mapper;

    public List<AlertQuery> rewriteQueries(List<AlertQuery> queries) {
        return queries.stream()
            .map(q -> q.isExpression() ? q : q.toBuilder().model(rewrite(q.getModel().deepCopy())).build())
            .collect(Collectors.toList());
    }

    /**
     * @throws QueryRewriteException when the payload is not a JSON object
     */
    public String rewrite(String payload) {
        JsonNode node;
        try {
            node = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new QueryRewriteException("failed to parse query model", e);
        }
        if (node == null || !node.isObject()) {
            throw new QueryRewriteException("failed to parse query model: not a JSON object", null);
        }
        try {
            return mapper.writeValueAsString(rewrite((ObjectNode) node));
        } catch (JsonProcessingException e) {
            throw new QueryRewriteException("failed to serialize query model", e);
        }
    }

    /** Rewrites the model in place and returns it */
    public ObjectNode rewrite(ObjectNode model) {
        // unified alerting has no hidden-but-evaluated queries
        model.remove(HIDE_FIELD);
        fixGraphiteReferencedSubQueries(model);
        fixPrometheusBothTypeQuery(model);
        return model;
    }

    /** targetFull holds the expanded form of target; referenced sub-queries cannot be resolved in unified alerting */
    private void fixGraphiteReferencedSubQueries(ObjectNode model) {
        var fullQuery = model.remove(TARGET_FULL_FIELD);
        if (fullQuery != null) {
            model.set(TARGET_FIELD, fullQuery);
        }
    }

    /**
     * Prometheus "Both" queries (instant and range) are not supported downstream, so they become range queries.
     */
    private void fixPrometheusBothTypeQuery(ObjectNode model) {
        var instant = model.get(INSTANT_FIELD);
        var range = model.get(RANGE_FIELD);
        if (!isBooleanOrAbsent(instant) || !isBooleanOrAbsent(range)) {
            if (isConfirmedPrometheus(model)) {
                log.atInfo().setMessage("Failed to parse instant/range fields on Prometheus query, leaving it unchanged: "
                        + "instant={}, range={}")
                    .addArgument(instant)
                    .addArgument(range)
                    .log();
            }
            return;
        }
        if (instant == null || !instant.booleanValue() || range == null || !range.booleanValue()) {
            return;
        }

        boolean isPrometheus;
        try {
            isPrometheus = isPrometheusQuery(model);
        } catch (IllegalArgumentException e) {
            log.info("Unable to convert alert rule that resembles a Prometheus 'Both' type query to 'Range': {}",
                e.getMessage());
            return;
        }
        if (!isPrometheus) {
            return;
        }

        log.warn("Prometheus 'Both' type queries are not supported in unified alerting. Converting to range query.");
        model.set(INSTANT_FIELD, BooleanNode.FALSE);
    }

    private static boolean isBooleanOrAbsent(JsonNode flag) {
        return flag == null || flag.isBoolean();
    }

    private static boolean isConfirmedPrometheus(ObjectNode model) {
        try {
            return isPrometheusQuery(model);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * @throws IllegalArgumentException when the model carries no datasource object with a type
     */
    static boolean isPrometheusQuery(ObjectNode model) {
        var datasource = model.get(DATASOURCE_FIELD);
        if (datasource == null) {
            throw new IllegalArgumentException("missing datasource field");
        }
        if (!datasource.isObject()) {
            throw new IllegalArgumentException("failed to parse datasource '" + datasource + "'");
        }
        var type = datasource.path("type").asText("");
        if (type.isEmpty()) {
            throw new IllegalArgumentException("missing type field '" + datasource + "'");
        }
        return Datasource.PROMETHEUS_TYPE.equals(type);
    }
}
