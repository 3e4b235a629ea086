package org.alertingupgrade.migrations.rules;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.alertingupgrade.migrations.common.ModelDuration;
import org.alertingupgrade.migrations.datasources.Datasource;
import org.alertingupgrade.migrations.datasources.DatasourceCache;
import org.alertingupgrade.migrations.datasources.DatasourceNotFoundException;
import org.alertingupgrade.migrations.legacy.LegacyAlertCondition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns classic conditions into a graph of queries and server side expressions: per condition one reduce
 * expression over its query and one threshold expression over the reduction, then one math expression that
 * chains the thresholds strictly left to right with the legacy operators.
 */
@Slf4j
@AllArgsConstructor
public class ConditionTranslator {
    static final String DEFAULT_FROM = "5m";
    static final String DEFAULT_TO = "now";
    static final int DEFAULT_INTERVAL_MS = 1000;
    static final int DEFAULT_MAX_DATA_POINTS = 43200;
    static final String NO_VALUE_EVALUATOR = "no_value";

    private static final Map<String, String> REDUCERS = Map.ofEntries(
        Map.entry("avg", "mean"),
        Map.entry("min", "min"),
        Map.entry("max", "max"),
        Map.entry("sum", "sum"),
        Map.entry("count", "count"),
        Map.entry("last", "last"),
        Map.entry("median", "median"),
        Map.entry("diff", "diff"),
        Map.entry("diff_abs", "diff_abs"),
        Map.entry("percent_diff", "percent_diff"),
        Map.entry("percent_diff_abs", "percent_diff_abs"),
        Map.entry("count_non_null", "count_non_null")
    );

    private static final Map<String, Integer> THRESHOLD_PARAM_COUNT = Map.of(
        "gt", 1,
        "lt", 1,
        "within_range", 2,
        "outside_range", 2
    );

    private final DatasourceCache datasourceCache;
    private final ObjectMapper mapper;

    /**
     * @throws ConditionTranslationException for anything that cannot be expressed, including unknown datasources
     */
    public TranslatedCondition translate(long orgId, List<LegacyAlertCondition> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            throw new ConditionTranslationException("alert has no conditions");
        }

        var refIds = new RefIdSequence();
        for (var condition : conditions) {
            refIds.reserve(originalRefId(condition));
        }

        var data = new ArrayList<AlertQuery>();
        var queryRefByRange = new HashMap<String, String>();
        var claimedOriginalRefIds = new HashMap<String, String>();
        var evaluationRefIds = new ArrayList<String>();

        for (int i = 0; i < conditions.size(); i++) {
            var condition = conditions.get(i);
            var queryRefId = addDatasourceQuery(orgId, condition, refIds, queryRefByRange, claimedOriginalRefIds, data);

            var reduceRefId = refIds.next();
            data.add(expression(reduceRefId, reduceModel(reduceRefId, queryRefId, condition, i)));

            var evalRefId = refIds.next();
            data.add(expression(evalRefId, evaluatorModel(evalRefId, reduceRefId, condition, i)));
            evaluationRefIds.add(evalRefId);
        }

        if (evaluationRefIds.size() == 1) {
            return TranslatedCondition.builder().condition(evaluationRefIds.get(0)).data(data).build();
        }

        var combinedRefId = refIds.next();
        var expressionText = new StringBuilder("${" + evaluationRefIds.get(0) + "}");
        for (int i = 1; i < evaluationRefIds.size(); i++) {
            expressionText.insert(0, "(")
                .append(") ")
                .append(booleanOperator(conditions.get(i), i))
                .append(" ${")
                .append(evaluationRefIds.get(i))
                .append("}");
        }
        var combined = expressionModel(combinedRefId, "math");
        combined.put("expression", expressionText.toString());
        data.add(expression(combinedRefId, combined));

        return TranslatedCondition.builder().condition(combinedRefId).data(data).build();
    }

    private String addDatasourceQuery(long orgId,
                                      LegacyAlertCondition condition,
                                      RefIdSequence refIds,
                                      Map<String, String> queryRefByRange,
                                      Map<String, String> claimedOriginalRefIds,
                                      List<AlertQuery> data) {
        var originalRefId = originalRefId(condition);
        var params = condition.getQuery().getParams();
        var from = parseRelative(params.size() > 1 ? params.get(1) : DEFAULT_FROM);
        var to = parseRelative(params.size() > 2 ? params.get(2) : DEFAULT_TO);
        var rangeKey = originalRefId + "|" + from.getSeconds() + "|" + to.getSeconds();

        var existing = queryRefByRange.get(rangeKey);
        if (existing != null) {
            return existing;
        }

        // the same query evaluated over another time range needs its own refId
        var refId = claimedOriginalRefIds.containsKey(originalRefId) ? refIds.next() : originalRefId;
        claimedOriginalRefIds.put(originalRefId, refId);
        queryRefByRange.put(rangeKey, refId);

        var datasource = resolveDatasource(orgId, condition.getQuery().getDatasourceId());
        var model = condition.getQuery().getModel();
        if (model == null) {
            throw new ConditionTranslationException("condition query " + originalRefId + " has no model");
        }
        model = model.deepCopy();
        model.put("refId", refId);
        model.set("datasource", mapper.createObjectNode()
            .put("type", datasource.getType())
            .put("uid", datasource.getUid()));
        if (!model.has("intervalMs")) {
            model.put("intervalMs", DEFAULT_INTERVAL_MS);
        }
        if (!model.has("maxDataPoints")) {
            model.put("maxDataPoints", DEFAULT_MAX_DATA_POINTS);
        }

        data.add(AlertQuery.builder()
            .refId(refId)
            .queryType(model.path("queryType").asText(""))
            .relativeTimeRange(RelativeTimeRange.of(from, to))
            .datasourceUid(datasource.getUid())
            .model(model)
            .build());
        return refId;
    }

    private Datasource resolveDatasource(long orgId, long datasourceId) {
        try {
            return datasourceCache.getDatasource(orgId, datasourceId);
        } catch (DatasourceNotFoundException e) {
            throw new ConditionTranslationException("failed to resolve datasource " + datasourceId, e);
        }
    }

    private ObjectNode reduceModel(String refId, String queryRefId, LegacyAlertCondition condition, int index) {
        var legacyReducer = condition.getReducer() == null ? null : condition.getReducer().getType();
        var reducer = legacyReducer == null ? null : REDUCERS.get(legacyReducer);
        if (reducer == null) {
            throw new ConditionTranslationException(
                "condition " + index + " uses unsupported reducer '" + legacyReducer + "'");
        }
        var model = expressionModel(refId, "reduce");
        model.put("expression", queryRefId);
        model.put("reducer", reducer);
        return model;
    }

    private ObjectNode evaluatorModel(String refId, String reduceRefId, LegacyAlertCondition condition, int index) {
        var evaluator = condition.getEvaluator();
        var type = evaluator == null ? null : evaluator.getType();
        if (NO_VALUE_EVALUATOR.equals(type)) {
            var model = expressionModel(refId, "math");
            model.put("expression", "is_null(${" + reduceRefId + "})");
            return model;
        }
        var paramCount = type == null ? null : THRESHOLD_PARAM_COUNT.get(type);
        if (paramCount == null) {
            throw new ConditionTranslationException("condition " + index + " uses unsupported evaluator '" + type + "'");
        }
        var params = evaluator.getParams() == null ? List.<Double>of() : evaluator.getParams();
        if (params.size() < paramCount) {
            throw new ConditionTranslationException("condition " + index + " evaluator '" + type + "' needs "
                + paramCount + " parameter(s) but has " + params.size());
        }

        var model = expressionModel(refId, "threshold");
        model.put("expression", reduceRefId);
        var evaluatorNode = mapper.createObjectNode().put("type", type);
        var paramsNode = evaluatorNode.putArray("params");
        params.subList(0, paramCount).forEach(paramsNode::add);
        model.putArray("conditions").addObject().set("evaluator", evaluatorNode);
        return model;
    }

    private ObjectNode expressionModel(String refId, String type) {
        var model = mapper.createObjectNode();
        model.put("refId", refId);
        model.put("type", type);
        model.set("datasource", mapper.createObjectNode()
            .put("type", AlertQuery.EXPRESSION_DATASOURCE_UID)
            .put("uid", AlertQuery.EXPRESSION_DATASOURCE_UID));
        return model;
    }

    private static AlertQuery expression(String refId, ObjectNode model) {
        return AlertQuery.builder()
            .refId(refId)
            .queryType("")
            .relativeTimeRange(RelativeTimeRange.NONE)
            .datasourceUid(AlertQuery.EXPRESSION_DATASOURCE_UID)
            .model(model)
            .build();
    }

    private static String booleanOperator(LegacyAlertCondition condition, int index) {
        var type = condition.getOperator() == null ? null : condition.getOperator().getType();
        if (type == null || type.isEmpty() || "and".equals(type)) {
            return "&&";
        }
        if ("or".equals(type)) {
            return "||";
        }
        throw new ConditionTranslationException("condition " + index + " uses unsupported operator '" + type + "'");
    }

    private static String originalRefId(LegacyAlertCondition condition) {
        var query = condition.getQuery();
        if (query == null || query.getParams() == null || query.getParams().isEmpty()
            || query.getParams().get(0) == null || query.getParams().get(0).isEmpty()) {
            throw new ConditionTranslationException("condition is missing its query reference");
        }
        return query.getParams().get(0);
    }

    /** Accepts {@code now}, {@code now-5m} and bare durations like {@code 5m} */
    static Duration parseRelative(String text) {
        if ("now".equals(text)) {
            return Duration.ZERO;
        }
        var trimmed = text.startsWith("now-") ? text.substring("now-".length()) : text;
        try {
            return ModelDuration.parse(trimmed);
        } catch (IllegalArgumentException e) {
            throw new ConditionTranslationException("failed to parse relative time range '" + text + "'", e);
        }
    }
}
