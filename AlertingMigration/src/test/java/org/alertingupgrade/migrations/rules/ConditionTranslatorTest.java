package org.alertingupgrade.migrations.rules;

import java.util.List;
import java.util.stream.Collectors;

import org.alertingupgrade.migrations.legacy.LegacyAlertCondition;
import org.alertingupgrade.migrations.testutils.LegacyFixtures;

import org.junit.jupiter.api.Test;

import static org.alertingupgrade.migrations.testutils.LegacyFixtures.MAPPER;
import static org.alertingupgrade.migrations.testutils.LegacyFixtures.condition;
import static org.alertingupgrade.migrations.testutils.LegacyFixtures.gtCondition;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConditionTranslatorTest {

    private final ConditionTranslator translator = new ConditionTranslator(LegacyFixtures.datasources(), MAPPER);

    private static List<String> refIds(TranslatedCondition translated) {
        return translated.getData().stream().map(AlertQuery::getRefId).collect(Collectors.toList());
    }

    private static AlertQuery byRefId(TranslatedCondition translated, String refId) {
        return translated.getData().stream().filter(q -> q.getRefId().equals(refId)).findFirst().orElseThrow();
    }

    @Test
    void singleConditionYieldsQueryReduceAndThreshold() {
        var translated = translator.translate(1, List.of(gtCondition("A")));

        assertThat(refIds(translated), contains("A", "B", "C"));
        assertThat(translated.getCondition(), equalTo("C"));

        var query = byRefId(translated, "A");
        assertThat(query.getDatasourceUid(), equalTo(LegacyFixtures.PROMETHEUS_DS_UID));
        assertThat(query.getRelativeTimeRange().getFrom(), equalTo(300L));
        assertThat(query.getRelativeTimeRange().getTo(), equalTo(0L));
        assertThat(query.getModel().get("intervalMs").asInt(), equalTo(ConditionTranslator.DEFAULT_INTERVAL_MS));
        assertThat(query.getModel().get("maxDataPoints").asInt(), equalTo(ConditionTranslator.DEFAULT_MAX_DATA_POINTS));
        assertThat(query.getModel().get("datasource").get("uid").asText(), equalTo(LegacyFixtures.PROMETHEUS_DS_UID));

        var reduce = byRefId(translated, "B");
        assertThat(reduce.isExpression(), equalTo(true));
        assertThat(reduce.getModel().get("type").asText(), equalTo("reduce"));
        assertThat(reduce.getModel().get("reducer").asText(), equalTo("mean"));
        assertThat(reduce.getModel().get("expression").asText(), equalTo("A"));

        var threshold = byRefId(translated, "C");
        assertThat(threshold.getModel().get("type").asText(), equalTo("threshold"));
        assertThat(threshold.getModel().get("expression").asText(), equalTo("B"));
        var evaluator = threshold.getModel().get("conditions").get(0).get("evaluator");
        assertThat(evaluator.get("type").asText(), equalTo("gt"));
        assertThat(evaluator.get("params").get(0).asDouble(), equalTo(10.0));
    }

    @Test
    void conditionsChainStrictlyLeftToRight() {
        var second = condition("A", "5m", "now", "max", "lt", 3);
        second.setOperator(new LegacyAlertCondition.Operator("or"));
        var third = condition("A", "5m", "now", "min", "gt", 1);

        var translated = translator.translate(1, List.of(gtCondition("A"), second, third));

        // one shared query, then reduce+threshold per condition, then the combining math expression
        assertThat(refIds(translated), contains("A", "B", "C", "D", "E", "F", "G", "H"));
        assertThat(translated.getCondition(), equalTo("H"));
        var math = byRefId(translated, "H").getModel();
        assertThat(math.get("type").asText(), equalTo("math"));
        assertThat(math.get("expression").asText(), equalTo("((${C}) || ${E}) && ${G}"));
    }

    @Test
    void sameQueryOverAnotherRangeGetsItsOwnRefId() {
        var translated = translator.translate(1, List.of(
            condition("A", "5m", "now", "avg", "gt", 1),
            condition("A", "10m", "now-1m", "avg", "gt", 1)
        ));

        var queries = translated.getData().stream().filter(q -> !q.isExpression()).collect(Collectors.toList());
        assertThat(queries, hasSize(2));
        assertThat(queries.get(0).getRefId(), equalTo("A"));
        var other = queries.get(1);
        assertThat(other.getRelativeTimeRange().getFrom(), equalTo(600L));
        assertThat(other.getRelativeTimeRange().getTo(), equalTo(60L));
        assertThat(other.getModel().get("refId").asText(), equalTo(other.getRefId()));
    }

    @Test
    void missingRangeDefaultsToLastFiveMinutes() {
        var translated = translator.translate(1, List.of(condition("A", null, null, "last", "gt", 1)));
        var range = byRefId(translated, "A").getRelativeTimeRange();
        assertThat(range.getFrom(), equalTo(300L));
        assertThat(range.getTo(), equalTo(0L));
    }

    @Test
    void noValueEvaluatorBecomesIsNull() {
        var translated = translator.translate(1, List.of(condition("A", "5m", "now", "avg", "no_value")));
        var model = byRefId(translated, translated.getCondition()).getModel();
        assertThat(model.get("type").asText(), equalTo("math"));
        assertThat(model.get("expression").asText(), equalTo("is_null(${B})"));
    }

    @Test
    void rangeEvaluatorsKeepBothParams() {
        var translated = translator.translate(1, List.of(condition("A", "5m", "now", "avg", "within_range", 1, 5)));
        var evaluator = byRefId(translated, "C").getModel().get("conditions").get(0).get("evaluator");
        assertThat(evaluator.get("params").size(), equalTo(2));
    }

    @Test
    void unknownDatasourceFails() {
        var condition = gtCondition("A");
        condition.getQuery().setDatasourceId(99);
        var e = assertThrows(ConditionTranslationException.class,
            () -> translator.translate(1, List.of(condition)));
        assertThat(e.getMessage(), containsString("99"));
    }

    @Test
    void unsupportedPartsFail() {
        assertThrows(ConditionTranslationException.class, () -> translator.translate(1, List.of()));
        assertThrows(ConditionTranslationException.class,
            () -> translator.translate(1, List.of(condition("A", "5m", "now", "stddev", "gt", 1))));
        assertThrows(ConditionTranslationException.class,
            () -> translator.translate(1, List.of(condition("A", "5m", "now", "avg", "between", 1))));
        assertThrows(ConditionTranslationException.class,
            () -> translator.translate(1, List.of(condition("A", "5m", "now", "avg", "within_range", 1))));
        assertThrows(ConditionTranslationException.class,
            () -> translator.translate(1, List.of(condition("A", "yesterday", "now", "avg", "gt", 1))));
    }

    @Test
    void refIdSequenceSkipsReservedAndRollsOver() {
        var seq = new RefIdSequence();
        seq.reserve("B");
        assertThat(seq.next(), equalTo("A"));
        assertThat(seq.next(), equalTo("C"));
        for (int i = 0; i < 22; i++) {
            seq.next();
        }
        assertThat(seq.next(), equalTo("Z"));
        assertThat(seq.next(), equalTo("AA"));
    }
}
