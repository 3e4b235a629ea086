package org.alertingupgrade.migrations.rules;

import java.util.List;

import org.alertingupgrade.migrations.testutils.CloseableLogSetup;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.alertingupgrade.migrations.testutils.LegacyFixtures.MAPPER;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueryRewriterTest {

    private final QueryRewriter rewriter = new QueryRewriter(MAPPER);

    private static ObjectNode prometheusBoth() {
        var model = MAPPER.createObjectNode();
        model.put("expr", "up");
        model.put("instant", true);
        model.put("range", true);
        model.set("datasource", MAPPER.createObjectNode().put("type", "prometheus").put("uid", "p"));
        return model;
    }

    @Test
    void hideIsAlwaysRemoved() {
        var model = MAPPER.createObjectNode().put("hide", true).put("expr", "up");
        var rewritten = rewriter.rewrite(model);
        assertFalse(rewritten.has("hide"));
        assertThat(rewritten.get("expr").asText(), equalTo("up"));
    }

    @Test
    void graphiteTargetFullReplacesTarget() {
        var model = MAPPER.createObjectNode().put("target", "#A").put("targetFull", "sum(foo.bar)");
        var rewritten = rewriter.rewrite(model);
        assertThat(rewritten.get("target").asText(), equalTo("sum(foo.bar)"));
        assertFalse(rewritten.has("targetFull"));
    }

    @Test
    void prometheusBothBecomesRange() {
        try (var logs = new CloseableLogSetup(QueryRewriter.class.getName())) {
            var rewritten = rewriter.rewrite(prometheusBoth());
            assertThat(rewritten.get("instant").asBoolean(), equalTo(false));
            assertThat(rewritten.get("range").asBoolean(), equalTo(true));
            assertThat(logs.getWarnings(), hasSize(1));
        }
    }

    @Test
    void otherDatasourcesKeepBothFlags() {
        var model = prometheusBoth();
        model.set("datasource", MAPPER.createObjectNode().put("type", "loki").put("uid", "l"));
        var rewritten = rewriter.rewrite(model);
        assertThat(rewritten.get("instant").asBoolean(), equalTo(true));
    }

    @Test
    void missingOrMalformedDatasourceLeavesModelUnchanged() {
        var noDatasource = prometheusBoth();
        noDatasource.remove("datasource");
        assertThat(rewriter.rewrite(noDatasource.deepCopy()), equalTo(noDatasource));

        var textDatasource = prometheusBoth();
        textDatasource.put("datasource", "prometheus");
        assertThat(rewriter.rewrite(textDatasource.deepCopy()), equalTo(textDatasource));
    }

    @Test
    void nonBooleanFlagsAreLeftAlone() {
        try (var logs = new CloseableLogSetup(QueryRewriter.class.getName())) {
            var model = prometheusBoth();
            model.put("instant", "yes");
            var rewritten = rewriter.rewrite(model.deepCopy());
            assertThat(rewritten, equalTo(model));
            assertThat(logs.getLogEvents(), hasItem(startsWith("Failed to parse instant/range")));
        }
    }

    @Test
    void rewritingIsIdempotent() {
        var model = prometheusBoth();
        model.put("hide", false).put("targetFull", "x");
        var once = rewriter.rewrite(model.deepCopy());
        var twice = rewriter.rewrite(once.deepCopy());
        assertThat(twice, equalTo(once));
    }

    @Test
    void expressionsPassThroughUntouched() {
        var expression = AlertQuery.builder()
            .refId("B")
            .datasourceUid(AlertQuery.EXPRESSION_DATASOURCE_UID)
            .model(MAPPER.createObjectNode().put("hide", true))
            .build();
        var result = rewriter.rewriteQueries(List.of(expression));
        assertSame(expression, result.get(0));
    }

    @Test
    void stringPayloadMustBeAnObject() {
        assertThrows(QueryRewriteException.class, () -> rewriter.rewrite("not json"));
        assertThrows(QueryRewriteException.class, () -> rewriter.rewrite("[1,2]"));
        assertThat(rewriter.rewrite("{\"hide\":true,\"expr\":\"up\"}"), equalTo("{\"expr\":\"up\"}"));
    }
}
