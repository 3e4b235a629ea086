package org.alertingupgrade.migrations.silences;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import org.alertingupgrade.migrations.rules.MigratedRule;
import org.alertingupgrade.migrations.rules.MigrationLabels;
import org.alertingupgrade.migrations.silences.proto.Matcher;
import org.alertingupgrade.migrations.silences.proto.MeshSilence;
import org.alertingupgrade.migrations.silences.proto.Silence;

import com.google.protobuf.Timestamp;

/**
 * Unified alerting has no "keep last state": a rule with no data or failing queries fires a synthetic
 * DatasourceNoData or DatasourceError alert. Silencing those alerts for the rule keeps the legacy behaviour
 * of notifying nobody.
 */
public class SilenceSynthesizer {
    public static final String NO_DATA_ALERT_NAME = "DatasourceNoData";
    public static final String ERROR_ALERT_NAME = "DatasourceError";
    static final String CREATED_BY = "Grafana Migration";
    static final String COMMENT = "migrated from legacy alerting";
    static final Duration SILENCE_DURATION = Duration.ofDays(365);
    /** Expired silences are kept this long before the Alertmanager garbage collects them */
    static final Duration RETENTION = Duration.ofDays(5);

    private final Clock clock;
    private final Supplier<String> idSupplier;

    public SilenceSynthesizer(Clock clock) {
        this(clock, () -> UUID.randomUUID().toString());
    }

    public SilenceSynthesizer(Clock clock, Supplier<String> idSupplier) {
        this.clock = clock;
        this.idSupplier = idSupplier;
    }

    /** One silence per legacy state that was "keep last state"; none when neither was */
    public List<MeshSilence> synthesize(MigratedRule migrated) {
        var silences = new ArrayList<MeshSilence>();
        var ruleUid = migrated.getRule().getUid();
        if (migrated.isKeepStateOnNoData()) {
            silences.add(silence(NO_DATA_ALERT_NAME, ruleUid));
        }
        if (migrated.isKeepStateOnError()) {
            silences.add(silence(ERROR_ALERT_NAME, ruleUid));
        }
        return silences;
    }

    private MeshSilence silence(String alertName, String ruleUid) {
        var now = clock.instant();
        var end = now.plus(SILENCE_DURATION);
        var silence = Silence.newBuilder()
            .setId(idSupplier.get())
            .addMatchers(equalMatcher("alertname", alertName))
            .addMatchers(equalMatcher(MigrationLabels.RULE_UID_LABEL, ruleUid))
            .setStartsAt(timestamp(now))
            .setEndsAt(timestamp(end))
            .setUpdatedAt(timestamp(now))
            .setCreatedBy(CREATED_BY)
            .setComment(COMMENT)
            .build();
        return MeshSilence.newBuilder()
            .setSilence(silence)
            .setExpiresAt(timestamp(end.plus(RETENTION)))
            .build();
    }

    private static Matcher equalMatcher(String name, String value) {
        return Matcher.newBuilder().setType(Matcher.Type.EQUAL).setName(name).setPattern(value).build();
    }

    static Timestamp timestamp(Instant instant) {
        return Timestamp.newBuilder().setSeconds(instant.getEpochSecond()).setNanos(instant.getNano()).build();
    }
}
