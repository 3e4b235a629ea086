package org.alertingupgrade.migrations.rules;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A unified alerting rule synthesized from one legacy alert */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {
    /** Column width of {@code alert_rule.title} */
    public static final int MAX_TITLE_LENGTH = 190;

    private long orgId;
    private String uid;
    private String title;
    /** refId of the query or expression whose result decides firing */
    private String condition;
    @Builder.Default
    private List<AlertQuery> data = new ArrayList<>();
    private long intervalSeconds;
    private long version;
    private String namespaceUid;
    private String dashboardUid;
    private Long panelId;
    private String ruleGroup;
    private int ruleGroupIndex;
    private NoDataState noDataState;
    private ExecutionErrorState execErrState;
    private Duration forDuration;
    private Instant updated;
    @Builder.Default
    private Map<String, String> annotations = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, String> labels = new LinkedHashMap<>();
    private boolean paused;
}
