package org.alertingupgrade.migrations.rules;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class AlertQuery {
    /** Datasource UID reserved for server side expressions */
    public static final String EXPRESSION_DATASOURCE_UID = "__expr__";

    String refId;
    String queryType;
    RelativeTimeRange relativeTimeRange;
    String datasourceUid;
    ObjectNode model;

    public boolean isExpression() {
        return EXPRESSION_DATASOURCE_UID.equals(datasourceUid);
    }
}
