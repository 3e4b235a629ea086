package org.alertingupgrade.migrations.rules;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TranslatedCondition {
    /** refId of the expression that decides whether the rule fires */
    String condition;
    /** Datasource queries followed by the generated expressions, in evaluation order */
    List<AlertQuery> data;
}
