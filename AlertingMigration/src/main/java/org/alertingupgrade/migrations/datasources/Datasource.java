package org.alertingupgrade.migrations.datasources;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Datasource {
    public static final String PROMETHEUS_TYPE = "prometheus";

    long id;
    long orgId;
    String uid;
    String type;
    String name;
}
