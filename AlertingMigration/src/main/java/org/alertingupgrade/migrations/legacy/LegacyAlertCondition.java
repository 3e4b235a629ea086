package org.alertingupgrade.migrations.legacy;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One classic condition: {@code reducer(query) evaluator params}, joined to its predecessor by operator */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegacyAlertCondition {
    private Evaluator evaluator;
    private Operator operator;
    private Query query;
    private Reducer reducer;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Evaluator {
        private List<Double> params = new ArrayList<>();
        private String type;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Operator {
        private String type;
    }

    /** {@code params} holds the referenced refId followed by the optional from/to of the time range */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Query {
        private List<String> params = new ArrayList<>();
        private long datasourceId;
        private ObjectNode model;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Reducer {
        private String type;
    }
}
