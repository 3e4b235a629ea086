package org.alertingupgrade.migrations.notifier;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/** A notification policy node */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class Route extends JsonWithExtras {
    private String receiver;

    @JsonProperty("group_by")
    private List<String> groupBy;

    @JsonProperty("object_matchers")
    private List<ObjectMatcher> objectMatchers = new ArrayList<>();

    private List<Route> routes = new ArrayList<>();

    /** Keep evaluating sibling routes after this one matched */
    @JsonProperty("continue")
    private boolean continueMatching;

    /** Prometheus duration text such as {@code 4h} */
    @JsonProperty("repeat_interval")
    private String repeatInterval;
}
