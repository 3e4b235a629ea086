package org.alertingupgrade.migrations.notifier;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.JsonNode;

/** Keeps members this model does not know about so a read-modify-write does not drop them */
public abstract class JsonWithExtras {
    private final Map<String, JsonNode> extras = new LinkedHashMap<>();

    @JsonAnySetter
    public void setExtra(String name, JsonNode value) {
        extras.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getExtras() {
        return extras;
    }
}
