package org.alertingupgrade.migrations.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum ExecutionErrorState {
    ALERTING("Alerting"),
    ERROR("Error"),
    OK("OK");

    @JsonValue
    private final String value;

    @JsonCreator
    public static ExecutionErrorState fromValue(String value) {
        for (var state : values()) {
            if (state.value.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown execution error state: " + value);
    }
}
