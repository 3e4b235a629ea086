package org.alertingupgrade.migrations.notifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** A label matcher, serialized as the triple {@code ["name", "=", "value"]} */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"name", "type", "value"})
public class ObjectMatcher {
    private String name;
    private MatchType type;
    private String value;

    public static ObjectMatcher equal(String name, String value) {
        return new ObjectMatcher(name, MatchType.EQUAL, value);
    }

    public static ObjectMatcher regex(String name, String value) {
        return new ObjectMatcher(name, MatchType.REGEX, value);
    }

    @AllArgsConstructor
    @Getter
    public enum MatchType {
        EQUAL("="),
        NOT_EQUAL("!="),
        REGEX("=~"),
        NOT_REGEX("!~");

        @JsonValue
        private final String operator;

        @JsonCreator
        public static MatchType fromOperator(String operator) {
            for (var type : values()) {
                if (type.operator.equals(operator)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown matcher operator: " + operator);
        }
    }
}
