package org.alertingupgrade.migrations.commands;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/** Outcome of a command that produces nothing but success or an error */
@AllArgsConstructor
@ToString
public class SimpleResult implements Result {
    @Getter
    private final int exitCode;
    @Getter
    private final String errorMessage;

    public static SimpleResult success() {
        return new SimpleResult(0, null);
    }

    public static SimpleResult error(String message) {
        return new SimpleResult(1, message);
    }

    public static SimpleResult error(int exitCode, String message) {
        return new SimpleResult(exitCode, message);
    }

    @Override
    public String asCliOutput() {
        if (exitCode == 0) {
            return "Success";
        } else {
            return "Error (code " + exitCode + "): " + errorMessage;
        }
    }

    @Override
    public JsonNode asJsonOutput() {
        var json = MAPPER.createObjectNode();
        json.put("exitCode", exitCode);
        if (errorMessage != null) {
            json.put("errorMessage", errorMessage);
        }
        return json;
    }
}
