package org.alertingupgrade.migrations.commands;

import java.util.List;

import org.alertingupgrade.migrations.cli.Format;

import com.fasterxml.jackson.databind.JsonNode;

/** Result of a command that reports on migrated dashboards and channels */
public interface MigrationItemResult extends Result {
    /** Item level errors recorded in the ledger */
    List<String> collectErrors();

    /** Human readable listing of the items, before the results section */
    String itemsAsCliOutput();

    JsonNode itemsAsJson();

    /** Name of the items member in the json output */
    String itemsJsonName();

    default String asCliOutput() {
        var sb = new StringBuilder();
        sb.append(itemsAsCliOutput());
        sb.append("Results:" + System.lineSeparator());
        var innerErrors = collectErrors();
        var errorMessage = getErrorMessage();
        if ((errorMessage != null && !errorMessage.isBlank()) || !innerErrors.isEmpty()) {
            sb.append(Format.indentToLevel(1) + "Issue(s) detected" + System.lineSeparator());
            sb.append("Issues:" + System.lineSeparator());
            if (errorMessage != null && !errorMessage.isBlank()) {
                sb.append(Format.indentToLevel(1) + errorMessage + System.lineSeparator());
            }
            innerErrors.forEach(err -> sb.append(Format.indentToLevel(1) + err + System.lineSeparator()));
        } else {
            sb.append(Format.indentToLevel(1) + getExitCode() + " issue(s) detected" + System.lineSeparator());
        }
        return sb.toString();
    }

    @Override
    default JsonNode asJsonOutput() {
        var json = MAPPER.createObjectNode();
        var items = itemsAsJson();
        if (items != null) {
            json.set(itemsJsonName(), items);
        }
        var errors = json.putArray("errors");
        collectErrors().forEach(errors::add);
        json.put("errorCount", getExitCode());
        var errorMessage = getErrorMessage();
        if (errorMessage != null && !errorMessage.isBlank()) {
            json.put("errorMessage", errorMessage);
        }
        return json;
    }

    /** Exit code that is never 0 while there are errors */
    static int exitCode(int exitCode, String errorMessage, List<String> errors) {
        var code = Math.max(exitCode, errors.size());
        if (code == 0 && errorMessage != null && !errorMessage.isBlank()) {
            return 1;
        }
        return code;
    }
}
