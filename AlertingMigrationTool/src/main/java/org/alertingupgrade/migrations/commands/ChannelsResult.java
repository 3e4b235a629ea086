package org.alertingupgrade.migrations.commands;

import java.util.ArrayList;
import java.util.List;

import org.alertingupgrade.migrations.cli.LedgerFormat;
import org.alertingupgrade.migrations.ledger.ContactPair;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;

/** Ledger entries of the channels touched by migrate-channel or migrate-channels */
@Builder
public class ChannelsResult implements MigrationItemResult {
    @Getter
    private final List<ContactPair> channels;
    @Getter
    private final String errorMessage;
    private final int exitCode;

    public int getExitCode() {
        return MigrationItemResult.exitCode(exitCode, errorMessage, collectErrors());
    }

    @Override
    public List<String> collectErrors() {
        var errors = new ArrayList<String>();
        if (channels != null) {
            channels.forEach(pair -> errors.addAll(LedgerFormat.errors(pair)));
        }
        return errors;
    }

    @Override
    public String itemsAsCliOutput() {
        if (channels == null) {
            return "";
        }
        var sb = new StringBuilder();
        sb.append("Channels: ").append(channels.size()).append(System.lineSeparator());
        channels.forEach(pair -> sb.append(LedgerFormat.channel(pair, 1)));
        return sb.toString();
    }

    @Override
    public JsonNode itemsAsJson() {
        return channels == null ? null : MAPPER.valueToTree(channels);
    }

    @Override
    public String itemsJsonName() {
        return "channels";
    }
}
