package org.alertingupgrade.migrations.commands;

import org.alertingupgrade.migrations.common.ObjectMapperFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Interface for classes that can output their state as JSON.
 */
public interface JsonOutput {
    ObjectMapper MAPPER = ObjectMapperFactory.createDefaultMapper();

    JsonNode asJsonOutput();
}
