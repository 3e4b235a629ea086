package org.alertingupgrade.migrations;

import org.alertingupgrade.migrations.service.MigrationService;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** A service plus whatever has to be closed once the command finished with it */
@AllArgsConstructor
public class MigrationServiceHandle implements AutoCloseable {
    @Getter
    private final MigrationService service;
    private final AutoCloseable resources;

    @Override
    public void close() throws Exception {
        if (resources != null) {
            resources.close();
        }
    }
}
