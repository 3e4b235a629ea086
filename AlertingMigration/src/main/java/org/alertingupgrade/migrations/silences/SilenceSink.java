package org.alertingupgrade.migrations.silences;

import java.util.List;

import org.alertingupgrade.migrations.silences.proto.MeshSilence;

public interface SilenceSink {
    /**
     * Adds the silences to those already stored for the org.
     *
     * @throws java.io.UncheckedIOException when the silences cannot be stored
     */
    void write(long orgId, List<MeshSilence> silences);

    /** Removes every stored silence of the org */
    void delete(long orgId);
}
