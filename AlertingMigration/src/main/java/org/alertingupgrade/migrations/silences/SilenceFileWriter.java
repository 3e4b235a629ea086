package org.alertingupgrade.migrations.silences;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.alertingupgrade.migrations.silences.proto.MeshSilence;

import lombok.extern.slf4j.Slf4j;

/** Length-delimited {@link MeshSilence} snapshots at {@code <dataPath>/alerting/<orgId>/silences} */
@Slf4j
public class SilenceFileWriter implements SilenceSink {
    static final String ALERTING_DIR = "alerting";
    static final String SILENCES_FILE = "silences";

    private final Path dataPath;

    public SilenceFileWriter(Path dataPath) {
        this.dataPath = dataPath;
    }

    public Path silencesFile(long orgId) {
        return dataPath.resolve(ALERTING_DIR).resolve(Long.toString(orgId)).resolve(SILENCES_FILE);
    }

    @Override
    public void write(long orgId, List<MeshSilence> silences) {
        if (silences.isEmpty()) {
            return;
        }
        var file = silencesFile(orgId);
        try {
            var all = new ArrayList<>(read(file));
            all.addAll(silences);
            Files.createDirectories(file.getParent());
            var tmp = Files.createTempFile(file.getParent(), SILENCES_FILE, ".tmp");
            try (var out = Files.newOutputStream(tmp)) {
                for (var silence : all) {
                    silence.writeDelimitedTo(out);
                }
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Wrote {} silences to {}", all.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write silences file " + file, e);
        }
    }

    /** Entries currently stored for the org, empty when there is no file */
    public List<MeshSilence> read(long orgId) {
        try {
            return read(silencesFile(orgId));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read silences file " + silencesFile(orgId), e);
        }
    }

    @Override
    public void delete(long orgId) {
        var file = silencesFile(orgId);
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Deleted silences file {}", file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to delete silences file " + file, e);
        }
    }

    private static List<MeshSilence> read(Path file) throws IOException {
        var silences = new ArrayList<MeshSilence>();
        if (!Files.exists(file)) {
            return silences;
        }
        try (var in = Files.newInputStream(file)) {
            MeshSilence silence;
            while ((silence = MeshSilence.parseDelimitedFrom(in)) != null) {
                silences.add(silence);
            }
        }
        return silences;
    }
}
