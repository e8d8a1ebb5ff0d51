package org.veridrive.driver.snapshot;

import org.veridrive.driver.api.SourceDescriptor;
import org.veridrive.driver.verify.ArtifactNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Discovers snapshot versions of a set of program files.
 * <p>
 * Version {@code n} of {@code dir/prog.vp} is {@code dir/prog.v<n>.vp}. Versions are looked up from 0
 * upwards; a version is included if at least one of the files has it, and the search stops at the
 * first version none of them has.
 */
public class SnapshotLocator {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotLocator.class);

    private final Predicate<Path> exists;

    public SnapshotLocator() {
        this(Files::isRegularFile);
    }

    /**
     * @param exists decides whether a versioned file is present.
     */
    public SnapshotLocator(Predicate<Path> exists) {
        this.exists = exists;
    }

    public List<SnapshotGroup> locate(List<SourceDescriptor> files) {
        List<SnapshotGroup> groups = new ArrayList<>();
        for (int version = 0; ; version++) {
            List<SourceDescriptor> snapshot = new ArrayList<>();
            for (SourceDescriptor file : files) {
                Path candidate = versioned(file.path(), version);
                if (exists.test(candidate)) {
                    snapshot.add(new SourceDescriptor(candidate, file.kind()));
                }
            }
            if (snapshot.isEmpty()) {
                break;
            }
            groups.add(new SnapshotGroup(version, snapshot));
        }
        LOG.debug("Found {} snapshot version(s) for {}", groups.size(), files);
        return groups;
    }

    /**
     * Returns the path of a given version of a file, e.g. {@code prog.v2.vp} for version 2 of {@code prog.vp}.
     */
    public static Path versioned(Path file, int version) {
        String fileName = file.getFileName().toString();
        String stem = ArtifactNames.stem(fileName);
        String versionedName = stem + ".v" + version + fileName.substring(stem.length());
        Path parent = file.getParent();
        return parent != null ? parent.resolve(versionedName) : Path.of(versionedName);
    }
}
