package org.veridrive.driver.snapshot;

import org.veridrive.driver.api.SourceDescriptor;

import java.util.List;

/**
 * The files of one snapshot version. Each group is verified as its own program.
 *
 * @param version The version number embedded in the file names.
 * @param files   The versioned files, in the order of the original file list.
 */
public record SnapshotGroup(int version, List<SourceDescriptor> files) {
    public SnapshotGroup {
        files = List.copyOf(files);
    }
}
