package org.veridrive.driver.verify;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Derives the names of on-disk artifacts. A unit's artifact depends only on the base input file
 * name and the unit name, so independent runs over different units never write the same file.
 */
public final class ArtifactNames {

    /** Program id used when the controller was not given one. */
    public static final String DEFAULT_PROGRAM_ID = "main_program_id";

    private ArtifactNames() {}

    /**
     * Returns where a unit is dumped: the configured dump file, or the base file name with the
     * VC extension inside {@code tempDir}, in both cases suffixed with {@code _<unit>}.
     *
     * @param printVcFile  The configured dump path, or {@code null}.
     * @param baseFileName The last input file name, e.g. {@code "max.vp"}.
     * @param unitName     The unit (module) name.
     * @param vcExtension  The proof engine's file extension, without dot.
     * @param tempDir      The directory used when no dump path is configured.
     * @return the artifact path.
     */
    public static Path unitArtifact(Path printVcFile, String baseFileName, String unitName, String vcExtension, Path tempDir) {
        Path base = printVcFile != null
                ? printVcFile
                : tempDir.resolve(changeExtension(Path.of(baseFileName).getFileName().toString(), vcExtension));
        return withUnitSuffix(base, unitName);
    }

    /**
     * Inserts {@code _<unit>} before the extension, e.g. {@code out/max.vc} becomes {@code out/max_Lib.vc}.
     * Characters that are unsafe in file names are percent-encoded, so distinct unit names always
     * give distinct paths.
     */
    public static Path withUnitSuffix(Path file, String unitName) {
        String fileName = file.getFileName().toString();
        String stem = stem(fileName);
        String extension = fileName.substring(stem.length());
        String suffixed = stem + "_" + escape(unitName) + extension;
        Path parent = file.getParent();
        return parent != null ? parent.resolve(suffixed) : Path.of(suffixed);
    }

    /**
     * Replaces the extension of a path, or appends one when it has none.
     *
     * @param file         The path.
     * @param newExtension The new extension, without dot.
     * @return the new path, in the same directory.
     */
    public static Path changeExtension(Path file, String newExtension) {
        Path parent = file.getParent();
        String renamed = changeExtension(file.getFileName().toString(), newExtension);
        return parent != null ? parent.resolve(renamed) : Path.of(renamed);
    }

    static String changeExtension(String fileName, String newExtension) {
        return stem(fileName) + "." + newExtension;
    }

    /**
     * @return the file name without its last extension; a leading dot does not start an extension.
     */
    public static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Builds the incremental-verification cache key of a unit.
     *
     * @param programId The id passed down by the controller, or {@code null}.
     * @param unitName  The unit name.
     * @return {@code <programId>_<unit>}.
     */
    public static String cacheId(String programId, String unitName) {
        return (programId != null ? programId : DEFAULT_PROGRAM_ID) + "_" + unitName;
    }

    /**
     * Percent-encodes every UTF-8 byte outside {@code [A-Za-z0-9_.-]}. {@code %} itself is encoded,
     * which keeps the mapping injective.
     */
    static String escape(String unitName) {
        StringBuilder sb = new StringBuilder(unitName.length());
        for (byte b : unitName.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xFF);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '_' || c == '.' || c == '-') {
                sb.append(c);
            } else {
                sb.append('%').append(String.format("%02X", b & 0xFF));
            }
        }
        return sb.toString();
    }
}
