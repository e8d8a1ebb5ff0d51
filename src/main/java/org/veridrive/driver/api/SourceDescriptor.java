package org.veridrive.driver.api;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * A resolved input reference. Created during command-line ingestion and immutable thereafter.
 *
 * @param path The path as given on the command line.
 * @param kind What the file is used for.
 */
public record SourceDescriptor(Path path, SourceKind kind) {

    public SourceDescriptor {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
    }

    /**
     * Creates a descriptor for a source-program file.
     */
    public static SourceDescriptor program(Path path) {
        return new SourceDescriptor(path, SourceKind.PROGRAM);
    }

    /**
     * @return the last path element, e.g. {@code "max.vp"}.
     */
    public String fileName() {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }

    /**
     * @return the lower-cased extension including the dot, or an empty string when there is none.
     */
    public String extension() {
        return extensionOf(fileName());
    }

    /**
     * Returns the lower-cased extension of a file name, including the leading dot.
     *
     * @param fileName the file name.
     * @return the extension, or an empty string when there is none.
     */
    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
