package org.veridrive.driver.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * reported by one of the pipeline stages.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param column The 0-based column of the issue.
 * @param category An optional category tag supplied by the reporter, may be null.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int column,
        String category
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents a successful run. */
        ERROR,
        /** A warning that does not affect the verdict. */
        WARNING,
        /** An informational message, e.g. a related location. */
        INFO
    }

    @Override
    public String toString() {
        String prefix = category != null ? category + ": " : "";
        return String.format("[%s] %s:%d:%d: %s%s", type, fileName, lineNumber, column, prefix, message);
    }
}
