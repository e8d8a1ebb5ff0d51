package org.veridrive.driver.diagnostics;

/**
 * Receives positional diagnostics from the proof engine and the other external collaborators.
 */
public interface IDiagnosticsSink {

    /**
     * Reports one message at a source position.
     *
     * @param token    The position. If it carries a nested origin, implementations may expand it
     *                 into additional related-location messages.
     * @param message  The message text.
     * @param error    {@code true} for errors, {@code false} for secondary information.
     * @param category An optional category tag, may be null.
     */
    void report(SourceToken token, String message, boolean error, String category);
}
