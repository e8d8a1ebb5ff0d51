package org.veridrive.driver.diagnostics;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * reported during a pipeline run.
 * <p>
 * There is one engine per process. The pipeline never runs concurrently with itself, so the
 * engine is written to from one thread at a time and is not synchronized.
 */
public class DiagnosticsEngine implements IDiagnosticsSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final PrintWriter echo;

    /**
     * Creates an engine that only collects.
     */
    public DiagnosticsEngine() {
        this(null);
    }

    /**
     * Creates an engine that also prints each diagnostic as it arrives.
     *
     * @param echo The printer to write to, or {@code null} to only collect.
     */
    public DiagnosticsEngine(PrintWriter echo) {
        this.echo = echo;
    }

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param fileName   The file in which the error occurred.
     * @param lineNumber The line number of the error.
     */
    public void reportError(String message, String fileName, int lineNumber) {
        add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, lineNumber, 0, null));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param fileName   The file in which the warning occurred.
     * @param lineNumber The line number of the warning.
     */
    public void reportWarning(String message, String fileName, int lineNumber) {
        add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, lineNumber, 0, null));
    }

    @Override
    public void report(SourceToken token, String message, boolean error, String category) {
        Diagnostic.Type type = error ? Diagnostic.Type.ERROR : Diagnostic.Type.INFO;
        add(new Diagnostic(type, message, token.fileName(), token.line(), token.column(), category));
    }

    private void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        if (echo != null) {
            echo.println(diagnostic);
            echo.flush();
        }
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return errorCount() > 0;
    }

    /**
     * @return the number of diagnostics of type {@link Diagnostic.Type#ERROR}.
     */
    public int errorCount() {
        return (int) diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
