package org.veridrive.driver.diagnostics;

import java.util.Objects;

/**
 * Sits between the proof engine and the driver's diagnostic sink. The engine counts columns from 1
 * while source programs count from 0, so every reported column is shifted left by one. A token with
 * a nested origin is reported at its outer position, followed by one {@code "Related location"}
 * message per level of the origin chain.
 */
public final class DiagnosticsAdapter implements IDiagnosticsSink {

    static final String RELATED_LOCATION = "Related location";

    private final IDiagnosticsSink delegate;

    public DiagnosticsAdapter(IDiagnosticsSink delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void report(SourceToken token, String message, boolean error, String category) {
        delegate.report(realign(token), message, error, category);

        // walk the origin chain iteratively, deep instantiation chains are common
        SourceToken origin = token.inner();
        while (origin != null) {
            delegate.report(realign(origin), RELATED_LOCATION, false, null);
            origin = origin.inner();
        }
    }

    private static SourceToken realign(SourceToken token) {
        return new SourceToken(token.fileName(), token.line(), Math.max(0, token.column() - 1), null);
    }
}
