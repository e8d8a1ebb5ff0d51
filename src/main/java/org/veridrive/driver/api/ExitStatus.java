package org.veridrive.driver.api;

/**
 * The final classification of one pipeline invocation. Exactly one value is produced per run.
 * <p>
 * The process exit code of a status is its ordinal, so the declaration order is part of the
 * external interface and must not change.
 */
public enum ExitStatus {
    /** Every verification unit verified and any requested build succeeded. */
    VERIFIED,
    /** Malformed invocation, unsupported or unreadable input, or a report sink that cannot be opened. */
    PREPROCESSING_ERROR,
    /** A source-level parse/resolve/typecheck failure, or a failed native build after verification. */
    COMPILE_ERROR,
    /** Verification ran but reported errors, inconclusive results, time outs or out-of-memory conditions. */
    NOT_VERIFIED,
    /** Generated output could not be written to disk. */
    COMPILE_OUTPUT_ERROR;

    /**
     * Returns the process exit code for this status.
     *
     * @param countVerificationErrors when {@code false}, every status other than
     *                                {@link #PREPROCESSING_ERROR} is reported as {@code 0}.
     * @return the exit code.
     */
    public int toExitCode(boolean countVerificationErrors) {
        if (!countVerificationErrors && this != PREPROCESSING_ERROR) {
            return 0;
        }
        return ordinal();
    }

    /**
     * Folds the status of one more file or snapshot group into a running status.
     * A non-{@link #VERIFIED} status that differs from the running one replaces it, so the
     * result is the last distinct failure seen. A {@link #VERIFIED} result never overwrites a failure.
     *
     * @param running the status merged so far.
     * @param next    the status of the next invocation.
     * @return the merged status.
     */
    public static ExitStatus merge(ExitStatus running, ExitStatus next) {
        if (running != next && next != VERIFIED) {
            return next;
        }
        return running;
    }
}
