package org.veridrive.driver.api;

/**
 * The stage a verification unit reached in the proof engine, and its verdict.
 * The stages are linear: resolve/typecheck, then the optimization passes, then solving.
 */
public enum PipelineOutcome {
    /** Nothing to verify. */
    DONE,
    /** The lowered unit failed name resolution. This is a translation defect, not a source error. */
    RESOLUTION_ERROR,
    /** The lowered unit failed type checking. This is a translation defect, not a source error. */
    TYPE_CHECKING_ERROR,
    /** Intermediate stage; the unit advances to the optimization passes and solving. */
    RESOLVED_AND_TYPE_CHECKED,
    /** Solving ran to completion; statistics are meaningful. */
    VERIFICATION_COMPLETED;

    /**
     * @return {@code true} for the two outcomes after which code generation may still run.
     */
    public boolean allowsCodeGeneration() {
        return this == DONE || this == VERIFICATION_COMPLETED;
    }
}
