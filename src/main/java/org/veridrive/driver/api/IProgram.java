package org.veridrive.driver.api;

import org.veridrive.driver.diagnostics.DiagnosticsEngine;

/**
 * The already-checked, in-memory representation of one or more source files, as produced by the
 * front end. The driver treats it as opaque and only forwards it to the translator and the code
 * generators.
 */
public interface IProgram {

    /**
     * @return the program name used in diagnostics ({@code "the program"} for multi-file programs).
     */
    String name();

    /**
     * Returns the diagnostic sink attached to this program. Code generators report into it, and the
     * driver compares its error count before and after generation to detect partial output.
     *
     * @return the attached diagnostics engine.
     */
    DiagnosticsEngine diagnostics();
}
