package org.veridrive.driver.api;

import java.util.Objects;

/**
 * One named verification-condition unit, produced by lowering one verifiable module.
 * Consumed exactly once by the verification runner.
 *
 * @param name    The module name; used in artifact names and per-module reporting.
 * @param program The lowered program.
 */
public record VcUnit(String name, IVcProgram program) {
    public VcUnit {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(program, "program");
    }
}
