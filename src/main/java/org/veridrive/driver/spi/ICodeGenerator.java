package org.veridrive.driver.spi;

import org.veridrive.driver.api.IProgram;
import org.veridrive.driver.codegen.CompilationTarget;

import java.util.Optional;

/**
 * Emits target-language source for a checked program. Problems that prevent complete output are
 * reported to the program's diagnostic sink; generation still returns best-effort text.
 */
public interface ICodeGenerator {

    /**
     * @return the backend this generator implements.
     */
    CompilationTarget target();

    /**
     * @return the fully qualified name of the class holding the program's entry point, if it has one.
     */
    Optional<String> findEntryPoint(IProgram program);

    /**
     * @return the generated source text.
     */
    String generate(IProgram program);
}
