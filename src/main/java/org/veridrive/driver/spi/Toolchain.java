package org.veridrive.driver.spi;

import org.veridrive.driver.api.ToolchainException;
import org.veridrive.driver.codegen.CompilationTarget;
import org.veridrive.driver.codegen.javac.JavacToolchain;

import java.util.Map;
import java.util.Objects;

/**
 * The external collaborators of one driver run.
 *
 * @param frontEnd        Parses and checks source programs.
 * @param translator      Lowers programs to verification units.
 * @param proofEngine     Verifies units.
 * @param generators      One generator per supported backend.
 * @param nativeToolchain Builds generated source; defaults to {@link JavacToolchain} when null.
 */
public record Toolchain(
        IFrontEnd frontEnd,
        ITranslator translator,
        IProofEngine proofEngine,
        Map<CompilationTarget, ICodeGenerator> generators,
        INativeToolchain nativeToolchain
) {
    public Toolchain {
        Objects.requireNonNull(frontEnd, "frontEnd");
        Objects.requireNonNull(translator, "translator");
        Objects.requireNonNull(proofEngine, "proofEngine");
        generators = generators != null ? Map.copyOf(generators) : Map.of();
        nativeToolchain = nativeToolchain != null ? nativeToolchain : new JavacToolchain();
    }

    /**
     * Returns the generator for a backend.
     *
     * @throws ToolchainException if this toolchain has no generator for the target.
     */
    public ICodeGenerator generator(CompilationTarget target) throws ToolchainException {
        ICodeGenerator generator = generators.get(target);
        if (generator == null) {
            throw new ToolchainException("No code generator registered for target " + target.name().toLowerCase());
        }
        return generator;
    }
}
