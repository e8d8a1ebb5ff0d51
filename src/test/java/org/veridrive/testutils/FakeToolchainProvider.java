package org.veridrive.testutils;

import com.typesafe.config.Config;
import org.veridrive.driver.codegen.CompilationTarget;
import org.veridrive.driver.spi.IToolchainProvider;
import org.veridrive.driver.spi.Toolchain;

import java.util.Map;

/**
 * Registered through {@code META-INF/services} so command-line tests go through the real
 * provider lookup. Reads programs from disk with {@link ScriptedFrontEnd} and builds with the
 * default native toolchain.
 */
public class FakeToolchainProvider implements IToolchainProvider {

    public static final String NAME = "scripted";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Toolchain create(Config config) {
        return new Toolchain(
                new ScriptedFrontEnd(),
                new ScriptedTranslator(),
                new ScriptedProofEngine(),
                Map.of(CompilationTarget.JAVA, new ScriptedCodeGenerator(CompilationTarget.JAVA),
                        CompilationTarget.JAVASCRIPT, new ScriptedCodeGenerator(CompilationTarget.JAVASCRIPT)),
                null);
    }
}
