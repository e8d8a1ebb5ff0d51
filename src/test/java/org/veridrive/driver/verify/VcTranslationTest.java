package org.veridrive.driver.verify;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.veridrive.config.DriverOptions;
import org.veridrive.driver.api.VcUnit;
import org.veridrive.testutils.ModuleScript;
import org.veridrive.testutils.ScriptedProgram;
import org.veridrive.testutils.ScriptedProofEngine;
import org.veridrive.testutils.ScriptedTranslator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class VcTranslationTest {

    @TempDir
    Path tempDir;

    @Test
    void translate_withoutDumpPath_shouldOnlyLower() {
        ScriptedProofEngine engine = new ScriptedProofEngine();
        ScriptedProgram program = ScriptedProgram.of("max.vp", ModuleScript.verified("A", 1), ModuleScript.verified("B", 1));

        List<VcUnit> units = new VcTranslation(new ScriptedTranslator(), engine)
                .translate(program, new DriverOptions.Builder().build());

        assertThat(units).extracting(VcUnit::name).containsExactly("A", "B");
        assertThat(engine.calls()).isEmpty();
    }

    @Test
    void translate_severalModules_shouldDumpOneFilePerUnit() {
        Path dump = tempDir.resolve("prog.vc");
        ScriptedProgram program = ScriptedProgram.of("max.vp", ModuleScript.verified("A", 1), ModuleScript.verified("B", 1));

        new VcTranslation(new ScriptedTranslator(), new ScriptedProofEngine())
                .translate(program, new DriverOptions.Builder().printVcFile(dump).build());

        assertThat(tempDir.resolve("prog_A.vc")).exists();
        assertThat(tempDir.resolve("prog_B.vc")).exists();
        assertThat(dump).doesNotExist();
    }

    @Test
    void translate_singleModule_shouldDumpWithoutSuffix() throws Exception {
        Path dump = tempDir.resolve("prog.vc");
        ScriptedProgram program = ScriptedProgram.of("max.vp", ModuleScript.verified("Only", 1));

        new VcTranslation(new ScriptedTranslator(), new ScriptedProofEngine())
                .translate(program, new DriverOptions.Builder().printVcFile(dump).build());

        assertThat(Files.readString(dump)).contains("unit Only");
    }

    @Test
    void translate_unwritableDump_shouldWarnAndContinue() {
        Path dump = tempDir.resolve("missing-dir").resolve("prog.vc");
        ScriptedProgram program = ScriptedProgram.of("max.vp", ModuleScript.verified("Only", 1));

        List<VcUnit> units = new VcTranslation(new ScriptedTranslator(), new ScriptedProofEngine())
                .translate(program, new DriverOptions.Builder().printVcFile(dump).build());

        assertThat(units).hasSize(1);
        assertThat(program.diagnostics().getDiagnostics()).hasSize(1);
        assertThat(program.diagnostics().hasErrors()).isFalse();
    }
}
