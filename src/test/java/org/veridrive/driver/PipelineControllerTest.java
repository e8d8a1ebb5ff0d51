package org.veridrive.driver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.veridrive.config.DriverOptions;
import org.veridrive.driver.api.ExitStatus;
import org.veridrive.driver.api.PipelineOutcome;
import org.veridrive.driver.api.SourceDescriptor;
import org.veridrive.driver.codegen.BuildResult;
import org.veridrive.driver.codegen.CodeGenResult;
import org.veridrive.driver.codegen.CompilationTarget;
import org.veridrive.driver.diagnostics.DiagnosticsEngine;
import org.veridrive.driver.snapshot.SnapshotLocator;
import org.veridrive.driver.spi.INativeToolchain;
import org.veridrive.driver.spi.Toolchain;
import org.veridrive.testutils.ScriptedCodeGenerator;
import org.veridrive.testutils.ScriptedFrontEnd;
import org.veridrive.testutils.ScriptedProofEngine;
import org.veridrive.testutils.ScriptedTranslator;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
class PipelineControllerTest {

    @TempDir
    Path tempDir;

    private ScriptedFrontEnd frontEnd;
    private ScriptedTranslator translator;
    private ScriptedProofEngine proofEngine;
    private INativeToolchain nativeToolchain;
    private DiagnosticsEngine reporter;
    private StringWriter output;

    @BeforeEach
    void setUp() {
        frontEnd = new ScriptedFrontEnd();
        translator = new ScriptedTranslator();
        proofEngine = new ScriptedProofEngine();
        nativeToolchain = mock(INativeToolchain.class);
        reporter = new DiagnosticsEngine();
        output = new StringWriter();
    }

    private PipelineController controller(DriverOptions options) {
        return controller(options, new SnapshotLocator(p -> false));
    }

    private PipelineController controller(DriverOptions options, SnapshotLocator locator) {
        Toolchain toolchain = new Toolchain(frontEnd, translator, proofEngine,
                Map.of(CompilationTarget.JAVA, new ScriptedCodeGenerator(CompilationTarget.JAVA)), nativeToolchain);
        return new PipelineController(toolchain, options, reporter, new PrintWriter(output), locator, tempDir);
    }

    private static DriverOptions.Builder noCompile() {
        return new DriverOptions.Builder().compile(false);
    }

    private SourceDescriptor file(String name, String... lines) {
        Path path = tempDir.resolve(name);
        frontEnd.script(path, lines);
        return SourceDescriptor.program(path);
    }

    @Test
    @DisplayName("A file whose units all verify exits with VERIFIED")
    void run_allUnitsVerified_shouldBeVerified() {
        // Given
        SourceDescriptor max = file("max.vp", "module A verified=2", "module B verified=1");

        // When
        PipelineResult result = controller(noCompile().build()).run(List.of(max), List.of());

        // Then
        assertThat(result.exitStatus()).isEqualTo(ExitStatus.VERIFIED);
        InvocationResult invocation = result.invocations().get(0);
        assertThat(invocation.programName()).isEqualTo(max.toString());
        assertThat(invocation.outcome()).isEqualTo(PipelineOutcome.VERIFICATION_COMPLETED);
        assertThat(invocation.statisticsByUnit()).containsOnlyKeys("A", "B");
        assertThat(invocation.totalStatistics().verifiedCount()).isEqualTo(3);
        assertThat(invocation.codeGen()).isEqualTo(CodeGenResult.Tag.SKIPPED);
        assertThat(output.toString()).contains("veridrive verifier finished with 3 verified, 0 errors");
    }

    @Test
    void run_unitWithErrors_shouldBeNotVerified() {
        SourceDescriptor max = file("max.vp", "module A verified=2", "module B verified=1 errors=1");

        PipelineResult result = controller(new DriverOptions.Builder().build()).run(List.of(max), List.of());

        assertThat(result.exitStatus()).isEqualTo(ExitStatus.NOT_VERIFIED);
        assertThat(result.invocations().get(0).codeGen()).isEqualTo(CodeGenResult.Tag.SKIPPED);
        assertThat(reporter.getDiagnostics()).extracting(d -> d.message()).contains("assertion might not hold");
    }

    @Test
    void run_parseError_shouldBeCompileErrorWithoutVerification() {
        SourceDescriptor max = file("max.vp", "error unresolved identifier 'x'");

        PipelineResult result = controller(noCompile().build()).run(List.of(max), List.of());

        assertThat(result.exitStatus()).isEqualTo(ExitStatus.COMPILE_ERROR);
        assertThat(result.invocations().get(0).outcome()).isNull();
        assertThat(translator.translateCalls()).isZero();
        assertThat(output.toString()).contains("unresolved identifier 'x'");
    }

    @Test
    @DisplayName("A malformed unit re-runs the proof engine for diagnostics and fails verification")
    void run_resolutionError_shouldRerunAndFail() {
        SourceDescriptor max = file("max.vp", "module Broken resolution-error", "module Fine verified=1");

        PipelineResult result = controller(noCompile().build()).run(List.of(max), List.of());

        assertThat(result.exitStatus()).isEqualTo(ExitStatus.NOT_VERIFIED);
        assertThat(result.invocations().get(0).outcome()).isEqualTo(PipelineOutcome.RESOLUTION_ERROR);
        assertThat(proofEngine.calls()).contains("print:max_Broken.vc", "parse:max_Broken.vc", "verify:Fine");
        assertThat(output.toString()).contains("re-running the proof engine");
    }

    @Test
    void run_verificationDisabled_shouldSucceedWithoutTranslating() {
        SourceDescriptor max = file("max.vp", "module A verified=0 errors=5");

        PipelineResult result = controller(noCompile().verify(false).build()).run(List.of(max), List.of());

        assertThat(result.exitStatus()).isEqualTo(ExitStatus.VERIFIED);
        assertThat(translator.translateCalls()).isZero();
        assertThat(proofEngine.calls()).isEmpty();
    }

    @Test
    void run_severalFilesTogether_shouldBeOneProgram() {
        SourceDescriptor a = file("a.vp", "module A verified=1");
        SourceDescriptor b = file("b.vp", "module B verified=1");

        PipelineResult result = controller(noCompile().build()).run(List.of(a, b), List.of());

        assertThat(result.invocations()).hasSize(1);
        assertThat(frontEnd.parsedProgramNames()).containsExactly(PipelineController.MULTI_FILE_PROGRAM_NAME);
        assertThat(result.invocations().get(0).statisticsByUnit()).containsOnlyKeys("A", "B");
    }

    @Test
    @DisplayName("Separate verification runs each file on its own and keeps the last distinct failure")
    void run_separately_shouldMergeStatuses() {
        SourceDescriptor good = file("good.vp", "module A verified=1");
        SourceDescriptor bad = file("bad.vp", "module B errors=1");
        SourceDescriptor broken = file("broken.vp", "error syntax error");

        PipelineResult result = controller(noCompile().verifySeparately(true).build())
                .run(List.of(good, bad, broken), List.of());

        assertThat(result.invocations()).extracting(InvocationResult::status)
                .containsExactly(ExitStatus.VERIFIED, ExitStatus.NOT_VERIFIED, ExitStatus.COMPILE_ERROR);
        assertThat(result.exitStatus()).isEqualTo(ExitStatus.COMPILE_ERROR);
        assertThat(frontEnd.parsedProgramNames()).containsExactly(good.toString(), bad.toString(), broken.toString());
        assertThat(output.toString()).contains("-------------------- " + good + " --------------------");
    }

    @Test
    void run_separatelyWithCaching_shouldUseFileAsProgramId() {
        SourceDescriptor a = file("a.vp", "module A verified=1");
        SourceDescriptor b = file("b.vp", "module B verified=1");

        controller(noCompile().verifySeparately(true).verifySnapshots(2).build()).run(List.of(a, b), List.of());

        assertThat(proofEngine.programIds()).containsExactly(a.path() + "_A", b.path() + "_B");
    }

    @Test
    void run_snapshots_shouldProcessEachVersion() {
        Path prog = tempDir.resolve("prog.vp");
        Path v0 = SnapshotLocator.versioned(prog, 0);
        Path v1 = SnapshotLocator.versioned(prog, 1);
        frontEnd.script(v0, "module A errors=1");
        frontEnd.script(v1, "module A verified=1");

        PipelineResult result = controller(noCompile().verifySnapshots(0).build(), new SnapshotLocator(Set.of(v0, v1)::contains))
                .run(List.of(SourceDescriptor.program(prog)), List.of());

        assertThat(frontEnd.parsedProgramNames()).containsExactly(v0.toString(), v1.toString());
        assertThat(result.exitStatus()).isEqualTo(ExitStatus.NOT_VERIFIED);
    }

    @Test
    void run_snapshotsWithoutVersions_shouldVerifyFilesAsGiven() {
        SourceDescriptor max = file("max.vp", "module A verified=1");

        PipelineResult result = controller(noCompile().verifySnapshots(0).build()).run(List.of(max), List.of());

        assertThat(result.exitStatus()).isEqualTo(ExitStatus.VERIFIED);
        assertThat(frontEnd.parsedProgramNames()).containsExactly(max.toString());
    }

    @Test
    void run_printStats_shouldAskTheFrontEnd() {
        SourceDescriptor max = file("max.vp", "module A verified=1");

        controller(noCompile().printStats(true).printFunctionCallGraph(true).build()).run(List.of(max), List.of());

        assertThat(output.toString()).contains("Statistics of " + max + ": 1 module(s)", "Call graph of " + max);
    }

    @Test
    void run_verifiedAndBuilt_shouldBeVerified() {
        SourceDescriptor max = file("max.vp", "module A verified=1", "main Hello");
        when(nativeToolchain.build(any())).thenReturn(new BuildResult(true, tempDir.resolve("max.jar"), tempDir, List.of(), List.of()));

        PipelineResult result = controller(new DriverOptions.Builder().build()).run(List.of(max), List.of());

        assertThat(result.exitStatus()).isEqualTo(ExitStatus.VERIFIED);
        assertThat(result.invocations().get(0).codeGen()).isEqualTo(CodeGenResult.Tag.BUILT);
    }

    @Test
    @DisplayName("A failed build after successful verification is a compile error")
    void run_verifiedButBuildFails_shouldBeCompileError() {
        SourceDescriptor max = file("max.vp", "module A verified=1", "main Hello");
        when(nativeToolchain.build(any())).thenReturn(BuildResult.failure(List.of("max.java:1: error: boom")));

        PipelineResult result = controller(new DriverOptions.Builder().build()).run(List.of(max), List.of());

        assertThat(result.exitStatus()).isEqualTo(ExitStatus.COMPILE_ERROR);
        assertThat(result.invocations().get(0).codeGen()).isEqualTo(CodeGenResult.Tag.BUILD_FAILED);
    }
}
