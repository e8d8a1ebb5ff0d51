package org.veridrive.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.veridrive.cli.CommandLineInterface;
import org.veridrive.config.DriverOptions;
import org.veridrive.driver.JsonReportSink;
import org.veridrive.driver.PipelineController;
import org.veridrive.driver.PipelineResult;
import org.veridrive.driver.PipelineWorker;
import org.veridrive.driver.api.ExitStatus;
import org.veridrive.driver.api.ToolchainException;
import org.veridrive.driver.codegen.CompilationTarget;
import org.veridrive.driver.diagnostics.DiagnosticsEngine;
import org.veridrive.driver.input.InputClassifier;
import org.veridrive.driver.input.InvalidInputException;
import org.veridrive.driver.spi.Toolchain;
import org.veridrive.driver.spi.ToolchainLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "verify",
    description = "Verifies programs and compiles them once they verify."
)
public class VerifyCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(VerifyCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(arity = "0..*", paramLabel = "FILE",
            description = "Program files, plus Java sources (.java) and libraries (.jar) for the build.")
    private List<String> files = new ArrayList<>();

    @Option(names = "--separate", description = "Verify each program file on its own.")
    private Boolean verifySeparately;

    @Option(names = "--snapshots", paramLabel = "N",
            description = "Look for snapshot versions (name.vN.ext); values above 1 also cache results per unit.")
    private Integer verifySnapshots;

    @Option(names = "--resolve", negatable = true, description = "Resolve the program (default: true).")
    private Boolean resolve;

    @Option(names = "--typecheck", negatable = true, description = "Type check the program (default: true).")
    private Boolean typecheck;

    @Option(names = "--verify", negatable = true, description = "Run the proof engine (default: true).")
    private Boolean verify;

    @Option(names = "--print-vc", paramLabel = "FILE", description = "Dump the verification units to FILE.")
    private Path printVcFile;

    @Option(names = "--pretty-print", negatable = true, description = "Pretty-print dumped units.")
    private Boolean prettyPrint;

    @Option(names = "--module-output", description = "Print elapsed time and statistics per unit.")
    private Boolean separateModuleOutput;

    @Option(names = "--compile", negatable = true, description = "Compile the program once it verifies (default: true).")
    private Boolean compile;

    @Option(names = "--force-compile", description = "Compile even if verification fails.")
    private Boolean forceCompile;

    @Option(names = "--spill", paramLabel = "LEVEL", description = "Write generated source: 0-3.")
    private Integer spillTargetCode;

    @Option(names = "--proc", paramLabel = "NAME", description = "Only verify this procedure; disables compilation.")
    private List<String> procsToCheck;

    @Option(names = "--target", paramLabel = "TARGET", description = "Code generation target: java or javascript.")
    private String compileTarget;

    @Option(names = "--out", paramLabel = "FILE", description = "Base path for generated files.")
    private Path printCompiledFile;

    @Option(names = "--run", description = "Build in memory and run the program's entry point.")
    private Boolean runAfterCompile;

    @Option(names = "--optimize", description = "Build against the immutable-collections library.")
    private Boolean optimize;

    @Option(names = "--use-runtime-lib", description = "Add the runtime library to the build.")
    private Boolean useRuntimeLib;

    @Option(names = "--runtime-lib-dir", paramLabel = "DIR", description = "Directory of the runtime libraries.")
    private Path runtimeLibraryDir;

    @Option(names = "--count-verification-errors", negatable = true,
            description = "Exit with a non-zero code when verification or compilation fails (default: true).")
    private Boolean countVerificationErrors;

    @Option(names = "--stats", description = "Print program statistics.")
    private Boolean printStats;

    @Option(names = "--call-graph", description = "Print the function call graph.")
    private Boolean printFunctionCallGraph;

    @Option(names = "--stack-size", paramLabel = "SIZE", description = "Stack size of the pipeline thread, e.g. 512M.")
    private String stackSize;

    @Option(names = "--report", paramLabel = "FILE", description = "Write a JSON report to FILE.")
    private Path reportFile;

    @Override
    public Integer call() throws Exception {
        final PrintWriter out = spec.commandLine().getOut();

        final Config config;
        final DriverOptions options;
        final Toolchain toolchain;
        final InputClassifier.ClassifiedInputs inputs;
        try {
            config = parent.getConfig();
            options = buildOptions(config);
            toolchain = ToolchainLoader.load(config);
            inputs = new InputClassifier(toolchain.frontEnd().sourceExtensions()).classify(files);
        } catch (FileNotFoundException | ConfigException | ToolchainException | InvalidInputException e) {
            return preprocessingError(out, e.getMessage());
        } catch (IllegalArgumentException e) {
            return preprocessingError(out, "Invalid option: " + e.getMessage());
        }

        final JsonReportSink report;
        try {
            report = options.reportFile() != null ? JsonReportSink.open(options.reportFile()) : null;
        } catch (IOException e) {
            return preprocessingError(out, "Could not open report file " + options.reportFile() + ": " + e.getMessage());
        }

        try (report) {
            final DiagnosticsEngine reporter = new DiagnosticsEngine(out);
            final PipelineController controller = new PipelineController(toolchain, options, reporter, out);
            final PipelineResult result = new PipelineWorker(options.stackSize())
                    .run(() -> controller.run(inputs.programs(), inputs.otherFiles()));

            final int exitCode = result.exitStatus().toExitCode(options.countVerificationErrors());
            LOGGER.debug("Pipeline finished with {} (exit code {})", result.exitStatus(), exitCode);
            if (report != null) {
                try {
                    report.write(result, exitCode);
                } catch (IOException e) {
                    LOGGER.error("Could not write report file {}", options.reportFile(), e);
                }
            }
            out.flush();
            return exitCode;
        }
    }

    DriverOptions buildOptions(Config config) {
        final DriverOptions.Builder b = DriverOptions.builder(config);
        if (verifySeparately != null) b.verifySeparately(verifySeparately);
        if (verifySnapshots != null) b.verifySnapshots(verifySnapshots);
        if (resolve != null) b.resolve(resolve);
        if (typecheck != null) b.typecheck(typecheck);
        if (verify != null) b.verify(verify);
        if (printVcFile != null) b.printVcFile(printVcFile);
        if (prettyPrint != null) b.prettyPrint(prettyPrint);
        if (separateModuleOutput != null) b.separateModuleOutput(separateModuleOutput);
        if (compile != null) b.compile(compile);
        if (forceCompile != null) b.forceCompile(forceCompile);
        if (spillTargetCode != null) b.spillTargetCode(spillTargetCode);
        if (procsToCheck != null) b.procsToCheck(procsToCheck);
        if (compileTarget != null) b.compileTarget(CompilationTarget.fromName(compileTarget));
        if (printCompiledFile != null) b.printCompiledFile(printCompiledFile);
        if (runAfterCompile != null) b.runAfterCompile(runAfterCompile);
        if (optimize != null) b.optimize(optimize);
        if (useRuntimeLib != null) b.useRuntimeLib(useRuntimeLib);
        if (runtimeLibraryDir != null) b.runtimeLibraryDir(runtimeLibraryDir);
        if (countVerificationErrors != null) b.countVerificationErrors(countVerificationErrors);
        if (printStats != null) b.printStats(printStats);
        if (printFunctionCallGraph != null) b.printFunctionCallGraph(printFunctionCallGraph);
        if (stackSize != null) b.stackSize(ConfigFactory.parseString("size = " + stackSize).getBytes("size"));
        if (reportFile != null) b.reportFile(reportFile);
        return b.build();
    }

    private static int preprocessingError(PrintWriter out, String message) {
        LOGGER.debug("Preprocessing error: {}", message);
        out.println("*** Error: " + message);
        out.flush();
        return ExitStatus.PREPROCESSING_ERROR.toExitCode(true);
    }
}
