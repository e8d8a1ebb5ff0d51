package org.veridrive.driver;

import org.veridrive.config.DriverOptions;
import org.veridrive.driver.api.ExitStatus;
import org.veridrive.driver.api.IProgram;
import org.veridrive.driver.api.ParseResult;
import org.veridrive.driver.api.SourceDescriptor;
import org.veridrive.driver.api.VcUnit;
import org.veridrive.driver.codegen.CodeGenDispatcher;
import org.veridrive.driver.codegen.CodeGenResult;
import org.veridrive.driver.diagnostics.DiagnosticsAdapter;
import org.veridrive.driver.diagnostics.DiagnosticsEngine;
import org.veridrive.driver.snapshot.SnapshotGroup;
import org.veridrive.driver.snapshot.SnapshotLocator;
import org.veridrive.driver.spi.Toolchain;
import org.veridrive.driver.verify.AggregateResult;
import org.veridrive.driver.verify.ResultAggregator;
import org.veridrive.driver.verify.VcTranslation;
import org.veridrive.driver.verify.VerificationRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The top-level entry point of a driver run.
 * <p>
 * In separate-verification mode every program file is processed on its own; otherwise, when
 * snapshot lookup is enabled, every snapshot version is processed on its own. The statuses of such
 * sub-runs are merged with {@link ExitStatus#merge}. The base case parses and checks the files as
 * one program, translates it, verifies every unit and hands the verdict to code generation.
 * <p>
 * The controller holds no state of its own between invocations; all results are returned.
 */
public class PipelineController {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineController.class);

    static final String MULTI_FILE_PROGRAM_NAME = "the program";

    private final Toolchain toolchain;
    private final DriverOptions options;
    private final DiagnosticsEngine reporter;
    private final PrintWriter out;
    private final SnapshotLocator snapshotLocator;
    private final Path tempDir;

    public PipelineController(Toolchain toolchain, DriverOptions options, DiagnosticsEngine reporter, PrintWriter out) {
        this(toolchain, options, reporter, out, new SnapshotLocator(), Path.of(System.getProperty("java.io.tmpdir")));
    }

    /**
     * @param toolchain       The external collaborators.
     * @param options         The run configuration.
     * @param reporter        The process-wide diagnostic sink.
     * @param out             The printer for all user-facing output.
     * @param snapshotLocator Discovers snapshot versions.
     * @param tempDir         Where unit artifacts go when no dump path is configured.
     */
    public PipelineController(Toolchain toolchain, DriverOptions options, DiagnosticsEngine reporter, PrintWriter out,
                              SnapshotLocator snapshotLocator, Path tempDir) {
        this.toolchain = toolchain;
        this.options = options;
        this.reporter = reporter;
        this.out = out;
        this.snapshotLocator = snapshotLocator;
        this.tempDir = tempDir;
    }

    /**
     * Runs the pipeline.
     *
     * @param files      The program files, in command-line order.
     * @param otherFiles Auxiliary native sources and libraries for the build.
     * @return the merged status and the individual invocations.
     */
    public PipelineResult run(List<SourceDescriptor> files, List<SourceDescriptor> otherFiles) {
        return processFiles(files, otherFiles, true, null);
    }

    PipelineResult processFiles(List<SourceDescriptor> files, List<SourceDescriptor> otherFiles,
                                boolean lookForSnapshots, String programId) {
        if (options.verifySeparately() && files.size() > 1) {
            PipelineResult merged = PipelineResult.empty();
            for (SourceDescriptor file : files) {
                out.println();
                out.println("-------------------- " + file + " --------------------");
                out.flush();
                merged = merged.merge(processFiles(List.of(file), List.of(), lookForSnapshots, file.path().toString()));
            }
            return merged;
        }

        if (options.snapshotsEnabled() && lookForSnapshots) {
            List<SnapshotGroup> groups = snapshotLocator.locate(files);
            if (!groups.isEmpty()) {
                PipelineResult merged = PipelineResult.empty();
                for (SnapshotGroup group : groups) {
                    LOG.debug("Processing snapshot version {}: {}", group.version(), group.files());
                    merged = merged.merge(processFiles(group.files(), List.of(), false, programId));
                }
                return merged;
            }
            LOG.warn("Snapshot verification requested but no snapshot versions of {} exist; verifying the files as given",
                    files);
        }

        return PipelineResult.of(processProgram(files, otherFiles, programId));
    }

    private InvocationResult processProgram(List<SourceDescriptor> files, List<SourceDescriptor> otherFiles, String programId) {
        final List<String> fileNames = files.stream().map(SourceDescriptor::toString).collect(Collectors.toList());
        final String programName = files.size() == 1 ? fileNames.get(0) : MULTI_FILE_PROGRAM_NAME;

        ParseResult parsed = toolchain.frontEnd().parseCheck(files, programName, reporter);
        if (parsed.failed()) {
            LOG.debug("Front end rejected {}: {}", programName, parsed.error());
            out.println(parsed.error());
            out.flush();
            return new InvocationResult(fileNames, programName, ExitStatus.COMPILE_ERROR, null, null, null);
        }

        final IProgram program = parsed.program();
        InvocationResult result = new InvocationResult(fileNames, programName, ExitStatus.VERIFIED, null, null, null);
        if (program != null && options.verificationEnabled()) {
            result = verifyAndCompile(program, files, otherFiles, programId, fileNames, programName);
        } else if (program != null) {
            LOG.info("Verification of {} is disabled by configuration", programName);
        }

        if (program != null && options.printStats()) {
            toolchain.frontEnd().printStatistics(program, out);
        }
        if (program != null && options.printFunctionCallGraph()) {
            toolchain.frontEnd().printFunctionCallGraph(program, out);
        }
        out.flush();
        return result;
    }

    private InvocationResult verifyAndCompile(IProgram program, List<SourceDescriptor> files,
                                              List<SourceDescriptor> otherFiles, String programId,
                                              List<String> fileNames, String programName) {
        List<VcUnit> units = new VcTranslation(toolchain.translator(), toolchain.proofEngine()).translate(program, options);

        String baseName = files.get(files.size() - 1).fileName();
        VerificationRunner runner = new VerificationRunner(toolchain.proofEngine(), new DiagnosticsAdapter(reporter),
                out, options, tempDir);
        AggregateResult aggregate = new ResultAggregator(runner, out, options).verifyAll(units, baseName, programId);

        CodeGenResult codeGen = new CodeGenDispatcher(toolchain, out, options).dispatch(aggregate.worstOutcome(),
                aggregate.statisticsByUnit(), program, aggregate.verified(), files.get(0), otherFiles);

        ExitStatus status = aggregate.verified() ? codeGen.statusForVerifiedProgram() : ExitStatus.NOT_VERIFIED;
        LOG.debug("{}: {} unit(s), outcome {}, code generation {}, status {}", programName, units.size(),
                aggregate.worstOutcome(), codeGen.tag(), status);
        return new InvocationResult(fileNames, programName, status, aggregate.worstOutcome(),
                aggregate.statisticsByUnit(), codeGen.tag());
    }
}
