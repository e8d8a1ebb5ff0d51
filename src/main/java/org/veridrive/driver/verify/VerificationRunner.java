package org.veridrive.driver.verify;

import org.veridrive.config.DriverOptions;
import org.veridrive.driver.api.IVcProgram;
import org.veridrive.driver.api.PipelineOutcome;
import org.veridrive.driver.api.PipelineStatistics;
import org.veridrive.driver.api.VcUnit;
import org.veridrive.driver.api.VerificationResult;
import org.veridrive.driver.diagnostics.IDiagnosticsSink;
import org.veridrive.driver.spi.IProofEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Drives one verification unit through the proof engine: resolve and type check, the optimization
 * passes, then solving.
 * <p>
 * Units come from the translator, so a resolution or type-checking failure is a defect in the
 * translation rather than in the source program. In that case the unit is written to its artifact
 * file, parsed back and checked once more, so the engine's messages point at real lines of a file
 * the user can open. The outcome returned is the one from the first check.
 */
public class VerificationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(VerificationRunner.class);

    static final String RERUN_BANNER =
            "*** Encountered internal translation error - re-running the proof engine to get better debug information";

    private final IProofEngine proofEngine;
    private final IDiagnosticsSink sink;
    private final PrintWriter out;
    private final DriverOptions options;
    private final Path tempDir;

    /**
     * @param proofEngine The engine.
     * @param sink        Where the engine reports; normally a {@link org.veridrive.driver.diagnostics.DiagnosticsAdapter}.
     * @param out         The printer for user-facing output.
     * @param options     The run configuration.
     * @param tempDir     The directory for unit artifacts when no dump path is configured.
     */
    public VerificationRunner(IProofEngine proofEngine, IDiagnosticsSink sink, PrintWriter out,
                              DriverOptions options, Path tempDir) {
        this.proofEngine = proofEngine;
        this.sink = sink;
        this.out = out;
        this.options = options;
        this.tempDir = tempDir;
    }

    /**
     * Verifies one unit.
     *
     * @param unit         The unit.
     * @param baseFileName The input file name artifacts are named after.
     * @param programId    The id of this program for result caching, or {@code null}.
     * @return the unit's statistics and outcome.
     */
    public UnitResult runUnit(VcUnit unit, String baseFileName, String programId) {
        final String cacheId = options.verifySnapshots() > 1 ? ArtifactNames.cacheId(programId, unit.name()) : null;
        final Path artifact = ArtifactNames.unitArtifact(options.printVcFile(), baseFileName, unit.name(),
                proofEngine.vcFileExtension(), tempDir);
        final IVcProgram program = unit.program();

        LOG.debug("Verifying unit '{}' (artifact {}, cache id {})", unit.name(), artifact, cacheId);
        PipelineOutcome outcome = proofEngine.resolveAndTypecheck(program, artifact.toString(), sink);
        switch (outcome) {
            case DONE:
                return new UnitResult(unit.name(), PipelineStatistics.EMPTY, outcome);

            case RESOLUTION_ERROR:
            case TYPE_CHECKING_ERROR:
                rerunForDiagnostics(unit, artifact);
                return new UnitResult(unit.name(), PipelineStatistics.EMPTY, outcome);

            case RESOLVED_AND_TYPE_CHECKED:
                proofEngine.eliminateDeadVariables(program);
                proofEngine.collectModSets(program);
                proofEngine.coalesceBlocks(program);
                proofEngine.inline(program);
                VerificationResult result = proofEngine.inferAndVerify(program, cacheId, sink);
                return new UnitResult(unit.name(), result.statistics(), result.outcome());

            default:
                throw new IllegalStateException("Unexpected outcome of resolve/typecheck for unit '"
                        + unit.name() + "': " + outcome);
        }
    }

    private void rerunForDiagnostics(VcUnit unit, Path artifact) {
        LOG.warn("Unit '{}' failed to resolve or type check; dumping it to {}", unit.name(), artifact);
        try {
            proofEngine.printVcFile(artifact, unit.program(), options.prettyPrint());
        } catch (IOException e) {
            LOG.error("Could not write {} for the diagnostic re-run", artifact, e);
            return;
        }
        out.println();
        out.println(RERUN_BANNER);
        out.println();
        out.flush();

        try {
            Optional<IVcProgram> reparsed = proofEngine.parseVcFiles(List.of(artifact));
            if (reparsed.isPresent()) {
                proofEngine.resolveAndTypecheck(reparsed.get(), artifact.toString(), sink);
            } else {
                LOG.warn("Dumped unit {} did not parse; no further diagnostics available", artifact);
            }
        } catch (IOException e) {
            LOG.error("Could not read back {} for the diagnostic re-run", artifact, e);
        }
    }
}
