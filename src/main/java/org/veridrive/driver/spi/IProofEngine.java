package org.veridrive.driver.spi;

import org.veridrive.driver.api.IVcProgram;
import org.veridrive.driver.api.PipelineOutcome;
import org.veridrive.driver.api.VerificationResult;
import org.veridrive.driver.diagnostics.IDiagnosticsSink;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The external proof engine. Each method is a blocking call; the engine may parallelize its own
 * solving internally.
 */
public interface IProofEngine {

    /**
     * Resolves and type checks a lowered unit.
     *
     * @param program  The unit.
     * @param fileName The artifact file name used in the engine's messages.
     * @param sink     Where to report problems.
     * @return {@link PipelineOutcome#DONE}, {@link PipelineOutcome#RESOLUTION_ERROR},
     *         {@link PipelineOutcome#TYPE_CHECKING_ERROR} or {@link PipelineOutcome#RESOLVED_AND_TYPE_CHECKED}.
     */
    PipelineOutcome resolveAndTypecheck(IVcProgram program, String fileName, IDiagnosticsSink sink);

    void eliminateDeadVariables(IVcProgram program);

    void collectModSets(IVcProgram program);

    void coalesceBlocks(IVcProgram program);

    void inline(IVcProgram program);

    /**
     * Infers invariants and discharges the proof obligations of a resolved unit.
     *
     * @param program   The unit, after the optimization passes.
     * @param programId The cache key for incremental verification, or {@code null} when caching is off.
     * @param sink      Where to report failed proof obligations.
     * @return the outcome and the unit's statistics.
     */
    VerificationResult inferAndVerify(IVcProgram program, String programId, IDiagnosticsSink sink);

    /**
     * Writes a unit to disk in the engine's textual format.
     *
     * @throws IOException if the file cannot be written.
     */
    void printVcFile(Path file, IVcProgram program, boolean prettyPrint) throws IOException;

    /**
     * Parses previously printed units.
     *
     * @return the parsed program, or empty if the text did not parse.
     * @throws IOException if a file cannot be read.
     */
    Optional<IVcProgram> parseVcFiles(List<Path> files) throws IOException;

    /**
     * @return the extension, without dot, of the engine's textual format.
     */
    default String vcFileExtension() {
        return "vc";
    }
}
