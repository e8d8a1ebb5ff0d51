package org.veridrive.driver.codegen;

import org.veridrive.driver.api.ExitStatus;

import java.nio.file.Path;
import java.util.Objects;

/**
 * What the code-generation stage did. The tag separates build failures from faults of the built
 * program, which never turn a successful build into a failed one.
 *
 * @param tag         The kind of result.
 * @param writtenFile The generated source written to disk, or {@code null}.
 * @param build       The build result, or {@code null} if no build ran.
 * @param execution   The execution result, or {@code null} if nothing ran.
 */
public record CodeGenResult(Tag tag, Path writtenFile, BuildResult build, ExecutionResult execution) {

    public enum Tag {
        /** The outcome or configuration did not ask for code generation. */
        SKIPPED,
        /** Complete source was generated without a build. */
        SPILLED,
        /** Complete source was generated for a target that has no build step. */
        GENERATED,
        /** The generated source was built into an artifact. */
        BUILT,
        /** The build ran and its entry point returned normally. */
        EXECUTED,
        /** The build ran and its entry point threw. */
        EXECUTION_FAULT,
        /** Generation reported errors; only partial source exists. */
        INCOMPLETE,
        /** The native compiler rejected the source. */
        BUILD_FAILED,
        /** Generated output or the optimize dependency could not be written. */
        OUTPUT_FAILED
    }

    public CodeGenResult {
        Objects.requireNonNull(tag, "tag");
    }

    public static CodeGenResult skipped() {
        return new CodeGenResult(Tag.SKIPPED, null, null, null);
    }

    public static CodeGenResult of(Tag tag, Path writtenFile) {
        return new CodeGenResult(tag, writtenFile, null, null);
    }

    /**
     * @return {@code true} unless generation was incomplete, the build failed or output could not be written.
     */
    public boolean succeeded() {
        return tag != Tag.INCOMPLETE && tag != Tag.BUILD_FAILED && tag != Tag.OUTPUT_FAILED;
    }

    /**
     * Returns the exit status of a verified program given this result.
     * <p>
     * Generating source without building it ({@link Tag#SPILLED}) counts as success, as do
     * {@link Tag#SKIPPED}, {@link Tag#GENERATED} and an execution fault after a good build. Only an
     * incomplete generation or a failed build is {@link ExitStatus#COMPILE_ERROR}, and only an
     * output that could not be written is {@link ExitStatus#COMPILE_OUTPUT_ERROR}.
     */
    public ExitStatus statusForVerifiedProgram() {
        if (succeeded()) {
            return ExitStatus.VERIFIED;
        }
        return tag == Tag.OUTPUT_FAILED ? ExitStatus.COMPILE_OUTPUT_ERROR : ExitStatus.COMPILE_ERROR;
    }
}
