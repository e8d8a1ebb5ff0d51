package org.veridrive.driver.spi;

import org.veridrive.driver.codegen.BuildRequest;
import org.veridrive.driver.codegen.BuildResult;
import org.veridrive.driver.codegen.ExecutionResult;

/**
 * Builds generated source into a runnable or linkable artifact and runs it in-process.
 */
public interface INativeToolchain {

    /**
     * Compiles the request. Compiler errors are returned in the result, not thrown.
     */
    BuildResult build(BuildRequest request);

    /**
     * Runs the entry point of a successful build.
     *
     * @param build      A result with {@link BuildResult#success()} set.
     * @param entryPoint The fully qualified class holding {@code main}.
     * @return the outcome; a fault raised by the program is captured in it.
     */
    ExecutionResult execute(BuildResult build, String entryPoint);

    /**
     * Frees what an in-memory build holds on to. Called once the build is no longer needed.
     */
    default void release(BuildResult build) {
    }
}
