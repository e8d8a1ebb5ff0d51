package org.veridrive.driver.spi;

import org.veridrive.driver.api.IProgram;
import org.veridrive.driver.api.ParseResult;
import org.veridrive.driver.api.SourceDescriptor;
import org.veridrive.driver.diagnostics.DiagnosticsEngine;

import java.io.PrintWriter;
import java.util.List;
import java.util.Set;

/**
 * Parses, resolves and type checks source programs into an {@link IProgram}.
 */
public interface IFrontEnd {

    /**
     * @return the lower-cased extensions (with dot) of source-program files, e.g. {@code ".vp"}.
     */
    Set<String> sourceExtensions();

    /**
     * Parses and checks the given files as one program.
     *
     * @param files       The program files, in command-line order.
     * @param programName The name to use in diagnostics.
     * @param reporter    The sink the front end reports source-level problems to; it becomes the
     *                    program's attached sink.
     * @return the checked program or the error message.
     */
    ParseResult parseCheck(List<SourceDescriptor> files, String programName, DiagnosticsEngine reporter);

    /**
     * Prints size statistics of a checked program. The default prints nothing.
     */
    default void printStatistics(IProgram program, PrintWriter out) {
    }

    /**
     * Prints the function call graph of a checked program. The default prints nothing.
     */
    default void printFunctionCallGraph(IProgram program, PrintWriter out) {
    }
}
