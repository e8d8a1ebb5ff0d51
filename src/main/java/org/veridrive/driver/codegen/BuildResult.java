package org.veridrive.driver.codegen;

import java.nio.file.Path;
import java.util.List;

/**
 * The outcome of a native build.
 *
 * @param success          {@code true} if the compiler reported no errors and packaging succeeded.
 * @param artifact         The written jar, or {@code null} for in-memory and failed builds.
 * @param classesDirectory The compiled classes of a successful in-memory build, or {@code null}.
 * @param classpath        The library jars the build referenced; execution needs them too.
 * @param messages         Compiler and packaging errors, in the order reported.
 */
public record BuildResult(boolean success, Path artifact, Path classesDirectory, List<Path> classpath, List<String> messages) {

    public BuildResult {
        classpath = classpath != null ? List.copyOf(classpath) : List.of();
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    public static BuildResult failure(List<String> messages) {
        return new BuildResult(false, null, null, List.of(), messages);
    }
}
