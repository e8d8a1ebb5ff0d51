package org.veridrive.driver.codegen;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Everything the native toolchain needs to build one generated program.
 *
 * @param sourceName      File name the generated source is compiled under, e.g. {@code "max.java"}.
 * @param source          The generated source text.
 * @param entryPoint      Fully qualified class holding {@code main}, or {@code null} for a library.
 * @param outputKind      Executable or library.
 * @param artifact        Where the jar is written; ignored when {@code inMemory} is set.
 * @param nativeSources   Additional source files compiled together with the generated source.
 * @param classpath       Library jars referenced by the build.
 * @param compilerOptions Options passed to the compiler as is.
 * @param inMemory        Build for immediate execution without writing an artifact.
 */
public record BuildRequest(
        String sourceName,
        String source,
        String entryPoint,
        OutputKind outputKind,
        Path artifact,
        List<Path> nativeSources,
        List<Path> classpath,
        List<String> compilerOptions,
        boolean inMemory
) {
    public BuildRequest {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(outputKind, "outputKind");
        nativeSources = List.copyOf(nativeSources);
        classpath = List.copyOf(classpath);
        compilerOptions = List.copyOf(compilerOptions);
    }

    /**
     * @return the name the build output is reported under.
     */
    public String artifactName() {
        return artifact != null ? artifact.getFileName().toString() : sourceName;
    }
}
