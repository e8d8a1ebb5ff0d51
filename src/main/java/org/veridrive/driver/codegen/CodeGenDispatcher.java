package org.veridrive.driver.codegen;

import org.veridrive.config.DriverOptions;
import org.veridrive.driver.api.IProgram;
import org.veridrive.driver.api.PipelineOutcome;
import org.veridrive.driver.api.PipelineStatistics;
import org.veridrive.driver.api.SourceDescriptor;
import org.veridrive.driver.api.SourceKind;
import org.veridrive.driver.api.ToolchainException;
import org.veridrive.driver.diagnostics.StatisticsTrailer;
import org.veridrive.driver.spi.ICodeGenerator;
import org.veridrive.driver.spi.INativeToolchain;
import org.veridrive.driver.spi.Toolchain;
import org.veridrive.driver.verify.ArtifactNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides from the verification verdict and the configuration whether to generate code, then
 * generates it, persists it and builds it as requested.
 * <p>
 * Code generation is only reachable for {@link PipelineOutcome#VERIFICATION_COMPLETED} and
 * {@link PipelineOutcome#DONE}; for any other outcome an error has already been reported.
 */
public class CodeGenDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(CodeGenDispatcher.class);

    /** Lint categories the generated code triggers routinely. */
    static final List<String> BENIGN_WARNINGS = List.of("rawtypes", "unchecked", "cast", "empty", "fallthrough");

    private final Toolchain toolchain;
    private final PrintWriter out;
    private final DriverOptions options;

    public CodeGenDispatcher(Toolchain toolchain, PrintWriter out, DriverOptions options) {
        this.toolchain = toolchain;
        this.out = out;
        this.options = options;
    }

    /**
     * Prints the combined statistics trailer and runs code generation if the outcome and
     * configuration call for it.
     *
     * @param outcome       The worst outcome over all units.
     * @param statistics    Statistics per unit.
     * @param program       The checked program.
     * @param verified      Whether every unit verified.
     * @param file          The program file output paths are derived from.
     * @param otherFiles    Auxiliary native sources and libraries.
     * @return what was done.
     */
    public CodeGenResult dispatch(PipelineOutcome outcome, Map<String, PipelineStatistics> statistics, IProgram program,
                                  boolean verified, SourceDescriptor file, List<SourceDescriptor> otherFiles) {
        final Path resultFile = options.printCompiledFile() != null ? options.printCompiledFile() : file.path();
        final boolean fullSelection = !options.partialProcedureSelection();

        switch (outcome) {
            case VERIFICATION_COMPLETED:
                StatisticsTrailer.write(out, PipelineStatistics.sum(statistics.values()));
                if ((options.compile() && verified && fullSelection) || options.forceCompile()) {
                    return generate(program, resultFile, otherFiles, true);
                }
                if ((options.spillTargetCode() >= 2 && verified && fullSelection) || options.spillTargetCode() >= 3) {
                    return generate(program, resultFile, otherFiles, false);
                }
                return CodeGenResult.skipped();

            case DONE:
                StatisticsTrailer.write(out, PipelineStatistics.sum(statistics.values()));
                if (options.forceCompile() || options.spillTargetCode() >= 3) {
                    return generate(program, resultFile, otherFiles, options.forceCompile());
                }
                return CodeGenResult.skipped();

            default:
                LOG.debug("Skipping code generation after outcome {}", outcome);
                return CodeGenResult.skipped();
        }
    }

    CodeGenResult generate(IProgram program, Path resultFile, List<SourceDescriptor> otherFiles, boolean build) {
        final CompilationTarget target = options.compileTarget();
        final ICodeGenerator generator;
        try {
            generator = toolchain.generator(target);
        } catch (ToolchainException e) {
            out.println("Error: cannot compile, because " + e.getMessage());
            out.flush();
            return CodeGenResult.of(CodeGenResult.Tag.BUILD_FAILED, null);
        }

        final int errorsBefore = program.diagnostics().errorCount();
        final Optional<String> entryPoint = generator.findEntryPoint(program);
        final String source = generator.generate(program);
        final boolean complete = program.diagnostics().errorCount() == errorsBefore;
        LOG.debug("Generated {} source for {} ({} chars, complete: {})", target, program.name(), source.length(), complete);

        Path written = null;
        if (options.spillTargetCode() > 0 || !otherFiles.isEmpty() || !target.requiresBuild()) {
            written = ArtifactNames.changeExtension(resultFile, target.extension());
            try {
                Files.writeString(written, source, StandardCharsets.UTF_8);
            } catch (IOException e) {
                LOG.error("Could not write generated program to {}", written, e);
                out.println("*** Error: could not write " + written + ": " + e.getMessage());
                out.flush();
                return CodeGenResult.of(CodeGenResult.Tag.OUTPUT_FAILED, null);
            }
            out.println(complete
                    ? "Compiled program written to " + written.getFileName()
                    : "File " + written.getFileName() + " contains the partially compiled program");
            out.flush();
        }

        if (!complete) {
            return CodeGenResult.of(CodeGenResult.Tag.INCOMPLETE, written);
        }
        if (!target.requiresBuild()) {
            return CodeGenResult.of(CodeGenResult.Tag.GENERATED, written);
        }
        if (!build) {
            return CodeGenResult.of(CodeGenResult.Tag.SPILLED, written);
        }
        return buildAndRun(source, entryPoint, resultFile, otherFiles, written);
    }

    private CodeGenResult buildAndRun(String source, Optional<String> entryPoint, Path resultFile,
                                      List<SourceDescriptor> otherFiles, Path written) {
        final INativeToolchain nativeToolchain = toolchain.nativeToolchain();
        final String baseName = ArtifactNames.stem(resultFile.getFileName().toString());
        final OutputKind kind = OutputKind.forEntryPoint(entryPoint.isPresent());
        final Path artifact = options.runAfterCompile() ? null : resultFile.resolveSibling(baseName + kind.suffix());

        BuildRequest request = new BuildRequest(
                baseName + "." + CompilationTarget.JAVA.extension(),
                source,
                entryPoint.orElse(null),
                kind,
                artifact,
                filesOfKind(otherFiles, SourceKind.NATIVE_SOURCE),
                buildClasspath(otherFiles),
                compilerOptions(),
                options.runAfterCompile());
        BuildResult build = nativeToolchain.build(request);
        try {
            return reportBuild(nativeToolchain, request, build, entryPoint, artifact, written);
        } finally {
            if (request.inMemory()) {
                nativeToolchain.release(build);
            }
        }
    }

    private CodeGenResult reportBuild(INativeToolchain nativeToolchain, BuildRequest request, BuildResult build,
                                      Optional<String> entryPoint, Path artifact, Path written) {
        if (options.runAfterCompile() && entryPoint.isEmpty()) {
            return new CodeGenResult(build.success() ? CodeGenResult.Tag.BUILT : CodeGenResult.Tag.BUILD_FAILED,
                    written, build, null);
        }
        if (!build.success()) {
            out.println("Errors compiling program into " + request.artifactName());
            for (String message : build.messages()) {
                out.println(message);
                out.println();
            }
            out.flush();
            return new CodeGenResult(CodeGenResult.Tag.BUILD_FAILED, written, build, null);
        }

        if (options.runAfterCompile()) {
            out.println("Program compiled successfully");
            out.println("Running...");
            out.println();
            out.flush();
            ExecutionResult execution = nativeToolchain.execute(build, entryPoint.get());
            if (execution.isFaulted()) {
                out.println("Error: Execution resulted in exception: " + execution.fault().getMessage());
                execution.fault().printStackTrace(out);
                out.flush();
                return new CodeGenResult(CodeGenResult.Tag.EXECUTION_FAULT, written, build, execution);
            }
            return new CodeGenResult(CodeGenResult.Tag.EXECUTED, written, build, execution);
        }

        out.println("Compiled program into " + request.artifactName());
        out.flush();
        if (options.optimize()) {
            try {
                copyOptimizeDependency(artifact);
            } catch (IOException e) {
                LOG.error("Could not copy optimize dependency", e);
                out.println("*** Error: could not copy optimize dependency " + options.optimizeDependency()
                        + ": " + e.getMessage());
                out.flush();
                return new CodeGenResult(CodeGenResult.Tag.OUTPUT_FAILED, written, build, null);
            }
        }
        return new CodeGenResult(CodeGenResult.Tag.BUILT, written, build, null);
    }

    private void copyOptimizeDependency(Path artifact) throws IOException {
        Path outputDir = artifact.getParent() != null ? artifact.getParent() : Path.of(".");
        Path source = options.runtimeLibraryDir().resolve(options.optimizeDependency());
        Files.copy(source, outputDir.resolve(options.optimizeDependency()), StandardCopyOption.REPLACE_EXISTING);
        out.println("Copied optimize dependency " + options.optimizeDependency() + " to " + outputDir);
        out.flush();
    }

    List<String> compilerOptions() {
        List<String> compilerOptions = new ArrayList<>();
        compilerOptions.add("-g");
        for (String category : BENIGN_WARNINGS) {
            compilerOptions.add("-Xlint:-" + category);
        }
        return compilerOptions;
    }

    List<Path> buildClasspath(List<SourceDescriptor> otherFiles) {
        List<Path> classpath = new ArrayList<>();
        if (options.useRuntimeLib()) {
            classpath.add(options.runtimeLibraryDir().resolve(DriverOptions.RUNTIME_LIBRARY));
        }
        if (options.optimize()) {
            classpath.add(options.runtimeLibraryDir().resolve(options.optimizeDependency()));
        }
        classpath.addAll(filesOfKind(otherFiles, SourceKind.NATIVE_LIBRARY));
        return classpath;
    }

    private static List<Path> filesOfKind(List<SourceDescriptor> files, SourceKind kind) {
        return files.stream().filter(f -> f.kind() == kind).map(SourceDescriptor::path).toList();
    }
}
