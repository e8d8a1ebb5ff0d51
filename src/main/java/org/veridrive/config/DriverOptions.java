package org.veridrive.config;

import com.typesafe.config.Config;
import org.veridrive.driver.codegen.CompilationTarget;

import java.nio.file.Path;
import java.util.List;

/**
 * The complete, immutable configuration of one driver run. It is built once from HOCON plus
 * command-line overrides and passed explicitly to the pipeline controller, the verification runner
 * and the code-generation dispatcher.
 *
 * @param verifySeparately       Verify each program file in its own pipeline invocation.
 * @param verifySnapshots        Snapshot mode; {@code -1} disables it, values above 1 also enable result caching.
 * @param resolve                Run resolution in the front end; when off, verification is skipped.
 * @param typecheck              Run type checking in the front end; when off, verification is skipped.
 * @param verify                 Run the proof engine at all.
 * @param printVcFile            Where to dump lowered units, or {@code null}.
 * @param prettyPrint            Pretty-print dumped units.
 * @param separateModuleOutput   Report elapsed time and statistics per unit.
 * @param compile                Generate and build code after successful verification.
 * @param forceCompile           Generate and build code regardless of the verification verdict.
 * @param spillTargetCode        0..3; how eagerly generated source is written without building.
 * @param procsToCheck           Restricts verification to these procedures; non-empty disables compilation.
 * @param compileTarget          The code-generation backend.
 * @param printCompiledFile      Base path for generated output instead of the input file, or {@code null}.
 * @param runAfterCompile        Build in memory and run the entry point immediately.
 * @param optimize               Build against the immutable-collections dependency.
 * @param useRuntimeLib          Add the runtime library jar to the build classpath.
 * @param runtimeLibraryDir      Directory holding the runtime library and the optimize dependency.
 * @param optimizeDependency     File name of the immutable-collections jar inside {@code runtimeLibraryDir}.
 * @param countVerificationErrors When off, every status but a preprocessing error exits with 0.
 * @param printStats             Print program statistics from the front end.
 * @param printFunctionCallGraph Print the function call graph from the front end.
 * @param stackSize              Stack budget in bytes of the pipeline worker thread.
 * @param reportFile             Where to write the JSON run report, or {@code null}.
 */
public record DriverOptions(
        boolean verifySeparately,
        int verifySnapshots,
        boolean resolve,
        boolean typecheck,
        boolean verify,
        Path printVcFile,
        boolean prettyPrint,
        boolean separateModuleOutput,
        boolean compile,
        boolean forceCompile,
        int spillTargetCode,
        List<String> procsToCheck,
        CompilationTarget compileTarget,
        Path printCompiledFile,
        boolean runAfterCompile,
        boolean optimize,
        boolean useRuntimeLib,
        Path runtimeLibraryDir,
        String optimizeDependency,
        boolean countVerificationErrors,
        boolean printStats,
        boolean printFunctionCallGraph,
        long stackSize,
        Path reportFile
) {
    /** Root path of the driver settings in HOCON. */
    public static final String CONFIG_PATH = "veridrive";

    /** Name of the runtime library jar inside {@link #runtimeLibraryDir()}. */
    public static final String RUNTIME_LIBRARY = "veridrive-runtime.jar";

    public DriverOptions {
        procsToCheck = procsToCheck != null ? List.copyOf(procsToCheck) : List.of();
        if (spillTargetCode < 0 || spillTargetCode > 3) {
            throw new IllegalArgumentException("spill-target-code must be between 0 and 3, was " + spillTargetCode);
        }
        if (stackSize <= 0) {
            throw new IllegalArgumentException("stack-size must be positive, was " + stackSize);
        }
    }

    /**
     * @return {@code true} if snapshot lookup is requested.
     */
    public boolean snapshotsEnabled() {
        return verifySnapshots >= 0;
    }

    /**
     * @return {@code true} if only a subset of procedures is verified, which rules out compilation.
     */
    public boolean partialProcedureSelection() {
        return !procsToCheck.isEmpty();
    }

    /**
     * @return {@code true} if the front-end checks and the proof engine are all enabled.
     */
    public boolean verificationEnabled() {
        return resolve && typecheck && verify;
    }

    /**
     * Reads all options from the {@code veridrive} section of the given configuration.
     *
     * @param config the resolved application configuration (must contain the reference defaults).
     * @return the options.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static DriverOptions fromConfig(Config config) {
        return builder(config).build();
    }

    /**
     * Returns a builder initialized from the {@code veridrive} section of the given configuration,
     * for callers that overlay command-line flags.
     */
    public static Builder builder(Config config) {
        Config c = config.getConfig(CONFIG_PATH);
        Builder b = new Builder();
        b.verifySeparately = c.getBoolean("verify-separately");
        b.verifySnapshots = c.getInt("verify-snapshots");
        b.resolve = c.getBoolean("resolve");
        b.typecheck = c.getBoolean("typecheck");
        b.verify = c.getBoolean("verify");
        b.printVcFile = optionalPath(c, "print-vc-file");
        b.prettyPrint = c.getBoolean("pretty-print");
        b.separateModuleOutput = c.getBoolean("separate-module-output");
        b.compile = c.getBoolean("compile");
        b.forceCompile = c.getBoolean("force-compile");
        b.spillTargetCode = c.getInt("spill-target-code");
        b.procsToCheck = c.getStringList("procs-to-check");
        b.compileTarget = CompilationTarget.fromName(c.getString("compile-target"));
        b.printCompiledFile = optionalPath(c, "print-compiled-file");
        b.runAfterCompile = c.getBoolean("run-after-compile");
        b.optimize = c.getBoolean("optimize");
        b.useRuntimeLib = c.getBoolean("use-runtime-lib");
        b.runtimeLibraryDir = Path.of(c.getString("runtime-library-dir"));
        b.optimizeDependency = c.getString("optimize-dependency");
        b.countVerificationErrors = c.getBoolean("count-verification-errors");
        b.printStats = c.getBoolean("print-stats");
        b.printFunctionCallGraph = c.getBoolean("print-function-call-graph");
        b.stackSize = c.getBytes("stack-size");
        b.reportFile = optionalPath(c, "report-file");
        return b;
    }

    private static Path optionalPath(Config c, String key) {
        if (!c.hasPath(key)) {
            return null;
        }
        String value = c.getString(key);
        return value.isBlank() ? null : Path.of(value);
    }

    /**
     * Mutable builder; every setter returns the builder.
     */
    public static final class Builder {
        private boolean verifySeparately;
        private int verifySnapshots = -1;
        private boolean resolve = true;
        private boolean typecheck = true;
        private boolean verify = true;
        private Path printVcFile;
        private boolean prettyPrint;
        private boolean separateModuleOutput;
        private boolean compile = true;
        private boolean forceCompile;
        private int spillTargetCode;
        private List<String> procsToCheck = List.of();
        private CompilationTarget compileTarget = CompilationTarget.JAVA;
        private Path printCompiledFile;
        private boolean runAfterCompile;
        private boolean optimize;
        private boolean useRuntimeLib;
        private Path runtimeLibraryDir = Path.of("lib");
        private String optimizeDependency = "guava.jar";
        private boolean countVerificationErrors = true;
        private boolean printStats;
        private boolean printFunctionCallGraph;
        private long stackSize = 256L * 1024 * 1024;
        private Path reportFile;

        /** Creates a builder holding the built-in defaults. */
        public Builder() {}

        public Builder verifySeparately(boolean value) { this.verifySeparately = value; return this; }
        public Builder verifySnapshots(int value) { this.verifySnapshots = value; return this; }
        public Builder resolve(boolean value) { this.resolve = value; return this; }
        public Builder typecheck(boolean value) { this.typecheck = value; return this; }
        public Builder verify(boolean value) { this.verify = value; return this; }
        public Builder printVcFile(Path value) { this.printVcFile = value; return this; }
        public Builder prettyPrint(boolean value) { this.prettyPrint = value; return this; }
        public Builder separateModuleOutput(boolean value) { this.separateModuleOutput = value; return this; }
        public Builder compile(boolean value) { this.compile = value; return this; }
        public Builder forceCompile(boolean value) { this.forceCompile = value; return this; }
        public Builder spillTargetCode(int value) { this.spillTargetCode = value; return this; }
        public Builder procsToCheck(List<String> value) { this.procsToCheck = value; return this; }
        public Builder compileTarget(CompilationTarget value) { this.compileTarget = value; return this; }
        public Builder printCompiledFile(Path value) { this.printCompiledFile = value; return this; }
        public Builder runAfterCompile(boolean value) { this.runAfterCompile = value; return this; }
        public Builder optimize(boolean value) { this.optimize = value; return this; }
        public Builder useRuntimeLib(boolean value) { this.useRuntimeLib = value; return this; }
        public Builder runtimeLibraryDir(Path value) { this.runtimeLibraryDir = value; return this; }
        public Builder optimizeDependency(String value) { this.optimizeDependency = value; return this; }
        public Builder countVerificationErrors(boolean value) { this.countVerificationErrors = value; return this; }
        public Builder printStats(boolean value) { this.printStats = value; return this; }
        public Builder printFunctionCallGraph(boolean value) { this.printFunctionCallGraph = value; return this; }
        public Builder stackSize(long value) { this.stackSize = value; return this; }
        public Builder reportFile(Path value) { this.reportFile = value; return this; }

        public DriverOptions build() {
            return new DriverOptions(verifySeparately, verifySnapshots, resolve, typecheck, verify,
                    printVcFile, prettyPrint, separateModuleOutput, compile, forceCompile, spillTargetCode,
                    procsToCheck, compileTarget, printCompiledFile, runAfterCompile, optimize, useRuntimeLib,
                    runtimeLibraryDir, optimizeDependency, countVerificationErrors, printStats,
                    printFunctionCallGraph, stackSize, reportFile);
        }
    }
}
