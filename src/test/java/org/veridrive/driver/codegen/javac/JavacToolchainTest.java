package org.veridrive.driver.codegen.javac;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.veridrive.driver.codegen.BuildRequest;
import org.veridrive.driver.codegen.BuildResult;
import org.veridrive.driver.codegen.ExecutionResult;
import org.veridrive.driver.codegen.OutputKind;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.Attributes;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the real JDK compiler, so these tests need a JDK rather than a JRE.
 */
@Tag("integration")
class JavacToolchainTest {

    private static final String HELLO = "public class Hello {\n"
            + "    public static void main(String[] args) {\n"
            + "        System.out.println(\"hello\");\n"
            + "    }\n"
            + "}\n";

    @TempDir
    Path tempDir;

    private Path workDir;
    private JavacToolchain toolchain;

    @BeforeEach
    void setUp() throws Exception {
        workDir = Files.createDirectories(tempDir.resolve("work"));
        toolchain = new JavacToolchain(workDir);
    }

    private List<Path> leftovers() throws Exception {
        try (Stream<Path> entries = Files.list(workDir)) {
            return entries.collect(Collectors.toList());
        }
    }

    private static BuildRequest request(String source, String entryPoint, Path artifact, boolean inMemory) {
        return new BuildRequest("prog.java", source, entryPoint,
                OutputKind.forEntryPoint(entryPoint != null), artifact, List.of(), List.of(), List.of("-g"), inMemory);
    }

    @Test
    void build_executable_shouldWriteJarWithMainClass() throws Exception {
        Path artifact = tempDir.resolve("prog.jar");

        BuildResult result = toolchain.build(request(HELLO, "Hello", artifact, false));

        assertThat(result.success()).isTrue();
        assertThat(result.artifact()).isEqualTo(artifact);
        try (JarFile jar = new JarFile(artifact.toFile())) {
            assertThat(jar.getManifest().getMainAttributes().getValue(Attributes.Name.MAIN_CLASS)).isEqualTo("Hello");
            assertThat(jar.getEntry("Hello.class")).isNotNull();
        }
    }

    @Test
    void build_library_shouldOmitMainClass() throws Exception {
        Path artifact = tempDir.resolve("out").resolve("prog.lib.jar");
        String library = "public class Util { public static int answer() { return 42; } }\n";

        BuildResult result = toolchain.build(request(library, null, artifact, false));

        assertThat(result.success()).isTrue();
        try (JarFile jar = new JarFile(artifact.toFile())) {
            assertThat(jar.getManifest().getMainAttributes().getValue(Attributes.Name.MAIN_CLASS)).isNull();
        }
    }

    @Test
    void build_withNativeSource_shouldCompileBothTogether() throws Exception {
        Path helper = tempDir.resolve("Helper.java");
        Files.writeString(helper, "public class Helper { public static String greeting() { return \"hi\"; } }\n");
        String main = "public class Main { public static void main(String[] a) { Helper.greeting(); } }\n";
        BuildRequest request = new BuildRequest("prog.java", main, "Main", OutputKind.EXECUTABLE,
                null, List.of(helper), List.of(), List.of(), true);

        BuildResult result = toolchain.build(request);

        assertThat(result.success()).isTrue();
        assertThat(result.classesDirectory().resolve("Helper.class")).exists();
    }

    @Test
    void build_invalidSource_shouldReturnCompilerErrors() {
        BuildResult result = toolchain.build(request("public class Broken { int x = ; }\n", null,
                tempDir.resolve("prog.lib.jar"), false));

        assertThat(result.success()).isFalse();
        assertThat(result.artifact()).isNull();
        assertThat(result.messages()).isNotEmpty();
        assertThat(result.messages().get(0)).startsWith("prog.java:1: error:");
        assertThat(tempDir.resolve("prog.lib.jar")).doesNotExist();
    }

    @Test
    void execute_inMemoryBuild_shouldRunMain() {
        BuildResult build = toolchain.build(request(HELLO, "Hello", null, true));

        ExecutionResult result = toolchain.execute(build, "Hello");

        assertThat(build.artifact()).isNull();
        assertThat(result.isFaulted()).isFalse();
    }

    @Test
    void execute_throwingProgram_shouldCaptureFault() {
        String failing = "public class Boom { public static void main(String[] a) { throw new IllegalStateException(\"boom\"); } }\n";
        BuildResult build = toolchain.build(request(failing, "Boom", null, true));

        ExecutionResult result = toolchain.execute(build, "Boom");

        assertThat(result.isFaulted()).isTrue();
        assertThat(result.fault()).isInstanceOf(IllegalStateException.class).hasMessage("boom");
    }

    @Test
    void execute_missingEntryPoint_shouldCaptureFault() {
        BuildResult build = toolchain.build(request(HELLO, "Hello", null, true));

        ExecutionResult result = toolchain.execute(build, "Missing");

        assertThat(result.fault()).isInstanceOf(ClassNotFoundException.class);
    }

    @Test
    @DisplayName("Packaged builds leave no class output behind")
    void build_jar_shouldDeleteClassOutput() throws Exception {
        BuildResult result = toolchain.build(request(HELLO, "Hello", tempDir.resolve("prog.jar"), false));

        assertThat(result.success()).isTrue();
        assertThat(result.classesDirectory()).isNull();
        assertThat(leftovers()).isEmpty();
    }

    @Test
    void build_failure_shouldDeleteClassOutput() throws Exception {
        BuildResult result = toolchain.build(request("public class Broken { int x = ; }\n", null, null, true));

        assertThat(result.success()).isFalse();
        assertThat(leftovers()).isEmpty();
    }

    @Test
    void release_inMemoryBuild_shouldDeleteClassOutput() throws Exception {
        BuildResult build = toolchain.build(request(HELLO, "Hello", null, true));
        assertThat(build.classesDirectory()).exists();
        assertThat(build.classesDirectory().getParent()).isEqualTo(workDir);

        toolchain.execute(build, "Hello");
        toolchain.release(build);

        assertThat(build.classesDirectory()).doesNotExist();
        assertThat(leftovers()).isEmpty();
    }

    @Test
    void execute_failedBuild_shouldBeRejected() {
        assertThatThrownBy(() -> toolchain.execute(BuildResult.failure(List.of("x")), "Hello"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
