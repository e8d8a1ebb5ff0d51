package org.veridrive.driver.codegen.javac;

import org.veridrive.driver.codegen.BuildRequest;
import org.veridrive.driver.codegen.BuildResult;
import org.veridrive.driver.codegen.ExecutionResult;
import org.veridrive.driver.spi.INativeToolchain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.URI;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The bundled native toolchain: compiles generated Java source with the {@code javax.tools}
 * compiler, packages the classes into a jar and runs entry points through a class loader.
 * <p>
 * The compiler is taken from a {@link ServiceLoader} registration if there is one, otherwise from
 * the running JDK. Without either, builds fail with a message instead of throwing.
 */
public class JavacToolchain implements INativeToolchain {

    private static final Logger LOG = LoggerFactory.getLogger(JavacToolchain.class);

    static final String CLASSES_PREFIX = "veridrive-classes";

    private final Path workDirectory;
    private JavaCompiler javaCompiler;

    /**
     * Creates a toolchain that puts class output under the system temporary directory.
     */
    public JavacToolchain() {
        this(null);
    }

    /**
     * @param workDirectory Where class output directories are created, or {@code null} for the
     *                      system temporary directory.
     */
    public JavacToolchain(Path workDirectory) {
        this.workDirectory = workDirectory;
    }

    private JavaCompiler javaCompiler() {
        if (javaCompiler == null) {
            final Iterator<JavaCompiler> iterator = ServiceLoader.load(JavaCompiler.class).iterator();
            javaCompiler = iterator.hasNext() ? iterator.next() : ToolProvider.getSystemJavaCompiler();
        }
        return javaCompiler;
    }

    @Override
    public BuildResult build(BuildRequest request) {
        final JavaCompiler compiler = javaCompiler();
        if (compiler == null) {
            return BuildResult.failure(List.of("Cannot find a Java compiler; building generated code requires a JDK"));
        }

        final Path classes;
        try {
            classes = workDirectory != null
                    ? Files.createTempDirectory(workDirectory, CLASSES_PREFIX)
                    : Files.createTempDirectory(CLASSES_PREFIX);
        } catch (IOException e) {
            return BuildResult.failure(List.of("Could not create a class output directory: " + e.getMessage()));
        }

        BuildResult result = null;
        try {
            result = compileAndPackage(compiler, classes, request);
            return result;
        } finally {
            // In-memory builds keep their classes until release().
            if (result == null || !result.success() || !request.inMemory()) {
                deleteRecursively(classes);
            }
        }
    }

    private BuildResult compileAndPackage(JavaCompiler compiler, Path classes, BuildRequest request) {
        final List<String> options = new ArrayList<>(request.compilerOptions());
        options.add("-d");
        options.add(classes.toString());
        if (!request.classpath().isEmpty()) {
            options.add("-classpath");
            options.add(request.classpath().stream().map(Path::toString).collect(Collectors.joining(File.pathSeparator)));
        }
        LOG.debug("Compiling {} with options {}", request.sourceName(), options);

        final DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        final boolean compiled;
        try (StandardJavaFileManager fileManager =
                     compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            final List<JavaFileObject> units = new ArrayList<>();
            units.add(new GeneratedSource(request.sourceName(), request.source()));
            fileManager.getJavaFileObjectsFromPaths(request.nativeSources()).forEach(units::add);
            compiled = compiler.getTask(null, fileManager, diagnostics, options, null, units).call();
        } catch (IOException | IllegalArgumentException e) {
            return new BuildResult(false, null, null, request.classpath(),
                    List.of("Could not run the Java compiler: " + e.getMessage()));
        }

        if (!compiled) {
            List<String> messages = diagnostics.getDiagnostics().stream()
                    .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                    .map(JavacToolchain::format)
                    .collect(Collectors.toList());
            if (messages.isEmpty()) {
                messages.add("Compilation of " + request.sourceName() + " failed");
            }
            return new BuildResult(false, null, null, request.classpath(), messages);
        }

        if (request.inMemory()) {
            return new BuildResult(true, null, classes, request.classpath(), List.of());
        }
        try {
            writeJar(classes, request);
        } catch (IOException e) {
            LOG.error("Could not package {}", request.artifact(), e);
            return new BuildResult(false, null, null, request.classpath(),
                    List.of("Could not write " + request.artifact() + ": " + e.getMessage()));
        }
        return new BuildResult(true, request.artifact(), null, request.classpath(), List.of());
    }

    /**
     * Deletes the class output of an in-memory build. Packaged and failed builds have already
     * been cleaned up by {@link #build}.
     */
    @Override
    public void release(BuildResult build) {
        if (build.classesDirectory() != null) {
            deleteRecursively(build.classesDirectory());
        }
    }

    private static void deleteRecursively(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> files = Files.walk(directory)) {
            for (Path file : files.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(file);
            }
        } catch (IOException e) {
            LOG.warn("Could not delete class output directory {}: {}", directory, e.getMessage());
        }
    }

    @Override
    public ExecutionResult execute(BuildResult build, String entryPoint) {
        if (!build.success() || build.classesDirectory() == null) {
            throw new IllegalArgumentException("Cannot execute a failed build");
        }
        try {
            final List<URL> urls = new ArrayList<>();
            urls.add(build.classesDirectory().toUri().toURL());
            for (Path library : build.classpath()) {
                urls.add(library.toUri().toURL());
            }
            try (URLClassLoader loader = new URLClassLoader(urls.toArray(new URL[0]), ClassLoader.getPlatformClassLoader())) {
                final Class<?> mainClass = Class.forName(entryPoint, true, loader);
                Method main;
                Object[] arguments;
                try {
                    main = mainClass.getMethod("main", String[].class);
                    arguments = new Object[] {new String[0]};
                } catch (NoSuchMethodException e) {
                    main = mainClass.getMethod("main");
                    arguments = new Object[0];
                }
                main.invoke(null, arguments);
                return ExecutionResult.completed();
            }
        } catch (InvocationTargetException e) {
            return ExecutionResult.faulted(e.getCause() != null ? e.getCause() : e);
        } catch (ReflectiveOperationException | IOException | LinkageError e) {
            return ExecutionResult.faulted(e);
        }
    }

    private static void writeJar(Path classes, BuildRequest request) throws IOException {
        final Manifest manifest = new Manifest();
        manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
        if (request.entryPoint() != null) {
            manifest.getMainAttributes().put(Attributes.Name.MAIN_CLASS, request.entryPoint());
        }
        final Path artifact = request.artifact();
        if (artifact.getParent() != null) {
            Files.createDirectories(artifact.getParent());
        }
        try (OutputStream os = Files.newOutputStream(artifact);
             JarOutputStream jar = new JarOutputStream(os, manifest);
             Stream<Path> files = Files.walk(classes)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().collect(Collectors.toList())) {
                String name = classes.relativize(file).toString().replace(File.separatorChar, '/');
                jar.putNextEntry(new JarEntry(name));
                Files.copy(file, jar);
                jar.closeEntry();
            }
        }
        LOG.debug("Wrote {}", artifact);
    }

    private static String format(Diagnostic<? extends JavaFileObject> d) {
        String location = d.getSource() != null
                ? d.getSource().getName() + ":" + d.getLineNumber() + ": "
                : "";
        return location + "error: " + d.getMessage(Locale.ROOT);
    }

    /**
     * Generated source held in memory. The generator decides the class names, so the file name
     * is accepted for any top-level class.
     */
    private static final class GeneratedSource extends SimpleJavaFileObject {
        private final String name;
        private final String source;

        GeneratedSource(String name, String source) {
            super(URI.create("string:///" + name), Kind.SOURCE);
            this.name = name;
            this.source = source;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean isNameCompatible(String simpleName, Kind kind) {
            return kind == Kind.SOURCE;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return source;
        }
    }
}
