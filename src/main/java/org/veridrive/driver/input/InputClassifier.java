package org.veridrive.driver.input;

import org.veridrive.driver.api.SourceDescriptor;
import org.veridrive.driver.api.SourceKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sorts command-line file arguments into source programs and auxiliary native files by extension.
 */
public final class InputClassifier {

    /** Native sources compiled together with generated code. */
    public static final String NATIVE_SOURCE_EXTENSION = ".java";
    /** Prebuilt libraries added to the build classpath. */
    public static final String NATIVE_LIBRARY_EXTENSION = ".jar";

    private final Set<String> programExtensions;

    /**
     * @param programExtensions extensions (with dot) recognized as source programs, usually from the front end.
     */
    public InputClassifier(Set<String> programExtensions) {
        this.programExtensions = programExtensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Classifies every argument, in order.
     *
     * @param arguments the file arguments as given.
     * @return the programs and the auxiliary files.
     * @throws InvalidInputException if there are no arguments, none of them is a program, or one has an
     *                               unsupported extension.
     */
    public ClassifiedInputs classify(List<String> arguments) throws InvalidInputException {
        if (arguments.isEmpty()) {
            throw new InvalidInputException("No input files were specified.");
        }
        List<SourceDescriptor> programs = new ArrayList<>();
        List<SourceDescriptor> otherFiles = new ArrayList<>();
        for (String argument : arguments) {
            SourceDescriptor descriptor = classify(argument);
            if (descriptor.kind() == SourceKind.PROGRAM) {
                programs.add(descriptor);
            } else {
                otherFiles.add(descriptor);
            }
        }
        if (programs.isEmpty()) {
            throw new InvalidInputException("No program files were specified.");
        }
        return new ClassifiedInputs(programs, otherFiles);
    }

    private SourceDescriptor classify(String argument) throws InvalidInputException {
        Path path = Path.of(argument);
        String extension = SourceDescriptor.extensionOf(path.getFileName() != null ? path.getFileName().toString() : argument);
        if (programExtensions.contains(extension)) {
            return new SourceDescriptor(path, SourceKind.PROGRAM);
        }
        if (NATIVE_SOURCE_EXTENSION.equals(extension)) {
            return new SourceDescriptor(path, SourceKind.NATIVE_SOURCE);
        }
        if (NATIVE_LIBRARY_EXTENSION.equals(extension)) {
            return new SourceDescriptor(path, SourceKind.NATIVE_LIBRARY);
        }
        throw new InvalidInputException(String.format(
                "'%s': Filename extension '%s' is not supported. Input files must be programs (%s), "
                        + "Java sources (%s) or Java libraries (%s)",
                argument, extension, String.join(", ", programExtensions.stream().sorted().toList()),
                NATIVE_SOURCE_EXTENSION, NATIVE_LIBRARY_EXTENSION));
    }

    /**
     * The result of classification.
     *
     * @param programs   Source-program files, in command-line order.
     * @param otherFiles Native sources and libraries, in command-line order.
     */
    public record ClassifiedInputs(List<SourceDescriptor> programs, List<SourceDescriptor> otherFiles) {
        public ClassifiedInputs {
            programs = List.copyOf(programs);
            otherFiles = List.copyOf(otherFiles);
        }
    }
}
