package org.veridrive.driver.codegen;

import java.util.Locale;

/**
 * The closed set of code-generation backends.
 */
public enum CompilationTarget {
    /** Java source, built into a jar by the native toolchain. */
    JAVA("java", true),
    /** A self-contained script; there is no build step. */
    JAVASCRIPT("js", false);

    private final String extension;
    private final boolean requiresBuild;

    CompilationTarget(String extension, boolean requiresBuild) {
        this.extension = extension;
        this.requiresBuild = requiresBuild;
    }

    /**
     * @return the canonical file extension of generated source, without the dot.
     */
    public String extension() {
        return extension;
    }

    /**
     * @return {@code true} if generated source goes through the native build step.
     */
    public boolean requiresBuild() {
        return requiresBuild;
    }

    /**
     * Parses a target name as used in configuration ({@code java}, {@code javascript} or {@code js}).
     *
     * @param name the configured name.
     * @return the target.
     * @throws IllegalArgumentException for unknown names.
     */
    public static CompilationTarget fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "java" -> JAVA;
            case "javascript", "js" -> JAVASCRIPT;
            default -> throw new IllegalArgumentException("Unknown compile target '" + name + "'");
        };
    }
}
