package org.veridrive.driver.codegen;

/**
 * What a native build produces, decided by whether the program has an entry point.
 */
public enum OutputKind {
    /** A jar with a {@code Main-Class} manifest entry. */
    EXECUTABLE(".jar"),
    /** A plain jar meant to be linked against. */
    LIBRARY(".lib.jar");

    private final String suffix;

    OutputKind(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    public static OutputKind forEntryPoint(boolean hasEntryPoint) {
        return hasEntryPoint ? EXECUTABLE : LIBRARY;
    }
}
