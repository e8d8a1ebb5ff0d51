package org.veridrive.driver.api;

/**
 * Thrown when the external collaborators needed for a run cannot be located or are incomplete,
 * e.g. no toolchain provider is registered or no generator exists for the selected target.
 */
public class ToolchainException extends Exception {

    /**
     * Constructs a new toolchain exception with the specified detail message.
     * @param message The detail message.
     */
    public ToolchainException(String message) {
        super(message);
    }

    /**
     * Constructs a new toolchain exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ToolchainException(String message, Throwable cause) {
        super(message, cause);
    }
}
