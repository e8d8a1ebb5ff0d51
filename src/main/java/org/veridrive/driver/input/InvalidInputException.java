package org.veridrive.driver.input;

/**
 * Thrown when the command-line inputs cannot be used; the run ends with a preprocessing error
 * before any file is read.
 */
public class InvalidInputException extends Exception {

    public InvalidInputException(String message) {
        super(message);
    }
}
