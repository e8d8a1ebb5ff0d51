package org.veridrive.driver.api;

/**
 * The result of parsing and checking the source files. Exactly one of {@code error} and
 * {@code program} is set, except that a front end may return neither when there was nothing to check.
 *
 * @param error   The front end's error message, or {@code null} on success.
 * @param program The checked program, or {@code null} on failure.
 */
public record ParseResult(String error, IProgram program) {

    public static ParseResult success(IProgram program) {
        return new ParseResult(null, program);
    }

    public static ParseResult failure(String error) {
        return new ParseResult(error, null);
    }

    public boolean failed() {
        return error != null;
    }
}
