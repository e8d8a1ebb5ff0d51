package org.veridrive.driver.codegen;

/**
 * The outcome of running a built program in-process.
 *
 * @param fault The throwable the program terminated with, or {@code null} if it returned normally.
 */
public record ExecutionResult(Throwable fault) {

    public static ExecutionResult completed() {
        return new ExecutionResult(null);
    }

    public static ExecutionResult faulted(Throwable fault) {
        return new ExecutionResult(fault);
    }

    public boolean isFaulted() {
        return fault != null;
    }
}
