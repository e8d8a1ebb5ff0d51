package org.veridrive.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs the pipeline on a dedicated thread with an explicit stack budget. Front ends and
 * translators recurse over program trees, which can exceed the default thread stack.
 */
public final class PipelineWorker {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineWorker.class);
    static final String THREAD_NAME = "veridrive-pipeline";

    private final long stackSize;

    /**
     * @param stackSize the requested stack size in bytes; the JVM may treat it as a hint.
     */
    public PipelineWorker(long stackSize) {
        if (stackSize <= 0) {
            throw new IllegalArgumentException("Stack size must be positive: " + stackSize);
        }
        this.stackSize = stackSize;
    }

    public long stackSize() {
        return stackSize;
    }

    /**
     * Runs the task on the worker thread and waits for it.
     *
     * @param task the task.
     * @param <T>  the result type.
     * @return the task's result.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     * @throws RuntimeException     rethrown unchanged if the task threw one.
     * @throws Error                rethrown unchanged if the task threw one.
     */
    public <T> T run(Supplier<T> task) throws InterruptedException {
        final AtomicReference<T> result = new AtomicReference<>();
        final AtomicReference<Throwable> failure = new AtomicReference<>();
        final Thread thread = new Thread(null, () -> {
            try {
                result.set(task.get());
            } catch (Throwable t) {
                failure.set(t);
            }
        }, THREAD_NAME, stackSize);

        LOG.debug("Starting pipeline thread with a stack of {} bytes", stackSize);
        thread.start();
        thread.join();

        final Throwable t = failure.get();
        if (t instanceof RuntimeException) {
            throw (RuntimeException) t;
        }
        if (t instanceof Error) {
            throw (Error) t;
        }
        if (t != null) {
            throw new IllegalStateException("Pipeline failed", t);
        }
        return result.get();
    }
}
