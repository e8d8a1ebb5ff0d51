package org.veridrive.driver;

import org.veridrive.driver.api.ExitStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * The merged status of a pipeline run plus the individual invocations it consisted of. The merged
 * status keeps only the last distinct failure, so callers needing per-file detail read
 * {@link #invocations()}.
 *
 * @param exitStatus  The merged status.
 * @param invocations Every base-case invocation, in execution order.
 */
public record PipelineResult(ExitStatus exitStatus, List<InvocationResult> invocations) {

    public PipelineResult {
        invocations = List.copyOf(invocations);
    }

    static PipelineResult empty() {
        return new PipelineResult(ExitStatus.VERIFIED, List.of());
    }

    static PipelineResult of(InvocationResult invocation) {
        return new PipelineResult(invocation.status(), List.of(invocation));
    }

    /**
     * Folds the result of a later invocation into this one with {@link ExitStatus#merge}.
     */
    PipelineResult merge(PipelineResult next) {
        List<InvocationResult> all = new ArrayList<>(invocations);
        all.addAll(next.invocations);
        return new PipelineResult(ExitStatus.merge(exitStatus, next.exitStatus), all);
    }
}
