package org.veridrive.driver;

import org.veridrive.driver.api.ExitStatus;
import org.veridrive.driver.api.PipelineOutcome;
import org.veridrive.driver.api.PipelineStatistics;
import org.veridrive.driver.codegen.CodeGenResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The record of one base-case pipeline invocation, i.e. one program checked as a whole.
 *
 * @param files            The program files.
 * @param programName      The name the program was checked under.
 * @param status           The status of this invocation alone.
 * @param outcome          The aggregate outcome, or {@code null} if verification did not run.
 * @param statisticsByUnit Statistics per unit; empty if verification did not run.
 * @param codeGen          What code generation did, or {@code null} if it was not reached.
 */
public record InvocationResult(
        List<String> files,
        String programName,
        ExitStatus status,
        PipelineOutcome outcome,
        Map<String, PipelineStatistics> statisticsByUnit,
        CodeGenResult.Tag codeGen
) {
    public InvocationResult {
        files = List.copyOf(files);
        statisticsByUnit = statisticsByUnit != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(statisticsByUnit))
                : Map.of();
    }

    public PipelineStatistics totalStatistics() {
        return PipelineStatistics.sum(statisticsByUnit.values());
    }
}
