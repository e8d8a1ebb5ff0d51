package org.veridrive.driver.verify;

import org.veridrive.driver.api.PipelineOutcome;
import org.veridrive.driver.api.PipelineStatistics;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The per-file verdict over all of its units.
 *
 * @param verified          {@code true} iff every unit is verified.
 * @param worstOutcome      The first non-completed outcome seen, see {@link ResultAggregator}.
 * @param statisticsByUnit  Statistics per unit name, in unit order.
 * @param elapsedByUnit     Time spent per unit name, in unit order.
 */
public record AggregateResult(
        boolean verified,
        PipelineOutcome worstOutcome,
        Map<String, PipelineStatistics> statisticsByUnit,
        Map<String, Duration> elapsedByUnit
) {
    public AggregateResult {
        statisticsByUnit = Collections.unmodifiableMap(new LinkedHashMap<>(statisticsByUnit));
        elapsedByUnit = Collections.unmodifiableMap(new LinkedHashMap<>(elapsedByUnit));
    }

    /**
     * @return the field-wise sum of all units' statistics.
     */
    public PipelineStatistics totalStatistics() {
        return PipelineStatistics.sum(statisticsByUnit.values());
    }
}
