package org.veridrive.driver.verify;

import org.veridrive.config.DriverOptions;
import org.veridrive.driver.api.PipelineOutcome;
import org.veridrive.driver.api.PipelineStatistics;
import org.veridrive.driver.api.VcUnit;
import org.veridrive.driver.diagnostics.StatisticsTrailer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verifies all units of one file in order and combines their results.
 * <p>
 * Every unit is run even after one fails, so statistics and diagnostics are complete. The file is
 * verified iff every unit is. The combined outcome starts at
 * {@link PipelineOutcome#VERIFICATION_COMPLETED}; while it is still completed or
 * {@link PipelineOutcome#DONE}, any unit outcome other than completed replaces it, so the first
 * failing unit decides. Note that this is the opposite direction of the file-level merge in
 * {@link org.veridrive.driver.api.ExitStatus#merge}, where the last distinct failure wins.
 */
public class ResultAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(ResultAggregator.class);

    private final VerificationRunner runner;
    private final PrintWriter out;
    private final DriverOptions options;

    public ResultAggregator(VerificationRunner runner, PrintWriter out, DriverOptions options) {
        this.runner = runner;
        this.out = out;
        this.options = options;
    }

    /**
     * Runs every unit through the {@link VerificationRunner} and aggregates the results.
     *
     * @param units        The units of one file, in translation order.
     * @param baseFileName The input file name artifacts are named after.
     * @param programId    The program id for result caching, or {@code null}.
     * @return the combined verdict.
     */
    public AggregateResult verifyAll(List<VcUnit> units, String baseFileName, String programId) {
        List<UnitResult> results = new ArrayList<>(units.size());
        for (VcUnit unit : units) {
            if (options.separateModuleOutput()) {
                out.println("For module: " + unit.name());
            }
            long start = System.nanoTime();
            UnitResult result = runner.runUnit(unit, baseFileName, programId)
                    .withElapsed(Duration.ofNanos(System.nanoTime() - start));
            if (options.separateModuleOutput()) {
                out.println("Elapsed time: " + formatElapsed(result.elapsed()));
                StatisticsTrailer.write(out, result.statistics());
            }
            LOG.debug("Unit '{}' finished with {} in {} ms", unit.name(), result.outcome(), result.elapsed().toMillis());
            results.add(result);
        }
        out.flush();
        return aggregate(results);
    }

    /**
     * Combines unit results.
     *
     * @param results The results in unit order.
     * @return the combined verdict.
     */
    public static AggregateResult aggregate(List<UnitResult> results) {
        boolean verified = true;
        PipelineOutcome outcome = PipelineOutcome.VERIFICATION_COMPLETED;
        Map<String, PipelineStatistics> statistics = new LinkedHashMap<>();
        Map<String, Duration> elapsed = new LinkedHashMap<>();

        for (UnitResult result : results) {
            verified = result.isVerified() && verified;
            if (outcome.allowsCodeGeneration() && result.outcome() != PipelineOutcome.VERIFICATION_COMPLETED) {
                outcome = result.outcome();
            }
            if (statistics.containsKey(result.unitName())) {
                LOG.warn("Duplicate unit name '{}'; statistics are summed", result.unitName());
            }
            statistics.merge(result.unitName(), result.statistics(), PipelineStatistics::plus);
            elapsed.merge(result.unitName(), result.elapsed(), Duration::plus);
        }
        return new AggregateResult(verified, outcome, statistics, elapsed);
    }

    static String formatElapsed(Duration duration) {
        return String.format("%02d:%02d:%02d", duration.toHours(), duration.toMinutesPart(), duration.toSecondsPart());
    }
}
