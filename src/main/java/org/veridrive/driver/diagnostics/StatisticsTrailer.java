package org.veridrive.driver.diagnostics;

import org.veridrive.driver.api.PipelineStatistics;

import java.io.PrintWriter;

/**
 * Formats the one-line verification summary printed after a unit or a whole file.
 */
public final class StatisticsTrailer {

    static final String TOOL_NAME = "veridrive verifier";

    private StatisticsTrailer() {}

    /**
     * Formats the trailer, e.g. {@code "veridrive verifier finished with 4 verified, 1 error, 2 time outs"}.
     * Zero inconclusive, time out and out-of-memory counts are omitted; cached counts are appended
     * only when any of them is non-zero.
     *
     * @param stats the statistics to summarize.
     * @return the trailer line.
     */
    public static String format(PipelineStatistics stats) {
        StringBuilder sb = new StringBuilder();
        sb.append(TOOL_NAME).append(" finished with ")
                .append(stats.verifiedCount()).append(" verified, ")
                .append(count(stats.errorCount(), "error"));
        if (stats.inconclusiveCount() > 0) {
            sb.append(", ").append(count(stats.inconclusiveCount(), "inconclusive"));
        }
        if (stats.timeoutCount() > 0) {
            sb.append(", ").append(count(stats.timeoutCount(), "time out"));
        }
        if (stats.outOfMemoryCount() > 0) {
            sb.append(", ").append(stats.outOfMemoryCount()).append(" out of memory");
        }
        if (stats.hasCachedResults()) {
            sb.append(" (cached: ")
                    .append(stats.cachedVerifiedCount()).append(" verified, ")
                    .append(count(stats.cachedErrorCount(), "error")).append(", ")
                    .append(count(stats.cachedInconclusiveCount(), "inconclusive")).append(", ")
                    .append(count(stats.cachedTimeoutCount(), "time out")).append(", ")
                    .append(stats.cachedOutOfMemoryCount()).append(" out of memory)");
        }
        return sb.toString();
    }

    /**
     * Writes the trailer preceded by an empty line.
     */
    public static void write(PrintWriter out, PipelineStatistics stats) {
        out.println();
        out.println(format(stats));
        out.flush();
    }

    private static String count(int n, String noun) {
        return n + " " + noun + (n == 1 ? "" : "s");
    }
}
