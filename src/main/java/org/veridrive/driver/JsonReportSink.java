package org.veridrive.driver;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.veridrive.driver.api.ExitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a machine-readable JSON report of a run. The file is opened before the pipeline starts so
 * that an unwritable location is detected up front.
 */
public final class JsonReportSink implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(JsonReportSink.class);

    private final Path file;
    private final Writer writer;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    private JsonReportSink(Path file, Writer writer) {
        this.file = file;
        this.writer = writer;
    }

    /**
     * Opens (and truncates) the report file.
     *
     * @param file the report location.
     * @return the sink.
     * @throws IOException if the file cannot be created.
     */
    public static JsonReportSink open(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new JsonReportSink(file, Files.newBufferedWriter(file, StandardCharsets.UTF_8));
    }

    /**
     * Writes the report.
     *
     * @param result   The run result.
     * @param exitCode The process exit code derived from it.
     * @throws IOException if writing fails.
     */
    public void write(PipelineResult result, int exitCode) throws IOException {
        Report report = new Report(result.exitStatus(), exitCode, result.invocations());
        gson.toJson(report, writer);
        writer.flush();
        LOG.debug("Wrote run report to {}", file);
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }

    record Report(ExitStatus exitStatus, int exitCode, List<InvocationResult> invocations) {
    }
}
