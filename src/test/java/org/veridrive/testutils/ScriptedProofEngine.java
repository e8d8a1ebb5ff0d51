package org.veridrive.testutils;

import org.veridrive.driver.api.IVcProgram;
import org.veridrive.driver.api.PipelineOutcome;
import org.veridrive.driver.api.VerificationResult;
import org.veridrive.driver.diagnostics.IDiagnosticsSink;
import org.veridrive.driver.diagnostics.SourceToken;
import org.veridrive.driver.spi.IProofEngine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A proof engine that replays the module scripts and records every call as
 * {@code "<step>:<unit>"}.
 */
public class ScriptedProofEngine implements IProofEngine {

    private final List<String> calls = new ArrayList<>();
    private final List<String> programIds = new ArrayList<>();
    private final Map<String, ModuleScript> seen = new HashMap<>();

    public List<String> calls() {
        return calls;
    }

    public List<String> programIds() {
        return programIds;
    }

    @Override
    public PipelineOutcome resolveAndTypecheck(IVcProgram program, String fileName, IDiagnosticsSink sink) {
        ModuleScript script = ((ScriptedVcProgram) program).script();
        seen.put(script.name(), script);
        calls.add("resolve:" + script.name());
        switch (script.outcome()) {
            case VERIFICATION_COMPLETED:
                return PipelineOutcome.RESOLVED_AND_TYPE_CHECKED;
            case RESOLUTION_ERROR:
            case TYPE_CHECKING_ERROR:
                sink.report(SourceToken.at(fileName, 3, 5), "malformed unit " + script.name(), true, null);
                return script.outcome();
            default:
                return script.outcome();
        }
    }

    @Override
    public void eliminateDeadVariables(IVcProgram program) {
        calls.add("eliminateDeadVariables:" + name(program));
    }

    @Override
    public void collectModSets(IVcProgram program) {
        calls.add("collectModSets:" + name(program));
    }

    @Override
    public void coalesceBlocks(IVcProgram program) {
        calls.add("coalesceBlocks:" + name(program));
    }

    @Override
    public void inline(IVcProgram program) {
        calls.add("inline:" + name(program));
    }

    @Override
    public VerificationResult inferAndVerify(IVcProgram program, String programId, IDiagnosticsSink sink) {
        ModuleScript script = ((ScriptedVcProgram) program).script();
        calls.add("verify:" + script.name());
        programIds.add(programId);
        if (script.statistics().errorCount() > 0) {
            sink.report(SourceToken.at(script.name() + ".vp", 1, 1), "assertion might not hold", true, null);
        }
        return VerificationResult.completed(script.statistics());
    }

    @Override
    public void printVcFile(Path file, IVcProgram program, boolean prettyPrint) throws IOException {
        calls.add("print:" + file.getFileName());
        Files.writeString(file, "unit " + name(program) + "\n", StandardCharsets.UTF_8);
    }

    @Override
    public Optional<IVcProgram> parseVcFiles(List<Path> files) throws IOException {
        calls.add("parse:" + files.get(0).getFileName());
        String text = Files.readString(files.get(0), StandardCharsets.UTF_8).trim();
        if (!text.startsWith("unit ")) {
            return Optional.empty();
        }
        ModuleScript script = seen.get(text.substring("unit ".length()));
        return script != null ? Optional.of(new ScriptedVcProgram(script)) : Optional.empty();
    }

    private static String name(IVcProgram program) {
        return ((ScriptedVcProgram) program).name();
    }
}
