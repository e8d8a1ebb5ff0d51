package org.veridrive.driver.verify;

import org.veridrive.config.DriverOptions;
import org.veridrive.driver.api.IProgram;
import org.veridrive.driver.api.VcUnit;
import org.veridrive.driver.spi.IProofEngine;
import org.veridrive.driver.spi.ITranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Lowers a program to verification units and, when a dump file is configured, writes every unit
 * to disk. The file name gets a {@code _<unit>} suffix only when the program has more than one
 * verifiable module.
 */
public class VcTranslation {

    private static final Logger LOG = LoggerFactory.getLogger(VcTranslation.class);

    private final ITranslator translator;
    private final IProofEngine proofEngine;

    public VcTranslation(ITranslator translator, IProofEngine proofEngine) {
        this.translator = translator;
        this.proofEngine = proofEngine;
    }

    public List<VcUnit> translate(IProgram program, DriverOptions options) {
        int moduleCount = translator.verifiableModuleCount(program);
        List<VcUnit> units = translator.translate(program);
        LOG.debug("Translated {} into {} unit(s)", program.name(), units.size());

        Path printFile = options.printVcFile();
        if (printFile != null) {
            for (VcUnit unit : units) {
                Path target = moduleCount > 1 ? ArtifactNames.withUnitSuffix(printFile, unit.name()) : printFile;
                try {
                    proofEngine.printVcFile(target, unit.program(), options.prettyPrint());
                } catch (IOException e) {
                    LOG.warn("Could not write unit {} to {}: {}", unit.name(), target, e.getMessage());
                    program.diagnostics().reportWarning("Could not write verification unit: " + e.getMessage(),
                            target.toString(), 0);
                }
            }
        }
        return units;
    }
}
