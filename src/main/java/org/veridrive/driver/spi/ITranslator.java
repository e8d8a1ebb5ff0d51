package org.veridrive.driver.spi;

import org.veridrive.driver.api.IProgram;
import org.veridrive.driver.api.VcUnit;

import java.util.List;

/**
 * Lowers a checked program to verification-condition units, one per verifiable module.
 */
public interface ITranslator {

    /**
     * @return how many modules of the program are verifiable, i.e. how many units {@link #translate} yields.
     */
    int verifiableModuleCount(IProgram program);

    /**
     * Lowers the program.
     *
     * @param program The checked program.
     * @return the units in module order; empty if there is nothing to verify.
     */
    List<VcUnit> translate(IProgram program);
}
