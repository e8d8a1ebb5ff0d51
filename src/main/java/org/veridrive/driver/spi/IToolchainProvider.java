package org.veridrive.driver.spi;

import com.typesafe.config.Config;

/**
 * Service interface through which a language implementation plugs its front end, translator,
 * proof engine and generators into the driver. Implementations are discovered with
 * {@link java.util.ServiceLoader} and need a public no-argument constructor.
 */
public interface IToolchainProvider {

    /**
     * @return the name used to select this provider with {@code veridrive.toolchain}.
     */
    String name();

    /**
     * Creates the collaborators for one run.
     *
     * @param config The resolved application configuration.
     * @return the toolchain.
     */
    Toolchain create(Config config);
}
