package org.veridrive.driver.spi;

import com.typesafe.config.Config;
import org.veridrive.driver.api.ToolchainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Locates the {@link IToolchainProvider} to use for a run.
 */
public final class ToolchainLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ToolchainLoader.class);
    static final String TOOLCHAIN_KEY = "veridrive.toolchain";

    private ToolchainLoader() {}

    /**
     * Loads the provider named by {@code veridrive.toolchain}, or the first one on the class path
     * when the key is empty, and creates its toolchain.
     *
     * @param config The resolved application configuration.
     * @return the toolchain.
     * @throws ToolchainException if no (matching) provider is registered.
     */
    public static Toolchain load(Config config) throws ToolchainException {
        return load(config, ServiceLoader.load(IToolchainProvider.class));
    }

    static Toolchain load(Config config, Iterable<IToolchainProvider> providers) throws ToolchainException {
        final String wanted = config.hasPath(TOOLCHAIN_KEY) ? config.getString(TOOLCHAIN_KEY).trim() : "";
        final List<IToolchainProvider> available = new ArrayList<>();
        providers.forEach(available::add);

        if (available.isEmpty()) {
            throw new ToolchainException("No toolchain provider found on the class path");
        }
        for (IToolchainProvider provider : available) {
            if (wanted.isEmpty() || wanted.equals(provider.name())) {
                LOG.debug("Using toolchain provider '{}'", provider.name());
                return provider.create(config);
            }
        }
        throw new ToolchainException("Toolchain '" + wanted + "' not found; available: "
                + available.stream().map(IToolchainProvider::name).collect(Collectors.joining(", ")));
    }
}
