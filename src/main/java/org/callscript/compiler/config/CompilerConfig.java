package org.callscript.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the {@link Config} that {@link CompilerOptions#fromConfig(Config)} reads the
 * {@code callscript.compiler} settings from.
 */
public final class CompilerConfig {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerConfig.class);
    private static final String CONFIG_FILE_NAME = "callscript.conf";

    private CompilerConfig() {}

    /**
     * Loads the configuration with {@code callscript.conf} from the working directory.
     * Environment variables win over {@code -D} system properties, which win over the file,
     * which wins over {@code reference.conf}.
     *
     * @return The merged and resolved configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Same as {@link #load()}, with {@code configFile} in place of {@code callscript.conf}.
     *
     * @param configFile The file to read; skipped if it does not exist.
     * @return The merged and resolved configuration.
     */
    public static Config load(final File configFile) {
        return ConfigFactory.systemEnvironment()
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(parseIfPresent(configFile))
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    private static Config parseIfPresent(final File configFile) {
        if (!configFile.isFile()) {
            LOG.debug("No compiler configuration at '{}', using defaults.", configFile.getPath());
            return ConfigFactory.empty();
        }
        LOG.info("Reading compiler configuration from {}", configFile.getAbsolutePath());
        return ConfigFactory.parseFile(configFile);
    }
}
