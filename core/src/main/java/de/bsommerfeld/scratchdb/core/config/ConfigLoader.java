package de.bsommerfeld.scratchdb.core.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the merged configuration tree. Precedence, highest first:
 * <ol>
 * <li>environment variables</li>
 * <li>system properties ({@code -Dscratchdb.session.query-timeout=10s})</li>
 * <li>{@code scratchdb.conf} in the working directory, if present</li>
 * <li>{@code reference.conf} defaults on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "scratchdb.conf";

    private ConfigLoader() {
    }

    /** Loads from the working directory's {@code scratchdb.conf}. */
    public static ScratchDbConfig load() {
        return load(Path.of(CONFIG_FILE_NAME));
    }

    /**
     * Loads using the given file as the file-based layer. A missing file is
     * skipped, not an error.
     */
    public static ScratchDbConfig load(Path configFile) {
        Config fileConfig;
        if (Files.isRegularFile(configFile)) {
            LOG.info("Loading configuration from file: {}", configFile.toAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile.toFile());
        } else {
            LOG.info("Configuration file '{}' not found. Using defaults.", configFile);
            fileConfig = ConfigFactory.empty();
        }

        Config merged = ConfigFactory.systemEnvironment()
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();

        return ScratchDbConfig.from(merged.getConfig("scratchdb"));
    }
}
