package com.atcascade.util;

import com.atcascade.core.ConfigurationException;
import com.atcascade.core.config.CascadeConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CascadeConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(CascadeConfigLoader.class);

    public static final String CONFIG_PROPERTY = "cascade.config";
    public static final String CONFIG_RESOURCE = "/cascade_config.json";

    /**
     * Loads the configuration from, in order: the given file, the file named
     * by the {@code cascade.config} system property, the classpath resource
     * {@code /cascade_config.json}.
     */
    public static CascadeConfig load(String explicitPath) {
        // 1. Command option
        if (explicitPath != null && !explicitPath.isEmpty()) {
            return loadFile(Paths.get(explicitPath));
        }

        // 2. System Property
        String sysProp = System.getProperty(CONFIG_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return loadFile(Paths.get(sysProp));
        }

        // 3. Classpath
        try (InputStream is = CascadeConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                throw new ConfigurationException("no configuration: pass --config, set -D" + CONFIG_PROPERTY
                        + " or put " + CONFIG_RESOURCE + " on the classpath");
            }
            logger.info("Using configuration from classpath {}", CONFIG_RESOURCE);
            return new ObjectMapper().readValue(is, CascadeConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + CONFIG_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    public static CascadeConfig loadFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("configuration file " + path + " does not exist");
        }
        logger.info("Using configuration from {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return new ObjectMapper().readValue(is, CascadeConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }
}
