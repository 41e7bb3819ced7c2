package com.atcascade.core.engine;

import com.atcascade.core.ConfigurationException;
import com.atcascade.core.config.CascadeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FitEngineFactory {

    private static final Logger logger = LoggerFactory.getLogger(FitEngineFactory.class);

    public static FitEngine create(CascadeConfig.EngineConfig config) {
        String type = (config != null && config.type != null) ? config.type : "process";

        if (type.trim().isEmpty()) {
            logger.warn("Engine type not specified, defaulting to 'process'");
            type = "process";
        }

        switch (type.toLowerCase()) {
            case "process":
                return process(config);
            case "dry_run":
            case "dry-run":
                return new DryRunFitEngine();
            default:
                throw new ConfigurationException("Unknown engine type '" + type
                        + "', expected process or dry_run");
        }
    }

    private static FitEngine process(CascadeConfig.EngineConfig config) {
        if (config == null || config.fitCommand == null || config.fitCommand.isEmpty()) {
            throw new ConfigurationException("engine.fitCommand is required for the process engine");
        }
        if (config.timeoutSeconds <= 0) {
            throw new ConfigurationException("engine.timeoutSeconds must be positive, found "
                    + config.timeoutSeconds);
        }
        return new ProcessFitEngine(config.fitCommand, config.predictCommand, config.timeoutSeconds);
    }
}
