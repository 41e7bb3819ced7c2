package com.atcascade.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Engine that reports success without fitting anything. Used to exercise the
 * job table, directories and logs of a cascade before the real engine is
 * available.
 */
public class DryRunFitEngine implements FitEngine {

    private static final Logger logger = LoggerFactory.getLogger(DryRunFitEngine.class);

    @Override
    public EngineResult fit(Path database, FitMode mode) {
        logger.info("Dry run: fit {} {}", mode.label(), database);
        return EngineResult.ok();
    }

    @Override
    public EngineResult predict(Path database, Path outputDir, String target) throws IOException {
        logger.info("Dry run: predict {} from {}", target, database);
        Files.createDirectories(outputDir);
        return EngineResult.ok();
    }
}
