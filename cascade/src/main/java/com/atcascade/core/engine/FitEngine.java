package com.atcascade.core.engine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Boundary to the external program that fits and predicts a single job's
 * database. Implementations must be safe to call from several worker threads
 * at once on different databases.
 */
public interface FitEngine {
    /**
     * Fit the database in place; the fit results are written back into it.
     */
    EngineResult fit(Path database, FitMode mode) throws IOException, InterruptedException;

    /**
     * Predict for the named job from a fitted database into the output
     * directory.
     */
    EngineResult predict(Path database, Path outputDir, String target) throws IOException, InterruptedException;
}
