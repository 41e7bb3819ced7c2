package com.atcascade.core.driver;

import com.atcascade.core.engine.EngineResult;
import com.atcascade.core.engine.FitEngine;
import com.atcascade.core.engine.FitMode;
import com.atcascade.core.job.DatabaseDirMapper;
import com.atcascade.core.job.Job;
import com.atcascade.core.log.LogMessages;
import com.atcascade.core.log.LogScanner;
import com.atcascade.db.LogTableDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

/**
 * Fits one job's database, trying each fit mode in turn, then writes the
 * databases of the job's children.
 */
public class FitJobRunner implements JobRunner {

    private static final Logger logger = LoggerFactory.getLogger(FitJobRunner.class);

    private final DatabaseDirMapper mapper;
    private final Path resultDir;
    private final FitEngine engine;
    private final LogScanner logScanner;
    private final ChildDatabaseWriter childWriter;
    private final List<FitMode> fitModes;

    public FitJobRunner(DatabaseDirMapper mapper,
                        Path resultDir,
                        FitEngine engine,
                        LogScanner logScanner,
                        ChildDatabaseWriter childWriter,
                        List<FitMode> fitModes) {
        if (fitModes.isEmpty()) {
            throw new IllegalArgumentException("at least one fit mode is required");
        }
        this.mapper = mapper;
        this.resultDir = resultDir;
        this.engine = engine;
        this.logScanner = logScanner;
        this.childWriter = childWriter;
        this.fitModes = List.copyOf(fitModes);
    }

    @Override
    public JobResult run(Job job) throws InterruptedException {
        Path database = mapper.databasePath(resultDir, job);
        if (!Files.exists(database)) {
            return new JobResult(JobOutcome.MISSING_INPUT, "missing " + database);
        }
        try {
            LogTableDao log = new LogTableDao(database.toString());
            if (log.containsMessage(LogMessages.CHILDREN_OK)) {
                return new JobResult(JobOutcome.ALREADY_DONE, "children already written");
            }
            log.reset();

            FitMode fitted = null;
            for (FitMode mode : fitModes) {
                EngineResult result = engine.fit(database, mode);
                if (result.isSuccess()) {
                    log.addMessage(LogMessages.FIT_OK);
                    fitted = mode;
                    break;
                }
                log.addError(LogMessages.fitError(mode.label(), result.getMessage()));
                logger.warn("{}: fit {} failed, {}", job.getJobName(), mode.label(), result.getMessage());
            }
            if (fitted == null) {
                return new JobResult(JobOutcome.ENGINE_FAILURE, "every fit type failed");
            }
            if (logScanner.hasTwoErrors(job)) {
                return new JobResult(JobOutcome.ENGINE_FAILURE, "more than one error in the log");
            }
            childWriter.writeChildren(job);
            return JobResult.done("fit " + fitted.label());
        } catch (IOException | SQLException e) {
            logger.error("{}: failed to prepare or record the fit", job.getJobName(), e);
            return new JobResult(JobOutcome.EXECUTION_ERROR, e.toString());
        }
    }
}
