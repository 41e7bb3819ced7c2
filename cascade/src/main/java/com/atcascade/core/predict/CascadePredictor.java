package com.atcascade.core.predict;

import com.atcascade.core.engine.EngineResult;
import com.atcascade.core.engine.FitEngine;
import com.atcascade.core.job.DatabaseDirMapper;
import com.atcascade.core.job.Job;
import com.atcascade.core.job.JobRelations;
import com.atcascade.core.job.JobTable;
import com.atcascade.core.log.LogScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Predicts for every job within a number of generations of a start job,
 * using each job's own fit or, failing that, its nearest fitted ancestor.
 */
public class CascadePredictor {

    private static final Logger logger = LoggerFactory.getLogger(CascadePredictor.class);

    public static final String PREDICT_DIR_NAME = "predict";

    private final JobRelations relations;
    private final DatabaseDirMapper mapper;
    private final Path resultDir;
    private final FitEngine engine;
    private final LogScanner logScanner;
    private final AncestorFit ancestorFit;
    private final int maxConcurrency;

    public CascadePredictor(JobRelations relations,
                            DatabaseDirMapper mapper,
                            Path resultDir,
                            FitEngine engine,
                            LogScanner logScanner,
                            int maxConcurrency) {
        this.relations = relations;
        this.mapper = mapper;
        this.resultDir = resultDir;
        this.engine = engine;
        this.logScanner = logScanner;
        this.ancestorFit = new AncestorFit(relations.getJobTable(), logScanner);
        this.maxConcurrency = maxConcurrency;
    }

    /** Start job and the descendants within {@code maxJobDepth} generations, increasing id. */
    public List<Job> select(int startJobId, Integer maxJobDepth) {
        JobTable jobTable = relations.getJobTable();
        List<Job> selected = new ArrayList<>();
        for (int jobId = startJobId; jobId < jobTable.size(); jobId++) {
            OptionalInt generation = relations.descendantGeneration(startJobId, jobId);
            if (generation.isPresent() && (maxJobDepth == null || generation.getAsInt() <= maxJobDepth)) {
                selected.add(jobTable.get(jobId));
            }
        }
        return selected;
    }

    /**
     * @param maxJobDepth null to predict for every descendant
     */
    public List<PredictResult> predict(int startJobId, Integer maxJobDepth) throws InterruptedException {
        List<Job> selected = select(startJobId, maxJobDepth);
        logger.info("Predicting {} jobs with {} workers", selected.size(), maxConcurrency);

        ExecutorService pool = Executors.newFixedThreadPool(maxConcurrency);
        List<PredictResult> results = new ArrayList<>(selected.size());
        try {
            List<Callable<PredictResult>> tasks = new ArrayList<>(selected.size());
            for (Job job : selected) {
                tasks.add(() -> predictOne(job));
            }
            for (Future<PredictResult> f : pool.invokeAll(tasks)) {
                results.add(f.get());
            }
        } catch (ExecutionException e) {
            // predictOne converts every failure to a result
            throw new IllegalStateException("predict worker failed unexpectedly", e.getCause());
        } finally {
            pool.shutdown();
            if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                pool.shutdownNow();
            }
        }
        long predicted = results.stream().filter(r -> r.getOutcome() == PredictOutcome.PREDICTED).count();
        logger.info("Predicted {} of {} jobs", predicted, results.size());
        return results;
    }

    PredictResult predictOne(Job job) {
        try {
            if (logScanner.hasTwoErrors(job)) {
                logger.warn("{}: skipping prediction, more than one error in the log", job.getJobName());
                return new PredictResult(job, PredictOutcome.ERROR, null, "two errors");
            }
            Job source = ancestorFit.find(job, true).orElse(null);
            if (source == null) {
                logger.warn("{}: no ancestor-or-self fit to predict from", job.getJobName());
                return new PredictResult(job, PredictOutcome.NO_FIT, null, null);
            }
            Path database = mapper.databasePath(resultDir, source);
            Path outputDir = mapper.jobDirectory(resultDir, job).resolve(PREDICT_DIR_NAME);
            EngineResult result = engine.predict(database, outputDir, job.getJobName());
            if (!result.isSuccess()) {
                return new PredictResult(job, PredictOutcome.ENGINE_FAILURE, source, result.getMessage());
            }
            return new PredictResult(job, PredictOutcome.PREDICTED, source, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new PredictResult(job, PredictOutcome.EXECUTION_ERROR, null, "interrupted");
        } catch (IOException | SQLException e) {
            logger.error("{}: prediction failed", job.getJobName(), e);
            return new PredictResult(job, PredictOutcome.EXECUTION_ERROR, null, e.toString());
        }
    }
}
