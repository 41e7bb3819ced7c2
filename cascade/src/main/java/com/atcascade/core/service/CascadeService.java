package com.atcascade.core.service;

import com.atcascade.core.ConfigurationException;
import com.atcascade.core.IntegrityException;
import com.atcascade.core.config.CascadeConfig;
import com.atcascade.core.config.CascadeConfigConverter;
import com.atcascade.core.driver.CascadeDriver;
import com.atcascade.core.driver.CascadeReport;
import com.atcascade.core.driver.ChildDatabaseWriter;
import com.atcascade.core.driver.FitJobRunner;
import com.atcascade.core.driver.JobStateListener;
import com.atcascade.core.engine.FitEngine;
import com.atcascade.core.engine.FitEngineFactory;
import com.atcascade.core.engine.FitMode;
import com.atcascade.core.job.CascadeInputs;
import com.atcascade.core.job.DatabaseDirMapper;
import com.atcascade.core.job.Job;
import com.atcascade.core.job.JobRelations;
import com.atcascade.core.job.JobTable;
import com.atcascade.core.log.DatabaseLogScanner;
import com.atcascade.core.log.JobLogStatus;
import com.atcascade.core.predict.CascadePredictor;
import com.atcascade.core.predict.PredictResult;
import com.atcascade.db.AllNodeDao;
import com.atcascade.db.JobTableDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The cascade commands. Every command after setup reads the cascade from the
 * all-node database rather than from the configuration file, so a changed
 * configuration cannot silently alter the job table of a cascade in progress.
 */
@Service
public class CascadeService {

    private static final Logger logger = LoggerFactory.getLogger(CascadeService.class);

    public static final String ALL_NODE_DB = "all_node.db";

    private final Function<CascadeConfig.EngineConfig, FitEngine> engineFactory;

    public CascadeService() {
        this(FitEngineFactory::create);
    }

    public CascadeService(Function<CascadeConfig.EngineConfig, FitEngine> engineFactory) {
        this.engineFactory = engineFactory;
    }

    public CascadeInputs setup(CascadeConfig config) {
        Path resultDir = resultDir(config);
        CascadeInputs inputs = CascadeConfigConverter.toInputs(config);
        JobTable jobTable = inputs.buildJobTable();
        new DatabaseDirMapper(inputs).checkDistinct(jobTable);
        try {
            Files.createDirectories(resultDir);
            Path allNode = resultDir.resolve(ALL_NODE_DB);
            Files.deleteIfExists(allNode);
            new AllNodeDao(allNode.toString()).writeInputs(inputs);
            logger.info("Wrote {} ({} nodes, {} jobs)", allNode, inputs.getHierarchy().size(), jobTable.size());
        } catch (IOException | SQLException e) {
            throw new RuntimeException("Failed to write the all-node database in " + resultDir, e);
        }
        return inputs;
    }

    /** Deletes the root node directory; false when there was nothing to delete. */
    public boolean cleanup(CascadeConfig config) {
        Path rootDir = resultDir(config).resolve(config.rootNodeName);
        if (!Files.exists(rootDir)) {
            logger.info("Nothing to clean up, {} does not exist", rootDir);
            return false;
        }
        try (Stream<Path> paths = Files.walk(rootDir)) {
            // children before their directory
            List<Path> all = paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path path : all) {
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete " + rootDir, e);
        }
        logger.info("Deleted {}", rootDir);
        return true;
    }

    public CascadeReport drill(CascadeConfig config, JobStateListener listener) throws InterruptedException {
        Cascade cascade = load(config);
        Job rootJob = cascade.jobTable.get(0);
        Path rootDir = cascade.resultDir.resolve(config.rootNodeName);
        if (Files.exists(rootDir)) {
            throw new ConfigurationException(rootDir + " already exists, run cleanup before drill");
        }
        if (config.rootDatabase == null || !Files.isRegularFile(Paths.get(config.rootDatabase))) {
            throw new ConfigurationException("root database " + config.rootDatabase + " does not exist");
        }
        try {
            Path rootDb = cascade.mapper.databasePath(cascade.resultDir, rootJob);
            Files.createDirectories(rootDb.getParent());
            Files.copy(Paths.get(config.rootDatabase), rootDb, StandardCopyOption.REPLACE_EXISTING);
            new JobTableDao(cascade.allNodeDb().toString()).save(cascade.jobTable);
        } catch (IOException | SQLException e) {
            throw new RuntimeException("Failed to prepare drill in " + cascade.resultDir, e);
        }
        return driver(cascade, config, listener).run(rootJob.getJobId(), false);
    }

    /**
     * Resumes below a job that already has a successful fit. Exactly one of
     * {@code jobName} and {@code database} is used.
     */
    public CascadeReport continueCascade(CascadeConfig config, String jobName, String database,
                                         JobStateListener listener) throws InterruptedException {
        Cascade cascade = load(config);
        checkStoredJobTable(cascade);
        Job job = findJob(cascade, jobName, database);
        try {
            JobLogStatus status = cascade.scanner.status(job);
            if (!status.hasFit()) {
                throw new ConfigurationException("cannot continue from " + job.getJobName()
                        + ": its log has no successful fit (status " + status + ")");
            }
            if (status != JobLogStatus.DONE) {
                logger.info("Writing the child databases of {} again", job.getJobName());
                new ChildDatabaseWriter(cascade.jobTable, cascade.mapper, cascade.resultDir).writeChildren(job);
            }
        } catch (IOException | SQLException e) {
            throw new RuntimeException("Failed to prepare continue from " + job.getJobName(), e);
        }
        return driver(cascade, config, listener).run(job.getJobId(), true);
    }

    public List<PredictResult> predict(CascadeConfig config, String startJobName, Integer maxJobDepth)
            throws InterruptedException {
        Cascade cascade = load(config);
        Job start = startJobName == null ? cascade.jobTable.get(0) : findJob(cascade, startJobName, null);
        if (maxJobDepth != null && maxJobDepth < 0) {
            throw new ConfigurationException("max job depth must not be negative, found " + maxJobDepth);
        }
        CascadePredictor predictor = new CascadePredictor(
                new JobRelations(cascade.jobTable, cascade.inputs.isRefitSplit()),
                cascade.mapper,
                cascade.resultDir,
                engineFactory.apply(config.engine),
                cascade.scanner,
                cascade.inputs.getMaxNumberCpu());
        return predictor.predict(start.getJobId(), maxJobDepth);
    }

    /** Job table rows: id, name, parent, database directory. */
    public List<String> display(CascadeConfig config) {
        Cascade cascade = load(config);
        List<String> lines = new ArrayList<>();
        lines.add(String.format("%-6s %-30s %-30s %s", "job_id", "job_name", "parent", "database_dir"));
        for (Job job : cascade.jobTable.jobs()) {
            Integer parentId = job.getParentJobId();
            String parent = parentId == null ? "" : cascade.jobTable.get(parentId).getJobName();
            lines.add(String.format("%-6d %-30s %-30s %s",
                    job.getJobId(), job.getJobName(), parent, cascade.mapper.databaseDir(job)));
        }
        return lines;
    }

    public List<JobSummary> summary(CascadeConfig config) {
        Cascade cascade = load(config);
        List<JobSummary> rows = new ArrayList<>();
        try {
            for (Job job : cascade.jobTable.jobs()) {
                rows.add(new JobSummary(job,
                        cascade.mapper.databaseDir(job),
                        cascade.scanner.status(job),
                        cascade.scanner.errorMessages(job)));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read job logs in " + cascade.resultDir, e);
        }
        return rows;
    }

    private CascadeDriver driver(Cascade cascade, CascadeConfig config, JobStateListener listener) {
        List<FitMode> fitModes = new ArrayList<>();
        for (String fitType : cascade.inputs.getFitTypeList()) {
            fitModes.add(FitMode.fromLabel(fitType));
        }
        FitJobRunner runner = new FitJobRunner(
                cascade.mapper,
                cascade.resultDir,
                engineFactory.apply(config.engine),
                cascade.scanner,
                new ChildDatabaseWriter(cascade.jobTable, cascade.mapper, cascade.resultDir),
                fitModes);
        return new CascadeDriver(cascade.jobTable, runner, cascade.inputs.getMaxNumberCpu(), listener);
    }

    private void checkStoredJobTable(Cascade cascade) {
        Optional<JobTable> stored;
        try {
            stored = new JobTableDao(cascade.allNodeDb().toString()).load();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read the stored job table", e);
        }
        if (stored.isPresent() && !stored.get().equals(cascade.jobTable)) {
            throw new IntegrityException("the job table stored by drill differs from the one rebuilt from "
                    + cascade.allNodeDb() + "; the cascade inputs changed after drill");
        }
    }

    private Job findJob(Cascade cascade, String jobName, String database) {
        if (jobName != null && database != null) {
            throw new ConfigurationException("give either a job name or a database, not both");
        }
        if (jobName != null) {
            return cascade.jobTable.findByName(jobName)
                    .orElseThrow(() -> new ConfigurationException("no job named " + jobName));
        }
        if (database == null) {
            throw new ConfigurationException("a job name or a database is required");
        }
        Path target = cascade.resultDir.resolve(database).toAbsolutePath().normalize();
        for (Job job : cascade.jobTable.jobs()) {
            Path path = cascade.mapper.databasePath(cascade.resultDir, job).toAbsolutePath().normalize();
            if (path.equals(target)) {
                return job;
            }
        }
        throw new ConfigurationException("database " + database + " does not belong to any job");
    }

    private Cascade load(CascadeConfig config) {
        Path resultDir = resultDir(config);
        Path allNode = resultDir.resolve(ALL_NODE_DB);
        if (!Files.isRegularFile(allNode)) {
            throw new ConfigurationException(allNode + " does not exist, run setup first");
        }
        CascadeInputs inputs;
        try {
            inputs = new AllNodeDao(allNode.toString()).loadInputs();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read " + allNode, e);
        }
        JobTable jobTable = inputs.buildJobTable();
        DatabaseDirMapper mapper = new DatabaseDirMapper(inputs);
        mapper.checkDistinct(jobTable);
        return new Cascade(resultDir, inputs, jobTable, mapper);
    }

    private static Path resultDir(CascadeConfig config) {
        if (config.resultDir == null || config.resultDir.isEmpty()) {
            throw new ConfigurationException("resultDir is required");
        }
        return Paths.get(config.resultDir);
    }

    private static class Cascade {
        final Path resultDir;
        final CascadeInputs inputs;
        final JobTable jobTable;
        final DatabaseDirMapper mapper;
        final DatabaseLogScanner scanner;

        Cascade(Path resultDir, CascadeInputs inputs, JobTable jobTable, DatabaseDirMapper mapper) {
            this.resultDir = resultDir;
            this.inputs = inputs;
            this.jobTable = jobTable;
            this.mapper = mapper;
            this.scanner = new DatabaseLogScanner(mapper, resultDir);
        }

        Path allNodeDb() {
            return resultDir.resolve(ALL_NODE_DB);
        }
    }
}
