package com.atcascade.core.service;

import com.atcascade.core.CascadeFixtures;
import com.atcascade.core.ConfigurationException;
import com.atcascade.core.IntegrityException;
import com.atcascade.core.InvalidGoalSetException;
import com.atcascade.core.ScriptedFitEngine;
import com.atcascade.core.config.CascadeConfig;
import com.atcascade.core.driver.CascadeReport;
import com.atcascade.core.driver.JobOutcome;
import com.atcascade.core.driver.JobReport;
import com.atcascade.core.driver.JobState;
import com.atcascade.core.engine.EngineResult;
import com.atcascade.core.job.JobTable;
import com.atcascade.core.log.JobLogStatus;
import com.atcascade.core.log.LogMessages;
import com.atcascade.core.predict.PredictOutcome;
import com.atcascade.core.predict.PredictResult;
import com.atcascade.db.JobTableDao;
import com.atcascade.db.LogTableDao;
import com.atcascade.db.SqliteInitializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CascadeServiceTest {

    @TempDir
    Path dir;

    private Path resultDir;
    private CascadeConfig config;
    private ScriptedFitEngine engine;
    private CascadeService service;

    @BeforeEach
    public void setup() throws Exception {
        resultDir = dir.resolve("results");
        Path rootDb = dir.resolve("root.db");
        SqliteInitializer.initializeLog(rootDb.toString());

        config = new CascadeConfig();
        config.resultDir = resultDir.toString();
        config.rootDatabase = rootDb.toString();
        config.rootNodeName = "n0";
        config.rootSplitReferenceName = "both";
        config.nodes = List.of(
                new CascadeConfig.NodeConfig("n0", null),
                new CascadeConfig.NodeConfig("n1", "n0"),
                new CascadeConfig.NodeConfig("n2", "n0"),
                new CascadeConfig.NodeConfig("n3", "n1"),
                new CascadeConfig.NodeConfig("n4", "n1"),
                new CascadeConfig.NodeConfig("n5", "n2"),
                new CascadeConfig.NodeConfig("n6", "n2"));
        config.splitReferences = List.of(
                new CascadeConfig.SplitReferenceConfig("female", -0.5),
                new CascadeConfig.SplitReferenceConfig("both", 0.0),
                new CascadeConfig.SplitReferenceConfig("male", 0.5));
        config.nodeSplit = List.of("n1");
        config.fitGoal = List.of("n3", "n4", "n5", "n6");
        config.maxNumberCpu = 2;
        config.refitSplit = true;

        engine = new ScriptedFitEngine();
        service = new CascadeService(engineConfig -> engine);
    }

    private LogTableDao log(String databaseDir) {
        return new LogTableDao(resultDir.resolve(databaseDir).resolve("dismod.db").toString());
    }

    @Test
    public void testSetupAndDisplay() {
        service.setup(config);
        assertTrue(Files.exists(resultDir.resolve(CascadeService.ALL_NODE_DB)));

        // later commands read the stored inputs, not the configuration file
        config.fitGoal = List.of("n3");
        List<String> lines = service.display(config);

        assertEquals(12, lines.size());
        assertTrue(lines.get(0).startsWith("job_id"));
        assertTrue(lines.get(11).contains("n4.male"));
        assertTrue(lines.get(11).contains("n1.male"));
        assertTrue(lines.get(11).endsWith("n0/n1/male/n4"));
    }

    @Test
    public void testSetupRejectsNestedGoals() {
        config.fitGoal = List.of("n1", "n3");
        assertThrows(InvalidGoalSetException.class, () -> service.setup(config));
        assertFalse(Files.exists(resultDir.resolve(CascadeService.ALL_NODE_DB)));
    }

    @Test
    public void testCommandsNeedSetup() {
        assertThrows(ConfigurationException.class, () -> service.drill(config, null));
        assertThrows(ConfigurationException.class, () -> service.summary(config));
    }

    @Test
    public void testDrill() throws Exception {
        service.setup(config);
        CascadeReport report = service.drill(config, null);

        assertEquals(11, report.getDoneCount());
        assertEquals(11, engine.getFittedDatabases().size());
        assertTrue(new JobTableDao(resultDir.resolve(CascadeService.ALL_NODE_DB).toString()).load().isPresent());
        for (JobSummary row : service.summary(config)) {
            assertEquals(JobLogStatus.DONE, row.getStatus(), row.getJob().getJobName());
            assertTrue(row.getErrors().isEmpty());
        }
        assertTrue(log("n0/n1/female/n3").containsMessage(LogMessages.FIT_OK));
        assertTrue(Files.exists(resultDir.resolve("n0/n2/n6/dismod.db")));
    }

    @Test
    public void testDrillRefusesExistingResults() throws Exception {
        service.setup(config);
        service.drill(config, null);

        assertThrows(ConfigurationException.class, () -> service.drill(config, null));

        assertTrue(service.cleanup(config));
        assertFalse(Files.exists(resultDir.resolve("n0")));
        assertFalse(service.cleanup(config));
        assertEquals(11, service.drill(config, null).getDoneCount());
    }

    @Test
    public void testContinueAfterFailure() throws Exception {
        Path failing = Paths.get("n1", "female");
        engine.setFitScript((db, mode) ->
                db.getParent().endsWith(failing) ? EngineResult.exitStatus(1) : EngineResult.ok());
        service.setup(config);

        CascadeReport first = service.drill(config, null);

        assertEquals(JobState.FAILED, first.find(3).orElseThrow().getState());
        assertEquals(JobState.SKIPPED, first.find(7).orElseThrow().getState());
        assertEquals(JobState.SKIPPED, first.find(8).orElseThrow().getState());
        assertEquals(8, first.getDoneCount());
        List<JobSummary> summary = service.summary(config);
        assertEquals(JobLogStatus.ERROR, summary.get(3).getStatus());
        assertEquals(2, summary.get(3).getErrors().size());
        assertEquals(JobLogStatus.MISSING, summary.get(7).getStatus());

        engine.setFitScript((db, mode) -> EngineResult.ok());
        assertThrows(ConfigurationException.class, () -> service.continueCascade(config, "n1.female", null, null));

        CascadeReport second = service.continueCascade(config, "n1.both", null, null);

        assertEquals(7, second.getJobs().size());
        assertEquals(7, second.getDoneCount());
        assertEquals(JobOutcome.DONE, second.find(3).orElseThrow().getOutcome());
        assertEquals(JobOutcome.ALREADY_DONE, second.find(4).orElseThrow().getOutcome());
        assertEquals(JobOutcome.ALREADY_DONE, second.find(9).orElseThrow().getOutcome());
        assertEquals(JobOutcome.DONE, second.find(7).orElseThrow().getOutcome());
        for (JobSummary row : service.summary(config)) {
            assertEquals(JobLogStatus.DONE, row.getStatus(), row.getJob().getJobName());
        }
    }

    @Test
    public void testContinueByDatabase() throws Exception {
        service.setup(config);
        service.drill(config, null);

        CascadeReport report = service.continueCascade(config, null, "n0/n1/female/dismod.db", null);

        assertEquals(3, report.getJobs().size());
        for (JobReport job : report.getJobs()) {
            assertEquals(JobOutcome.ALREADY_DONE, job.getOutcome());
        }
        assertThrows(ConfigurationException.class,
                () -> service.continueCascade(config, null, "n0/n7/dismod.db", null));
        assertThrows(ConfigurationException.class,
                () -> service.continueCascade(config, "n1.both", "n0/n1/dismod.db", null));
    }

    @Test
    public void testContinueWritesMissingChildren() throws Exception {
        service.setup(config);
        service.drill(config, null);
        // as if the run stopped between the fit of n1.both and its children
        LogTableDao n1 = log("n0/n1");
        n1.reset();
        n1.addMessage(LogMessages.FIT_OK);

        CascadeReport report = service.continueCascade(config, "n1.both", null, null);

        assertEquals(7, report.getDoneCount());
        assertEquals(11 + 6, engine.getFittedDatabases().size());
        assertTrue(n1.containsMessage(LogMessages.CHILDREN_OK));
    }

    @Test
    public void testContinueDetectsChangedJobTable() throws Exception {
        service.setup(config);
        service.drill(config, null);
        JobTable other = CascadeFixtures.splitAtN1(false, 1).buildJobTable();
        JobTable shorter = new JobTable(other.jobs().subList(0, 7));
        new JobTableDao(resultDir.resolve(CascadeService.ALL_NODE_DB).toString()).save(shorter);

        assertThrows(IntegrityException.class, () -> service.continueCascade(config, "n1.both", null, null));
    }

    @Test
    public void testPredict() throws Exception {
        service.setup(config);
        service.drill(config, null);

        List<PredictResult> depthOne = service.predict(config, null, 1);
        assertEquals(3, depthOne.size());
        for (PredictResult result : depthOne) {
            assertEquals(PredictOutcome.PREDICTED, result.getOutcome());
        }

        List<PredictResult> belowN1 = service.predict(config, "n1.both", null);
        assertEquals(7, belowN1.size());
        assertTrue(Files.isDirectory(resultDir.resolve("n0/n1/male/n4/predict")));

        assertThrows(ConfigurationException.class, () -> service.predict(config, "n9.both", null));
        assertThrows(ConfigurationException.class, () -> service.predict(config, null, -1));
    }
}
