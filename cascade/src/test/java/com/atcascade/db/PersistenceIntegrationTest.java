package com.atcascade.db;

import com.atcascade.core.CascadeFixtures;
import com.atcascade.core.ConfigurationException;
import com.atcascade.core.hierarchy.SplitReferenceTable;
import com.atcascade.core.job.CascadeInputs;
import com.atcascade.core.job.JobTable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class PersistenceIntegrationTest {

    @TempDir
    Path dir;

    private String allNodeDb;
    private AllNodeDao allNodeDao;
    private JobTableDao jobTableDao;

    @BeforeEach
    public void setup() throws SQLException {
        allNodeDb = dir.resolve("all_node.db").toString();
        SqliteInitializer.initializeAllNode(allNodeDb);
        allNodeDao = new AllNodeDao(allNodeDb);
        jobTableDao = new JobTableDao(allNodeDb);
    }

    @Test
    public void testInputsRoundTrip() throws SQLException {
        CascadeInputs inputs = new CascadeInputs(CascadeFixtures.sevenNodes(), CascadeFixtures.sexSplit(),
                CascadeFixtures.ids(1), 0, 1, CascadeFixtures.ids(3, 4, 5, 6), true, 3, List.of("fixed"));
        allNodeDao.writeInputs(inputs);

        CascadeInputs loaded = allNodeDao.loadInputs();
        Assertions.assertEquals(7, loaded.getHierarchy().size());
        Assertions.assertEquals(1, loaded.getHierarchy().parentOf(4));
        Assertions.assertEquals("male", loaded.getSplitTable().nameOf(2));
        Assertions.assertEquals(0.5, loaded.getSplitTable().get(2).getValue(), 1e-12);
        Assertions.assertEquals(1, loaded.getRootSplitReferenceId());
        Assertions.assertEquals(Set.of(1), loaded.getSplitNodeSet());
        Assertions.assertEquals(Set.of(3, 4, 5, 6), loaded.getGoalSet());
        Assertions.assertTrue(loaded.isRefitSplit());
        Assertions.assertEquals(3, loaded.getMaxNumberCpu());
        Assertions.assertEquals(List.of("fixed"), loaded.getFitTypeList());
        Assertions.assertEquals(inputs.buildJobTable(), loaded.buildJobTable());

        Map<String, String> options = allNodeDao.loadOptions();
        Assertions.assertEquals("n0", options.get(AllNodeDao.OPTION_ROOT_NODE_NAME));
        Assertions.assertEquals("both", options.get(AllNodeDao.OPTION_ROOT_SPLIT_REFERENCE_NAME));
    }

    @Test
    public void testInputsWithoutSplit() throws SQLException {
        CascadeInputs inputs = new CascadeInputs(CascadeFixtures.chain(4), SplitReferenceTable.empty(),
                Set.of(), 0, null, CascadeFixtures.ids(3), false, 1, null);
        allNodeDao.writeInputs(inputs);
        // writing twice replaces the rows
        allNodeDao.writeInputs(inputs);

        CascadeInputs loaded = allNodeDao.loadInputs();
        Assertions.assertTrue(loaded.getSplitTable().isEmpty());
        Assertions.assertNull(loaded.getRootSplitReferenceId());
        Assertions.assertEquals(4, loaded.buildJobTable().size());
        Assertions.assertEquals(List.of("both", "fixed"), loaded.getFitTypeList());
    }

    @Test
    public void testNotAnAllNodeDatabase() {
        AllNodeDao empty = new AllNodeDao(dir.resolve("other.db").toString());
        Assertions.assertThrows(ConfigurationException.class, empty::loadInputs);
    }

    @Test
    public void testJobTableRoundTrip() throws SQLException {
        Assertions.assertFalse(jobTableDao.load().isPresent());

        JobTable table = CascadeFixtures.splitAtN1(false, 1).buildJobTable();
        jobTableDao.save(table);
        Optional<JobTable> loaded = jobTableDao.load();
        Assertions.assertTrue(loaded.isPresent());
        Assertions.assertEquals(table, loaded.get());
        Assertions.assertNull(loaded.get().get(0).getParentJobId());

        JobTable chain = new CascadeInputs(CascadeFixtures.chain(2), SplitReferenceTable.empty(), Set.of(),
                0, null, CascadeFixtures.ids(1), false, 1, null).buildJobTable();
        jobTableDao.save(chain);
        Assertions.assertEquals(chain, jobTableDao.load().get());
        Assertions.assertNull(jobTableDao.load().get().get(1).getSplitReferenceId());
    }

    @Test
    public void testLogTable() throws SQLException {
        LogTableDao log = new LogTableDao(dir.resolve("dismod.db").toString());
        Assertions.assertTrue(log.entries().isEmpty());
        Assertions.assertFalse(log.containsMessage("fit: OK"));

        log.addMessage("parent: n0");
        log.addError("fit both: error: exit status 1");
        log.addMessage("fit: OK");

        List<LogEntry> entries = log.entries();
        Assertions.assertEquals(3, entries.size());
        Assertions.assertEquals(LogEntry.TYPE_CASCADE, entries.get(0).getMessageType());
        Assertions.assertTrue(entries.get(1).isError());
        Assertions.assertTrue(entries.get(0).getLogId() < entries.get(2).getLogId());
        Assertions.assertTrue(entries.get(2).getUnixTime() > 0);
        Assertions.assertTrue(log.containsMessage("fit: OK"));

        log.reset();
        Assertions.assertTrue(log.entries().isEmpty());
    }
}
