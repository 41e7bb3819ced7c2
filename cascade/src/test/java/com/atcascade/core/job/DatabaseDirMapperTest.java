package com.atcascade.core.job;

import com.atcascade.core.CascadeFixtures;
import com.atcascade.core.ConfigurationException;
import com.atcascade.core.IntegrityException;
import com.atcascade.core.hierarchy.NodeHierarchy;
import com.atcascade.core.hierarchy.SplitReferenceTable;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.atcascade.core.CascadeFixtures.ids;
import static org.junit.jupiter.api.Assertions.*;

public class DatabaseDirMapperTest {

    private final NodeHierarchy h = CascadeFixtures.sevenNodes();
    private final SplitReferenceTable split = CascadeFixtures.sexSplit();
    private final Set<Integer> splitNodes = ids(1, 2);

    private String dir(int node, int splitId) {
        return DatabaseDirMapper.getDatabaseDir(h, split, splitNodes, 0, 1, node, splitId);
    }

    @Test
    public void testPaths() {
        assertEquals("n0", dir(0, 1));
        assertEquals("n0/n1", dir(1, 1));
        assertEquals("n0/n1/female", dir(1, 0));
        assertEquals("n0/n2/male/n5", dir(5, 2));
        assertEquals("n0/n2/n5", dir(5, 1));
        assertEquals("n0/n1/female/n3", dir(3, 0));
    }

    @Test
    public void testRootIsSplitNode() {
        String dir = DatabaseDirMapper.getDatabaseDir(h, split, ids(0), 0, 1, 2, 2);
        assertEquals("n0/male/n2", dir);
        assertEquals("n0/male", DatabaseDirMapper.getDatabaseDir(h, split, ids(0), 0, 1, 0, 2));
    }

    @Test
    public void testWithoutSplit() {
        String dir = DatabaseDirMapper.getDatabaseDir(h, SplitReferenceTable.empty(), Set.of(), 0, null, 6, null);
        assertEquals("n0/n2/n6", dir);
    }

    @Test
    public void testNotBelowRoot() {
        assertThrows(ConfigurationException.class,
                () -> DatabaseDirMapper.getDatabaseDir(h, split, splitNodes, 1, 1, 5, 1));
    }

    @Test
    public void testEveryJobHasItsOwnDirectory() {
        CascadeInputs inputs = CascadeFixtures.splitAtN1(false, 1);
        JobTable table = inputs.buildJobTable();
        DatabaseDirMapper mapper = new DatabaseDirMapper(inputs);
        mapper.checkDistinct(table);

        Set<String> dirs = new HashSet<>();
        for (Job job : table.jobs()) {
            assertTrue(dirs.add(mapper.databaseDir(job)));
        }
        Path resultDir = Paths.get("results");
        assertEquals(Paths.get("results", "n0", "n1", "male", "n4", "dismod.db"),
                mapper.databasePath(resultDir, table.get(10)));
    }

    @Test
    public void testSharedDirectoryIsRejected() {
        // n0 is not a split node, so n0.female would land in n0's own directory
        CascadeInputs inputs = CascadeFixtures.splitAtN1(false, 1);
        JobTable table = new JobTable(List.of(
                new Job(0, "n0.both", 0, 1, null),
                new Job(1, "n0.female", 0, 0, 0)));
        assertThrows(IntegrityException.class, () -> new DatabaseDirMapper(inputs).checkDistinct(table));
    }
}
