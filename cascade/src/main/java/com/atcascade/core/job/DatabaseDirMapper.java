package com.atcascade.core.job;

import com.atcascade.core.ConfigurationException;
import com.atcascade.core.IntegrityException;
import com.atcascade.core.hierarchy.NodeHierarchy;
import com.atcascade.core.hierarchy.SplitReferenceTable;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps a (fit node, split reference) pair to the directory, relative to the
 * result directory, that holds its fit database.
 *
 * <p>Each directory segment is a node name except where the path crosses a
 * split: there the split name is inserted after the split node. For nodes
 * n0 -> n1 -> n3 with split node n1 the pair (n3, female) maps to
 * {@code n0/n1/female/n3}.
 */
public class DatabaseDirMapper {

    public static final String DATABASE_FILE_NAME = "dismod.db";

    private final CascadeInputs inputs;

    public DatabaseDirMapper(CascadeInputs inputs) {
        this.inputs = inputs;
    }

    public static String getDatabaseDir(NodeHierarchy hierarchy,
                                        SplitReferenceTable splitTable,
                                        Set<Integer> splitNodeSet,
                                        int rootNodeId,
                                        Integer rootSplitReferenceId,
                                        int fitNodeId,
                                        Integer fitSplitReferenceId) {
        if (!hierarchy.isAncestorOrSelf(rootNodeId, fitNodeId)) {
            throw new ConfigurationException(hierarchy.nameOf(fitNodeId)
                    + " is not a descendant of the root node " + hierarchy.nameOf(rootNodeId));
        }
        Deque<String> segments = new ArrayDeque<>();
        int nodeId = fitNodeId;
        Integer splitId = fitSplitReferenceId;
        while (nodeId != rootNodeId) {
            if (!Objects.equals(splitId, rootSplitReferenceId) && splitNodeSet.contains(nodeId)) {
                segments.addFirst(splitTable.nameOf(fitSplitReferenceId));
                splitId = rootSplitReferenceId;
            } else {
                segments.addFirst(hierarchy.nameOf(nodeId));
                nodeId = hierarchy.parentOf(nodeId);
            }
        }
        if (!Objects.equals(splitId, rootSplitReferenceId) && splitNodeSet.contains(rootNodeId)) {
            segments.addFirst(splitTable.nameOf(fitSplitReferenceId));
        }
        segments.addFirst(hierarchy.nameOf(rootNodeId));
        return String.join("/", segments);
    }

    public String databaseDir(int fitNodeId, Integer fitSplitReferenceId) {
        return getDatabaseDir(inputs.getHierarchy(), inputs.getSplitTable(), inputs.getSplitNodeSet(),
                inputs.getRootNodeId(), inputs.getRootSplitReferenceId(), fitNodeId, fitSplitReferenceId);
    }

    public String databaseDir(Job job) {
        return databaseDir(job.getFitNodeId(), job.getSplitReferenceId());
    }

    public Path jobDirectory(Path resultDir, Job job) {
        return resultDir.resolve(databaseDir(job));
    }

    public Path databasePath(Path resultDir, Job job) {
        return jobDirectory(resultDir, job).resolve(DATABASE_FILE_NAME);
    }

    /**
     * Fails if two jobs of the table would share a directory, which would let
     * concurrent fits overwrite each other.
     */
    public void checkDistinct(JobTable jobTable) {
        Map<String, Job> byDir = new HashMap<>();
        for (Job job : jobTable.jobs()) {
            String dir = databaseDir(job);
            Job other = byDir.put(dir, job);
            if (other != null) {
                throw new IntegrityException("jobs " + other.getJobName() + " and " + job.getJobName()
                        + " both map to database directory " + dir);
            }
        }
    }
}
