package com.atcascade.core.job;

import com.atcascade.core.AmbiguousSplitException;
import com.atcascade.core.ConfigurationException;
import com.atcascade.core.hierarchy.FitChildren;
import com.atcascade.core.hierarchy.NodeHierarchy;
import com.atcascade.core.hierarchy.SplitReferenceTable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the job table for a cascade starting at one (node, split reference)
 * pair.
 *
 * <p>Jobs are processed in increasing id order. A job at a split node that
 * still carries the root split has the other split values of the same node
 * as children; any other job has the fit children of its node, with the same
 * split, as children. Children are appended in that order, so the result is
 * a deterministic function of the inputs and parents always precede their
 * children.
 */
public final class JobTableBuilder {

    private JobTableBuilder() {
    }

    public static JobTable build(NodeHierarchy hierarchy,
                                 Set<Integer> splitNodeSet,
                                 SplitReferenceTable splitTable,
                                 int startNodeId,
                                 Integer startSplitReferenceId,
                                 Set<Integer> goalSet) {
        if (!hierarchy.contains(startNodeId)) {
            throw new ConfigurationException("start node id " + startNodeId + " is not in the node table");
        }
        if (!splitTable.isValidId(startSplitReferenceId)) {
            throw new ConfigurationException("start split reference id " + startSplitReferenceId
                    + " is not valid for a split reference table of size " + splitTable.size());
        }
        for (int nodeId : splitNodeSet) {
            if (!hierarchy.contains(nodeId)) {
                throw new ConfigurationException("split node id " + nodeId + " is not in the node table");
            }
        }
        if (!splitNodeSet.isEmpty() && splitTable.size() < 2) {
            throw new AmbiguousSplitException("split node set has " + splitNodeSet.size()
                    + " nodes but the split reference table has " + splitTable.size()
                    + " entries; at least 2 are needed to split");
        }
        FitChildren fitChildren = FitChildren.compute(hierarchy, startNodeId, goalSet);
        Integer rootSplit = splitTable.rootId();

        List<Job> jobs = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        append(jobs, seen, hierarchy, splitTable, startNodeId, startSplitReferenceId, null);

        for (int jobId = 0; jobId < jobs.size(); jobId++) {
            Job job = jobs.get(jobId);
            int nodeId = job.getFitNodeId();
            Integer splitId = job.getSplitReferenceId();
            if (splitNodeSet.contains(nodeId) && Objects.equals(splitId, rootSplit)) {
                for (int childSplit : splitTable.nonRootIds()) {
                    append(jobs, seen, hierarchy, splitTable, nodeId, childSplit, jobId);
                }
            } else {
                for (int childNode : fitChildren.of(nodeId)) {
                    append(jobs, seen, hierarchy, splitTable, childNode, splitId, jobId);
                }
            }
        }
        return new JobTable(jobs);
    }

    private static void append(List<Job> jobs,
                               Set<String> seen,
                               NodeHierarchy hierarchy,
                               SplitReferenceTable splitTable,
                               int nodeId,
                               Integer splitId,
                               Integer parentJobId) {
        if (!seen.add(nodeId + "/" + splitId)) {
            return;
        }
        jobs.add(new Job(jobs.size(), jobName(hierarchy, splitTable, nodeId, splitId), nodeId, splitId, parentJobId));
    }

    static String jobName(NodeHierarchy hierarchy, SplitReferenceTable splitTable, int nodeId, Integer splitId) {
        String name = hierarchy.nameOf(nodeId);
        if (splitTable.isEmpty()) {
            return name;
        }
        return name + "." + splitTable.nameOf(splitId);
    }
}
