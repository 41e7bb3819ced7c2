package com.atcascade.core.job;

import com.atcascade.core.ConfigurationException;
import com.atcascade.core.hierarchy.NodeHierarchy;
import com.atcascade.core.hierarchy.SplitReferenceTable;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Everything that shapes a cascade's job table, as read back from the
 * all-node database. Passed explicitly to every component that needs it.
 */
public class CascadeInputs {

    public static final List<String> DEFAULT_FIT_TYPE_LIST = List.of("both", "fixed");

    private final NodeHierarchy hierarchy;
    private final SplitReferenceTable splitTable;
    private final Set<Integer> splitNodeSet;
    private final int rootNodeId;
    private final Integer rootSplitReferenceId;
    private final Set<Integer> goalSet;
    private final boolean refitSplit;
    private final int maxNumberCpu;
    private final List<String> fitTypeList;

    public CascadeInputs(NodeHierarchy hierarchy,
                         SplitReferenceTable splitTable,
                         Set<Integer> splitNodeSet,
                         int rootNodeId,
                         Integer rootSplitReferenceId,
                         Set<Integer> goalSet,
                         boolean refitSplit,
                         int maxNumberCpu,
                         List<String> fitTypeList) {
        if (maxNumberCpu < 1) {
            throw new ConfigurationException("max_number_cpu must be at least 1, found " + maxNumberCpu);
        }
        this.hierarchy = hierarchy;
        this.splitTable = splitTable;
        this.splitNodeSet = Collections.unmodifiableSet(new TreeSet<>(splitNodeSet));
        this.rootNodeId = rootNodeId;
        this.rootSplitReferenceId = rootSplitReferenceId;
        this.goalSet = Collections.unmodifiableSet(new TreeSet<>(goalSet));
        this.refitSplit = refitSplit;
        this.maxNumberCpu = maxNumberCpu;
        this.fitTypeList = fitTypeList == null || fitTypeList.isEmpty()
                ? DEFAULT_FIT_TYPE_LIST
                : List.copyOf(fitTypeList);
    }

    public NodeHierarchy getHierarchy() {
        return hierarchy;
    }

    public SplitReferenceTable getSplitTable() {
        return splitTable;
    }

    public Set<Integer> getSplitNodeSet() {
        return splitNodeSet;
    }

    public int getRootNodeId() {
        return rootNodeId;
    }

    public Integer getRootSplitReferenceId() {
        return rootSplitReferenceId;
    }

    public Set<Integer> getGoalSet() {
        return goalSet;
    }

    public boolean isRefitSplit() {
        return refitSplit;
    }

    public int getMaxNumberCpu() {
        return maxNumberCpu;
    }

    public List<String> getFitTypeList() {
        return fitTypeList;
    }

    /** Job table rooted at the root node and root split. */
    public JobTable buildJobTable() {
        return JobTableBuilder.build(hierarchy, splitNodeSet, splitTable, rootNodeId, rootSplitReferenceId, goalSet);
    }
}
