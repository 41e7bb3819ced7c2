package com.atcascade.core.job;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Ancestor / descendant queries on a job table.
 */
public class JobRelations {

    private final JobTable jobTable;
    private final boolean refitSplit;

    public JobRelations(JobTable jobTable, boolean refitSplit) {
        this.jobTable = jobTable;
        this.refitSplit = refitSplit;
    }

    /**
     * Number of generations from an ancestor job to a descendant job, or empty
     * when the first is not an ancestor-or-self of the second. Generations
     * count node changes along the parent chain; when the cascade refits at
     * splits, a change of split between the two jobs counts as one more.
     */
    public OptionalInt descendantGeneration(int ancestorId, int descendantId) {
        if (descendantId < ancestorId) {
            return OptionalInt.empty();
        }
        int generation = 0;
        int jobId = descendantId;
        while (jobId != ancestorId) {
            Job job = jobTable.get(jobId);
            Integer parentId = job.getParentJobId();
            if (parentId == null || parentId < ancestorId) {
                return OptionalInt.empty();
            }
            if (jobTable.get(parentId).getFitNodeId() != job.getFitNodeId()) {
                generation++;
            }
            jobId = parentId;
        }
        if (refitSplit && !Objects.equals(
                jobTable.get(ancestorId).getSplitReferenceId(),
                jobTable.get(descendantId).getSplitReferenceId())) {
            generation++;
        }
        return OptionalInt.of(generation);
    }

    public boolean isAncestorOrSelf(int ancestorId, int descendantId) {
        Integer jobId = descendantId;
        while (jobId != null && jobId >= ancestorId) {
            if (jobId == ancestorId) {
                return true;
            }
            jobId = jobTable.get(jobId).getParentJobId();
        }
        return false;
    }

    /** Proper descendants, increasing id. */
    public List<Integer> descendants(int jobId) {
        boolean[] below = new boolean[jobTable.size()];
        below[jobId] = true;
        List<Integer> result = new ArrayList<>();
        for (int id = jobId + 1; id < jobTable.size(); id++) {
            Integer parent = jobTable.get(id).getParentJobId();
            if (parent != null && below[parent]) {
                below[id] = true;
                result.add(id);
            }
        }
        return result;
    }

    /** Parent chain, nearest first. */
    public List<Integer> ancestors(int jobId) {
        List<Integer> result = new ArrayList<>();
        Integer parent = jobTable.get(jobId).getParentJobId();
        while (parent != null) {
            result.add(parent);
            parent = jobTable.get(parent).getParentJobId();
        }
        return result;
    }

    public JobTable getJobTable() {
        return jobTable;
    }
}
