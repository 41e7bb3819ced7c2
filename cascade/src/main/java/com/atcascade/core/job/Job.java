package com.atcascade.core.job;

import java.util.Objects;

/**
 * One (node, split reference) fit with the job whose posterior seeds its
 * prior.
 */
public class Job {
    private final int jobId;
    private final String jobName;
    private final int fitNodeId;
    private final Integer splitReferenceId;
    private final Integer parentJobId;

    public Job(int jobId, String jobName, int fitNodeId, Integer splitReferenceId, Integer parentJobId) {
        this.jobId = jobId;
        this.jobName = jobName;
        this.fitNodeId = fitNodeId;
        this.splitReferenceId = splitReferenceId;
        this.parentJobId = parentJobId;
    }

    public int getJobId() {
        return jobId;
    }

    public String getJobName() {
        return jobName;
    }

    public int getFitNodeId() {
        return fitNodeId;
    }

    /** Null when the cascade has no split reference table. */
    public Integer getSplitReferenceId() {
        return splitReferenceId;
    }

    /** Null only for the start job. */
    public Integer getParentJobId() {
        return parentJobId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Job)) {
            return false;
        }
        Job other = (Job) o;
        return jobId == other.jobId
                && fitNodeId == other.fitNodeId
                && jobName.equals(other.jobName)
                && Objects.equals(splitReferenceId, other.splitReferenceId)
                && Objects.equals(parentJobId, other.parentJobId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, jobName, fitNodeId, splitReferenceId, parentJobId);
    }

    @Override
    public String toString() {
        return "Job{id=" + jobId + ", name='" + jobName + "', node=" + fitNodeId
                + ", split=" + splitReferenceId + ", parent=" + parentJobId + "}";
    }
}
