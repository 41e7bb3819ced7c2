package com.atcascade.core.driver;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Final state of every job a driver run considered, increasing job id.
 */
public class CascadeReport {
    private final List<JobReport> jobs;

    public CascadeReport(List<JobReport> jobs) {
        this.jobs = Collections.unmodifiableList(jobs);
    }

    public List<JobReport> getJobs() {
        return jobs;
    }

    public Optional<JobReport> find(int jobId) {
        for (JobReport report : jobs) {
            if (report.getJob().getJobId() == jobId) {
                return Optional.of(report);
            }
        }
        return Optional.empty();
    }

    public long count(JobState state) {
        return jobs.stream().filter(r -> r.getState() == state).count();
    }

    public long getDoneCount() {
        return count(JobState.DONE);
    }

    public long getFailedCount() {
        return count(JobState.FAILED);
    }

    public long getSkippedCount() {
        return count(JobState.SKIPPED);
    }

    public boolean isSuccess() {
        return getFailedCount() == 0 && getSkippedCount() == 0;
    }

    @Override
    public String toString() {
        return "CascadeReport{jobs=" + jobs.size() +
                ", done=" + getDoneCount() +
                ", failed=" + getFailedCount() +
                ", skipped=" + getSkippedCount() +
                '}';
    }
}
