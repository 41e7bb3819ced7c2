package com.atcascade.core.predict;

import com.atcascade.core.job.Job;
import com.atcascade.core.job.JobTable;
import com.atcascade.core.log.LogScanner;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Finds the fit to predict a job from when the job itself may not have a
 * usable fit: the nearest job up the parent chain whose database records a
 * successful fit.
 */
public class AncestorFit {

    private final JobTable jobTable;
    private final LogScanner logScanner;

    public AncestorFit(JobTable jobTable, LogScanner logScanner) {
        this.jobTable = jobTable;
        this.logScanner = logScanner;
    }

    public Optional<Job> find(Job job, boolean allowSameJob) throws SQLException {
        Integer jobId = allowSameJob ? Integer.valueOf(job.getJobId()) : job.getParentJobId();
        while (jobId != null) {
            Job candidate = jobTable.get(jobId);
            if (logScanner.status(candidate).hasFit()) {
                return Optional.of(candidate);
            }
            jobId = candidate.getParentJobId();
        }
        return Optional.empty();
    }
}
