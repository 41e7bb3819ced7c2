package com.atcascade.core.service;

import com.atcascade.core.job.Job;
import com.atcascade.core.log.JobLogStatus;

import java.util.List;

public class JobSummary {
    private final Job job;
    private final String databaseDir;
    private final JobLogStatus status;
    private final List<String> errors;

    public JobSummary(Job job, String databaseDir, JobLogStatus status, List<String> errors) {
        this.job = job;
        this.databaseDir = databaseDir;
        this.status = status;
        this.errors = List.copyOf(errors);
    }

    public Job getJob() {
        return job;
    }

    public String getDatabaseDir() {
        return databaseDir;
    }

    public JobLogStatus getStatus() {
        return status;
    }

    public List<String> getErrors() {
        return errors;
    }
}
