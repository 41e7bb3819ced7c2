package com.atcascade.core.driver;

import com.atcascade.core.job.Job;

public class JobReport {
    private final Job job;
    private final JobState state;
    private final JobOutcome outcome;
    private final String message;

    public JobReport(Job job, JobState state, JobOutcome outcome, String message) {
        this.job = job;
        this.state = state;
        this.outcome = outcome;
        this.message = message;
    }

    public Job getJob() {
        return job;
    }

    public JobState getState() {
        return state;
    }

    public JobOutcome getOutcome() {
        return outcome;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return job.getJobName() + " " + state + " " + outcome + (message == null ? "" : " " + message);
    }
}
