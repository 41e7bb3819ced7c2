package com.atcascade.core.predict;

import com.atcascade.core.job.Job;

public class PredictResult {
    private final Job job;
    private final PredictOutcome outcome;
    private final Job sourceJob;
    private final String message;

    public PredictResult(Job job, PredictOutcome outcome, Job sourceJob, String message) {
        this.job = job;
        this.outcome = outcome;
        this.sourceJob = sourceJob;
        this.message = message;
    }

    public Job getJob() {
        return job;
    }

    public PredictOutcome getOutcome() {
        return outcome;
    }

    /** Job whose fit was used; null when nothing was predicted. */
    public Job getSourceJob() {
        return sourceJob;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return job.getJobName() + " " + outcome
                + (sourceJob == null ? "" : " from " + sourceJob.getJobName())
                + (message == null ? "" : " " + message);
    }
}
