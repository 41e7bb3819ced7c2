package com.atcascade.core.driver;

public class JobResult {
    private final JobOutcome outcome;
    private final String message;

    public JobResult(JobOutcome outcome, String message) {
        this.outcome = outcome;
        this.message = message;
    }

    public static JobResult done(String message) {
        return new JobResult(JobOutcome.DONE, message);
    }

    public JobOutcome getOutcome() {
        return outcome;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return outcome + ": " + message;
    }
}
