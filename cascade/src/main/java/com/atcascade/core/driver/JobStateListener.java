package com.atcascade.core.driver;

import com.atcascade.core.job.Job;

public interface JobStateListener {

    JobStateListener NONE = (job, state, outcome) -> {
    };

    /**
     * Called on the coordinator thread for every state change. The outcome is
     * null until the job reaches a terminal state.
     */
    void onStateChange(Job job, JobState state, JobOutcome outcome);
}
