package com.atcascade.core.driver;

import com.atcascade.core.job.Job;

/**
 * Runs one job once its parent is done. Called from worker threads,
 * concurrently for jobs that own different directories.
 */
public interface JobRunner {
    JobResult run(Job job) throws Exception;
}
