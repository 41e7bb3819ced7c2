package com.atcascade.core.driver;

import com.atcascade.core.job.Job;
import com.atcascade.core.job.JobRelations;
import com.atcascade.core.job.JobTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs the jobs below a start job on a fixed pool of workers. A job is
 * dispatched only once its parent is done; when a job fails, every job below
 * it is skipped without running.
 */
public class CascadeDriver {

    private static final Logger logger = LoggerFactory.getLogger(CascadeDriver.class);

    private final JobTable jobTable;
    private final JobRunner jobRunner;
    private final int maxConcurrency;
    private final JobStateListener listener;
    private final JobRelations relations;

    public CascadeDriver(JobTable jobTable, JobRunner jobRunner, int maxConcurrency, JobStateListener listener) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, found " + maxConcurrency);
        }
        this.jobTable = jobTable;
        this.jobRunner = jobRunner;
        this.maxConcurrency = maxConcurrency;
        this.listener = listener == null ? JobStateListener.NONE : listener;
        this.relations = new JobRelations(jobTable, false);
    }

    /**
     * @param skipStartJob treat the start job as already done and begin with
     *                     its children
     */
    public CascadeReport run(int startJobId, boolean skipStartJob) throws InterruptedException {
        if (startJobId < 0 || startJobId >= jobTable.size()) {
            throw new IllegalArgumentException("start job id " + startJobId + " is not in the job table");
        }
        int nJob = jobTable.size();
        JobState[] state = new JobState[nJob];
        JobOutcome[] outcome = new JobOutcome[nJob];
        String[] message = new String[nJob];

        List<Integer> selected = new ArrayList<>();
        selected.add(startJobId);
        selected.addAll(relations.descendants(startJobId));
        for (int jobId : selected) {
            state[jobId] = JobState.PENDING;
        }

        TreeSet<Integer> ready = new TreeSet<>();
        if (skipStartJob) {
            state[startJobId] = JobState.DONE;
            outcome[startJobId] = JobOutcome.ALREADY_DONE;
            message[startJobId] = "start job of continue";
            listener.onStateChange(jobTable.get(startJobId), JobState.DONE, JobOutcome.ALREADY_DONE);
            ready.addAll(jobTable.childrenOf(startJobId));
        } else {
            ready.add(startJobId);
        }
        logger.info("Running {} jobs from {} with {} workers",
                selected.size(), jobTable.get(startJobId).getJobName(), maxConcurrency);

        ExecutorService pool = Executors.newFixedThreadPool(maxConcurrency);
        CompletionService<Completion> completions = new ExecutorCompletionService<>(pool);
        int inFlight = 0;
        try {
            while (!ready.isEmpty() || inFlight > 0) {
                while (!ready.isEmpty() && inFlight < maxConcurrency) {
                    Job job = jobTable.get(ready.pollFirst());
                    state[job.getJobId()] = JobState.RUNNING;
                    listener.onStateChange(job, JobState.RUNNING, null);
                    logger.info("Begin {}", job.getJobName());
                    completions.submit(() -> new Completion(job, runJob(job)));
                    inFlight++;
                }

                Completion done = completions.take().get();
                inFlight--;
                Job job = done.job;
                int jobId = job.getJobId();
                outcome[jobId] = done.result.getOutcome();
                message[jobId] = done.result.getMessage();
                if (done.result.getOutcome().isSuccess()) {
                    state[jobId] = JobState.DONE;
                    logger.info("End   {}: {}", job.getJobName(), done.result.getOutcome());
                    listener.onStateChange(job, JobState.DONE, outcome[jobId]);
                    ready.addAll(jobTable.childrenOf(jobId));
                } else {
                    state[jobId] = JobState.FAILED;
                    logger.error("Error {}: {}", job.getJobName(), done.result);
                    listener.onStateChange(job, JobState.FAILED, outcome[jobId]);
                    skipDescendants(job, state, outcome, message);
                }
            }
        } catch (ExecutionException e) {
            // runJob converts every failure to a result
            throw new IllegalStateException("job worker failed unexpectedly", e.getCause());
        } finally {
            pool.shutdownNow();
            if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warn("Workers did not stop within a minute, still running: {}", runningJobs(state));
            }
        }

        List<JobReport> reports = new ArrayList<>(selected.size());
        for (int jobId : new TreeSet<>(selected)) {
            reports.add(new JobReport(jobTable.get(jobId), state[jobId], outcome[jobId], message[jobId]));
        }
        CascadeReport report = new CascadeReport(reports);
        logger.info("Finished: {} done, {} failed, {} skipped",
                report.getDoneCount(), report.getFailedCount(), report.getSkippedCount());
        return report;
    }

    private JobResult runJob(Job job) {
        try {
            return jobRunner.run(job);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new JobResult(JobOutcome.EXECUTION_ERROR, "interrupted");
        } catch (Exception e) {
            logger.error("Job {} threw", job.getJobName(), e);
            return new JobResult(JobOutcome.EXECUTION_ERROR, e.toString());
        }
    }

    List<String> runningJobs(JobState[] state) {
        List<String> names = new ArrayList<>();
        for (int jobId = 0; jobId < state.length; jobId++) {
            if (state[jobId] == JobState.RUNNING) {
                names.add(jobTable.get(jobId).getJobName());
            }
        }
        return names;
    }

    private void skipDescendants(Job failed, JobState[] state, JobOutcome[] outcome, String[] message) {
        for (int jobId : relations.descendants(failed.getJobId())) {
            if (state[jobId].isTerminal()) {
                continue;
            }
            state[jobId] = JobState.SKIPPED;
            outcome[jobId] = JobOutcome.SKIPPED_DUE_TO_ANCESTOR_FAILURE;
            message[jobId] = "ancestor " + failed.getJobName() + " failed";
            Job job = jobTable.get(jobId);
            logger.warn("Skip  {}: ancestor {} failed", job.getJobName(), failed.getJobName());
            listener.onStateChange(job, JobState.SKIPPED, JobOutcome.SKIPPED_DUE_TO_ANCESTOR_FAILURE);
        }
    }

    private static class Completion {
        final Job job;
        final JobResult result;

        Completion(Job job, JobResult result) {
            this.job = job;
            this.result = result;
        }
    }
}
