package com.atcascade.core.job;

import com.atcascade.core.IntegrityException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, topologically ordered list of jobs: job ids are the list
 * indices and every parent id is smaller than the id of its children.
 */
public class JobTable {

    private final List<Job> jobs;
    private final List<List<Integer>> children;
    private final Map<String, Integer> idByName;

    public JobTable(List<Job> jobs) {
        this.jobs = Collections.unmodifiableList(new ArrayList<>(jobs));
        this.idByName = new HashMap<>();
        Map<String, Integer> idByPair = new HashMap<>();
        List<List<Integer>> kids = new ArrayList<>(jobs.size());
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            if (job.getJobId() != i) {
                throw new IntegrityException("job " + job.getJobName() + " has id " + job.getJobId()
                        + " but is at index " + i);
            }
            Integer parent = job.getParentJobId();
            if (i == 0 ? parent != null : (parent == null || parent < 0 || parent >= i)) {
                throw new IntegrityException("job " + job.getJobName() + " has parent job id " + parent
                        + " which does not precede it");
            }
            String pair = job.getFitNodeId() + "/" + job.getSplitReferenceId();
            Integer other = idByPair.put(pair, i);
            if (other != null) {
                throw new IntegrityException("jobs " + other + " and " + i
                        + " fit the same node and split reference: " + job.getJobName());
            }
            if (idByName.put(job.getJobName(), i) != null) {
                throw new IntegrityException("job name " + job.getJobName() + " appears more than once");
            }
            kids.add(new ArrayList<>());
            if (parent != null) {
                kids.get(parent).add(i);
            }
        }
        List<List<Integer>> frozen = new ArrayList<>(kids.size());
        for (List<Integer> list : kids) {
            frozen.add(Collections.unmodifiableList(list));
        }
        this.children = Collections.unmodifiableList(frozen);
    }

    public int size() {
        return jobs.size();
    }

    public Job get(int jobId) {
        return jobs.get(jobId);
    }

    public List<Job> jobs() {
        return jobs;
    }

    /** Jobs that can run as soon as the given job is done, increasing id. */
    public List<Integer> childrenOf(int jobId) {
        return children.get(jobId);
    }

    public Optional<Job> findByName(String jobName) {
        Integer id = idByName.get(jobName);
        return id == null ? Optional.empty() : Optional.of(jobs.get(id));
    }

    public Optional<Job> find(int fitNodeId, Integer splitReferenceId) {
        for (Job job : jobs) {
            if (job.getFitNodeId() == fitNodeId && Objects.equals(job.getSplitReferenceId(), splitReferenceId)) {
                return Optional.of(job);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JobTable)) {
            return false;
        }
        return jobs.equals(((JobTable) o).jobs);
    }

    @Override
    public int hashCode() {
        return jobs.hashCode();
    }
}
