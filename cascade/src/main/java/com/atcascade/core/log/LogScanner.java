package com.atcascade.core.log;

import com.atcascade.core.job.Job;

import java.sql.SQLException;
import java.util.List;

public interface LogScanner {

    JobLogStatus status(Job job) throws SQLException;

    List<String> errorMessages(Job job) throws SQLException;

    List<String> warningMessages(Job job) throws SQLException;

    boolean containsMessage(Job job, String message) throws SQLException;

    /**
     * True when the job's log has more than one error. Such a job is treated
     * as failed even if the last engine run exited normally.
     */
    default boolean hasTwoErrors(Job job) throws SQLException {
        return errorMessages(job).size() > 1;
    }
}
