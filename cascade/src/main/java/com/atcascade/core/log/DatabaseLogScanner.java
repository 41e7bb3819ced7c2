package com.atcascade.core.log;

import com.atcascade.core.job.DatabaseDirMapper;
import com.atcascade.core.job.Job;
import com.atcascade.db.LogEntry;
import com.atcascade.db.LogTableDao;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads job status from the log table of each job's fit database.
 */
public class DatabaseLogScanner implements LogScanner {

    private final DatabaseDirMapper mapper;
    private final Path resultDir;

    public DatabaseLogScanner(DatabaseDirMapper mapper, Path resultDir) {
        this.mapper = mapper;
        this.resultDir = resultDir;
    }

    @Override
    public JobLogStatus status(Job job) throws SQLException {
        Path database = mapper.databasePath(resultDir, job);
        if (!Files.exists(database)) {
            return JobLogStatus.MISSING;
        }
        boolean fit = false;
        boolean children = false;
        boolean error = false;
        for (LogEntry entry : new LogTableDao(database.toString()).entries()) {
            if (LogMessages.CHILDREN_OK.equals(entry.getMessage())) {
                children = true;
            } else if (LogMessages.FIT_OK.equals(entry.getMessage())) {
                fit = true;
            } else if (entry.isError()) {
                error = true;
            }
        }
        if (children) {
            return JobLogStatus.DONE;
        }
        if (fit) {
            return JobLogStatus.FIT;
        }
        return error ? JobLogStatus.ERROR : JobLogStatus.NOT_RUN;
    }

    @Override
    public List<String> errorMessages(Job job) throws SQLException {
        return messages(job, LogEntry.TYPE_ERROR);
    }

    @Override
    public List<String> warningMessages(Job job) throws SQLException {
        return messages(job, LogEntry.TYPE_WARNING);
    }

    @Override
    public boolean containsMessage(Job job, String message) throws SQLException {
        Path database = mapper.databasePath(resultDir, job);
        if (!Files.exists(database)) {
            return false;
        }
        return new LogTableDao(database.toString()).containsMessage(message);
    }

    private List<String> messages(Job job, String messageType) throws SQLException {
        Path database = mapper.databasePath(resultDir, job);
        if (!Files.exists(database)) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (LogEntry entry : new LogTableDao(database.toString()).entries()) {
            if (messageType.equals(entry.getMessageType())) {
                result.add(entry.getMessage());
            }
        }
        return result;
    }
}
