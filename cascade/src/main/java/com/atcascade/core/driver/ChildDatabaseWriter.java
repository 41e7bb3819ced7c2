package com.atcascade.core.driver;

import com.atcascade.core.job.DatabaseDirMapper;
import com.atcascade.core.job.Job;
import com.atcascade.core.job.JobTable;
import com.atcascade.core.log.LogMessages;
import com.atcascade.db.LogTableDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.SQLException;

/**
 * Seeds each child job's database from its parent's fitted database. The
 * parent's log gets {@code children: OK} only after every child is written,
 * so an interrupted run derives the children again on continue.
 */
public class ChildDatabaseWriter {

    private static final Logger logger = LoggerFactory.getLogger(ChildDatabaseWriter.class);

    private final JobTable jobTable;
    private final DatabaseDirMapper mapper;
    private final Path resultDir;

    public ChildDatabaseWriter(JobTable jobTable, DatabaseDirMapper mapper, Path resultDir) {
        this.jobTable = jobTable;
        this.mapper = mapper;
        this.resultDir = resultDir;
    }

    public void writeChildren(Job parent) throws IOException, SQLException {
        Path parentDb = mapper.databasePath(resultDir, parent);
        for (int childId : jobTable.childrenOf(parent.getJobId())) {
            Job child = jobTable.get(childId);
            Path childDb = mapper.databasePath(resultDir, child);
            Files.createDirectories(childDb.getParent());
            Files.copy(parentDb, childDb, StandardCopyOption.REPLACE_EXISTING);
            LogTableDao childLog = new LogTableDao(childDb.toString());
            childLog.reset();
            childLog.addMessage(LogMessages.parent(parent.getJobName()));
            logger.debug("Wrote {} from {}", childDb, parent.getJobName());
        }
        new LogTableDao(parentDb.toString()).addMessage(LogMessages.CHILDREN_OK);
    }
}
