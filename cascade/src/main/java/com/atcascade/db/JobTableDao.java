package com.atcascade.db;

import com.atcascade.core.job.Job;
import com.atcascade.core.job.JobTable;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Job table stored in the all-node database by drill, so later commands can
 * check they rebuild the same table.
 */
public class JobTableDao {

    private final String dbPath;

    public JobTableDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public void save(JobTable jobTable) throws SQLException {
        SqliteInitializer.initializeAllNode(dbPath);
        String sql = "INSERT INTO job (job_id, job_name, fit_node_id, split_reference_id, parent_job_id) " +
                "VALUES (?, ?, ?, ?, ?)";
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                try (Statement stmt = conn.createStatement()) {
                    stmt.executeUpdate("DELETE FROM job");
                }
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    for (Job job : jobTable.jobs()) {
                        ps.setInt(1, job.getJobId());
                        ps.setString(2, job.getJobName());
                        ps.setInt(3, job.getFitNodeId());
                        setNullableInt(ps, 4, job.getSplitReferenceId());
                        setNullableInt(ps, 5, job.getParentJobId());
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    /** Empty when drill has not stored a job table yet. */
    public Optional<JobTable> load() throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (Connection conn = connect()) {
            if (!LogTableDao.tableExists(conn, "job")) {
                return Optional.empty();
            }
            String sql = "SELECT job_id, job_name, fit_node_id, split_reference_id, parent_job_id " +
                    "FROM job ORDER BY job_id";
            try (PreparedStatement ps = conn.prepareStatement(sql);
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    jobs.add(new Job(
                            rs.getInt("job_id"),
                            rs.getString("job_name"),
                            rs.getInt("fit_node_id"),
                            getNullableInt(rs, "split_reference_id"),
                            getNullableInt(rs, "parent_job_id")));
                }
            }
        }
        if (jobs.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new JobTable(jobs));
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
