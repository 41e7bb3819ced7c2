package com.atcascade.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initializeAllNode(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("CREATE TABLE IF NOT EXISTS node (" +
                        "node_id INTEGER PRIMARY KEY, " +
                        "node_name TEXT NOT NULL UNIQUE, " +
                        "parent INTEGER" +
                        ");");

                stmt.execute("CREATE TABLE IF NOT EXISTS split_reference (" +
                        "split_reference_id INTEGER PRIMARY KEY, " +
                        "split_reference_name TEXT NOT NULL UNIQUE, " +
                        "split_reference_value REAL NOT NULL" +
                        ");");

                stmt.execute("CREATE TABLE IF NOT EXISTS node_split (" +
                        "node_split_id INTEGER PRIMARY KEY, " +
                        "node_id INTEGER NOT NULL UNIQUE" +
                        ");");

                stmt.execute("CREATE TABLE IF NOT EXISTS fit_goal (" +
                        "fit_goal_id INTEGER PRIMARY KEY, " +
                        "node_id INTEGER NOT NULL UNIQUE" +
                        ");");

                stmt.execute("CREATE TABLE IF NOT EXISTS option_all (" +
                        "option_all_id INTEGER PRIMARY KEY, " +
                        "option_name TEXT NOT NULL UNIQUE, " +
                        "option_value TEXT" +
                        ");");

                // Written by drill; parent_job_id is null only for job 0
                stmt.execute("CREATE TABLE IF NOT EXISTS job (" +
                        "job_id INTEGER PRIMARY KEY, " +
                        "job_name TEXT NOT NULL UNIQUE, " +
                        "fit_node_id INTEGER NOT NULL, " +
                        "split_reference_id INTEGER, " +
                        "parent_job_id INTEGER" +
                        ");");
            }
        }
    }

    /**
     * Log table shared with the fit engine; the engine appends its own
     * {@code error} and {@code warning} rows.
     */
    public static void initializeLog(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("CREATE TABLE IF NOT EXISTS log (" +
                        "log_id INTEGER PRIMARY KEY, " +
                        "message_type TEXT, " +
                        "table_name TEXT, " +
                        "row_id INTEGER, " +
                        "unix_time INTEGER, " +
                        "message TEXT" +
                        ");");
            }
        }
    }
}
