package com.atcascade.db;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * Log table of one fit database.
 */
public class LogTableDao {

    private final String dbPath;

    public LogTableDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    /** Drops every row, creating the table when it is missing. */
    public void reset() throws SQLException {
        SqliteInitializer.initializeLog(dbPath);
        try (Connection conn = connect();
                Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("DELETE FROM log");
        }
    }

    public void addEntry(String messageType, String message) throws SQLException {
        SqliteInitializer.initializeLog(dbPath);
        long now = System.currentTimeMillis() / 1000;
        String sql = "INSERT INTO log (message_type, table_name, row_id, unix_time, message) " +
                "VALUES (?, NULL, NULL, ?, ?)";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, messageType);
            ps.setLong(2, now);
            ps.setString(3, message);
            ps.executeUpdate();
        }
    }

    public void addMessage(String message) throws SQLException {
        addEntry(LogEntry.TYPE_CASCADE, message);
    }

    public void addError(String message) throws SQLException {
        addEntry(LogEntry.TYPE_ERROR, message);
    }

    public List<LogEntry> entries() throws SQLException {
        List<LogEntry> entries = new ArrayList<>();
        try (Connection conn = connect()) {
            if (!tableExists(conn, "log")) {
                return entries;
            }
            String sql = "SELECT log_id, message_type, unix_time, message FROM log ORDER BY log_id";
            try (PreparedStatement ps = conn.prepareStatement(sql);
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new LogEntry(
                            rs.getLong("log_id"),
                            rs.getString("message_type"),
                            rs.getLong("unix_time"),
                            rs.getString("message")));
                }
            }
        }
        return entries;
    }

    public boolean containsMessage(String message) throws SQLException {
        try (Connection conn = connect()) {
            if (!tableExists(conn, "log")) {
                return false;
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT 1 FROM log WHERE message = ? LIMIT 1")) {
                ps.setString(1, message);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        }
    }

    static boolean tableExists(Connection conn, String table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT name FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
