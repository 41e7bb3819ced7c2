package com.atcascade.db;

import com.atcascade.core.ConfigurationException;
import com.atcascade.core.hierarchy.Node;
import com.atcascade.core.hierarchy.NodeHierarchy;
import com.atcascade.core.hierarchy.SplitReference;
import com.atcascade.core.hierarchy.SplitReferenceTable;
import com.atcascade.core.job.CascadeInputs;

import java.sql.*;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The all-node database: node, split_reference, node_split, fit_goal and
 * option_all tables. These are written once by setup and read back by every
 * later command, so all commands see the same cascade.
 */
public class AllNodeDao {

    public static final String OPTION_ROOT_NODE_NAME = "root_node_name";
    public static final String OPTION_ROOT_SPLIT_REFERENCE_NAME = "root_split_reference_name";
    public static final String OPTION_MAX_NUMBER_CPU = "max_number_cpu";
    public static final String OPTION_REFIT_SPLIT = "refit_split";
    public static final String OPTION_FIT_TYPE_LIST = "fit_type_list";

    private final String dbPath;

    public AllNodeDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    /** Replaces the contents of every input table. */
    public void writeInputs(CascadeInputs inputs) throws SQLException {
        SqliteInitializer.initializeAllNode(dbPath);
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                try (Statement stmt = conn.createStatement()) {
                    stmt.executeUpdate("DELETE FROM node");
                    stmt.executeUpdate("DELETE FROM split_reference");
                    stmt.executeUpdate("DELETE FROM node_split");
                    stmt.executeUpdate("DELETE FROM fit_goal");
                    stmt.executeUpdate("DELETE FROM option_all");
                }
                try (PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO node (node_id, node_name, parent) VALUES (?, ?, ?)")) {
                    for (Node node : inputs.getHierarchy().nodes()) {
                        ps.setInt(1, node.getNodeId());
                        ps.setString(2, node.getName());
                        if (node.getParentId() == null) {
                            ps.setNull(3, Types.INTEGER);
                        } else {
                            ps.setInt(3, node.getParentId());
                        }
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                try (PreparedStatement ps = conn.prepareStatement("INSERT INTO split_reference " +
                        "(split_reference_id, split_reference_name, split_reference_value) VALUES (?, ?, ?)")) {
                    for (SplitReference ref : inputs.getSplitTable().references()) {
                        ps.setInt(1, ref.getSplitReferenceId());
                        ps.setString(2, ref.getName());
                        ps.setDouble(3, ref.getValue());
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                insertIds(conn, "node_split", "node_split_id", inputs.getSplitNodeSet());
                insertIds(conn, "fit_goal", "fit_goal_id", inputs.getGoalSet());

                Map<String, String> options = new LinkedHashMap<>();
                options.put(OPTION_ROOT_NODE_NAME, inputs.getHierarchy().nameOf(inputs.getRootNodeId()));
                if (inputs.getRootSplitReferenceId() != null) {
                    options.put(OPTION_ROOT_SPLIT_REFERENCE_NAME,
                            inputs.getSplitTable().nameOf(inputs.getRootSplitReferenceId()));
                }
                options.put(OPTION_MAX_NUMBER_CPU, Integer.toString(inputs.getMaxNumberCpu()));
                options.put(OPTION_REFIT_SPLIT, Boolean.toString(inputs.isRefitSplit()));
                options.put(OPTION_FIT_TYPE_LIST, String.join(" ", inputs.getFitTypeList()));
                try (PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO option_all (option_name, option_value) VALUES (?, ?)")) {
                    for (Map.Entry<String, String> e : options.entrySet()) {
                        ps.setString(1, e.getKey());
                        ps.setString(2, e.getValue());
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

    private static void insertIds(Connection conn, String table, String idColumn, Set<Integer> nodeIds)
            throws SQLException {
        String sql = "INSERT INTO " + table + " (" + idColumn + ", node_id) VALUES (?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int rowId = 0;
            for (int nodeId : nodeIds) {
                ps.setInt(1, rowId++);
                ps.setInt(2, nodeId);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    public Map<String, String> loadOptions() throws SQLException {
        Map<String, String> options = new LinkedHashMap<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT option_name, option_value FROM option_all ORDER BY option_all_id");
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                options.put(rs.getString("option_name"), rs.getString("option_value"));
            }
        }
        return options;
    }

    public CascadeInputs loadInputs() throws SQLException {
        try (Connection conn = connect()) {
            if (!LogTableDao.tableExists(conn, "node")) {
                throw new ConfigurationException(dbPath + " is not an all-node database, run setup first");
            }
            List<Node> nodes = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT node_id, node_name, parent FROM node ORDER BY node_id");
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int parent = rs.getInt("parent");
                    Integer parentId = rs.wasNull() ? null : parent;
                    nodes.add(new Node(rs.getInt("node_id"), rs.getString("node_name"), parentId));
                }
            }
            List<SplitReference> refs = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement("SELECT split_reference_id, split_reference_name, " +
                    "split_reference_value FROM split_reference ORDER BY split_reference_id");
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    refs.add(new SplitReference(
                            rs.getInt("split_reference_id"),
                            rs.getString("split_reference_name"),
                            rs.getDouble("split_reference_value")));
                }
            }
            Set<Integer> splitNodes = loadIds(conn, "node_split");
            Set<Integer> goals = loadIds(conn, "fit_goal");
            Map<String, String> options = loadOptions();

            NodeHierarchy hierarchy = new NodeHierarchy(nodes);
            String rootNodeName = options.get(OPTION_ROOT_NODE_NAME);
            if (rootNodeName == null) {
                throw new ConfigurationException("option_all has no " + OPTION_ROOT_NODE_NAME);
            }
            Integer rootSplit = null;
            String rootSplitName = options.get(OPTION_ROOT_SPLIT_REFERENCE_NAME);
            if (!refs.isEmpty()) {
                if (rootSplitName == null) {
                    throw new ConfigurationException("option_all has no " + OPTION_ROOT_SPLIT_REFERENCE_NAME
                            + " but split_reference is not empty");
                }
                for (SplitReference ref : refs) {
                    if (ref.getName().equals(rootSplitName)) {
                        rootSplit = ref.getSplitReferenceId();
                    }
                }
                if (rootSplit == null) {
                    throw new ConfigurationException("root split reference " + rootSplitName
                            + " is not in split_reference");
                }
            }
            int maxNumberCpu = Integer.parseInt(options.getOrDefault(OPTION_MAX_NUMBER_CPU, "1"));
            boolean refitSplit = Boolean.parseBoolean(options.getOrDefault(OPTION_REFIT_SPLIT, "false"));
            String fitTypes = options.getOrDefault(OPTION_FIT_TYPE_LIST, "").trim();
            List<String> fitTypeList = fitTypes.isEmpty() ? null : Arrays.asList(fitTypes.split("\\s+"));

            return new CascadeInputs(
                    hierarchy,
                    new SplitReferenceTable(refs, rootSplit),
                    splitNodes,
                    hierarchy.idOf(rootNodeName),
                    rootSplit,
                    goals,
                    refitSplit,
                    maxNumberCpu,
                    fitTypeList);
        }
    }

    private static Set<Integer> loadIds(Connection conn, String table) throws SQLException {
        Set<Integer> ids = new TreeSet<>();
        try (PreparedStatement ps = conn.prepareStatement("SELECT node_id FROM " + table);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getInt("node_id"));
            }
        }
        return ids;
    }
}
