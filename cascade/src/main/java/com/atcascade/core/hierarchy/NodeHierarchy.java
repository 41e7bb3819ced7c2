package com.atcascade.core.hierarchy;

import com.atcascade.core.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only tree of nodes stored as a flat array indexed by node id, with
 * parent back-references. A parent always has a smaller id than its
 * children, so walking parent links strictly decreases the id.
 */
public class NodeHierarchy {

    private final List<Node> nodes;
    private final List<List<Integer>> children;
    private final Map<String, Integer> idByName;
    private final int rootId;

    public NodeHierarchy(List<Node> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new ConfigurationException("node table is empty");
        }
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.idByName = new HashMap<>();
        List<List<Integer>> kids = new ArrayList<>();
        Integer root = null;
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node.getNodeId() != i) {
                throw new ConfigurationException("node " + node.getName() + " has id " + node.getNodeId()
                        + " but is at index " + i);
            }
            if (idByName.put(node.getName(), i) != null) {
                throw new ConfigurationException("node name " + node.getName() + " appears more than once");
            }
            Integer parent = node.getParentId();
            if (parent == null) {
                if (root != null) {
                    throw new ConfigurationException("node table has more than one root: "
                            + nodes.get(root).getName() + " and " + node.getName());
                }
                root = i;
            } else if (parent < 0 || parent >= i) {
                throw new ConfigurationException("parent of node " + node.getName()
                        + " must have a smaller node id, found parent id " + parent);
            }
            kids.add(new ArrayList<>());
        }
        if (root == null) {
            throw new ConfigurationException("node table has no root node");
        }
        for (Node node : nodes) {
            if (node.getParentId() != null) {
                kids.get(node.getParentId()).add(node.getNodeId());
            }
        }
        List<List<Integer>> frozen = new ArrayList<>(kids.size());
        for (List<Integer> list : kids) {
            frozen.add(Collections.unmodifiableList(list));
        }
        this.children = Collections.unmodifiableList(frozen);
        this.rootId = root;
    }

    /**
     * Builds a hierarchy from (name, parent name) pairs listed parents first.
     */
    public static NodeHierarchy fromNames(List<String> names, List<String> parentNames) {
        if (names.size() != parentNames.size()) {
            throw new IllegalArgumentException("names and parentNames must have the same length");
        }
        Map<String, Integer> ids = new HashMap<>();
        List<Node> nodes = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            String parentName = parentNames.get(i);
            Integer parentId = null;
            if (parentName != null && !parentName.isEmpty()) {
                parentId = ids.get(parentName);
                if (parentId == null) {
                    throw new ConfigurationException("parent " + parentName + " of node " + names.get(i)
                            + " must appear before it in the node table");
                }
            }
            ids.put(names.get(i), i);
            nodes.add(new Node(i, names.get(i), parentId));
        }
        return new NodeHierarchy(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public Node node(int nodeId) {
        return nodes.get(nodeId);
    }

    public List<Node> nodes() {
        return nodes;
    }

    public Integer parentOf(int nodeId) {
        return nodes.get(nodeId).getParentId();
    }

    public List<Integer> childrenOf(int nodeId) {
        return children.get(nodeId);
    }

    public int rootId() {
        return rootId;
    }

    public String nameOf(int nodeId) {
        return nodes.get(nodeId).getName();
    }

    public int idOf(String name) {
        Integer id = idByName.get(name);
        if (id == null) {
            throw new ConfigurationException("cannot find node " + name + " in the node table");
        }
        return id;
    }

    public boolean contains(int nodeId) {
        return nodeId >= 0 && nodeId < nodes.size();
    }

    public boolean isAncestorOrSelf(int ancestorId, int descendantId) {
        Integer id = descendantId;
        while (id != null && id >= ancestorId) {
            if (id == ancestorId) {
                return true;
            }
            id = nodes.get(id).getParentId();
        }
        return false;
    }
}
