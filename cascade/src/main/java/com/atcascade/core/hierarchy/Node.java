package com.atcascade.core.hierarchy;

public class Node {
    private final int nodeId;
    private final String name;
    private final Integer parentId;

    public Node(int nodeId, String name, Integer parentId) {
        this.nodeId = nodeId;
        this.name = name;
        this.parentId = parentId;
    }

    public int getNodeId() {
        return nodeId;
    }

    public String getName() {
        return name;
    }

    /** Null for the root of the hierarchy. */
    public Integer getParentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    @Override
    public String toString() {
        return "Node{id=" + nodeId + ", name='" + name + "', parent=" + parentId + "}";
    }
}
