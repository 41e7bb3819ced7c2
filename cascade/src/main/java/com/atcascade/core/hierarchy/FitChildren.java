package com.atcascade.core.hierarchy;

import com.atcascade.core.InvalidGoalSetException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * For every node, the children that must be fit to reach the goal set from a
 * start node: the child nodes that are ancestors-or-self of some goal node.
 * Goal nodes themselves have no fit children.
 */
public class FitChildren {

    private final List<List<Integer>> fitChildren;

    private FitChildren(List<List<Integer>> fitChildren) {
        this.fitChildren = fitChildren;
    }

    public static FitChildren compute(NodeHierarchy hierarchy, int startNodeId, Set<Integer> goalSet) {
        if (goalSet == null || goalSet.isEmpty()) {
            throw new InvalidGoalSetException("fit goal set is empty");
        }
        int nNode = hierarchy.size();
        List<TreeSet<Integer>> sets = new ArrayList<>(nNode);
        for (int i = 0; i < nNode; i++) {
            sets.add(new TreeSet<>());
        }
        boolean[] reached = new boolean[nNode];
        reached[startNodeId] = true;
        // sorted so error messages and walks do not depend on set iteration order
        for (int goalId : new TreeSet<>(goalSet)) {
            if (!hierarchy.contains(goalId)) {
                throw new InvalidGoalSetException("goal node id " + goalId + " is not in the node table");
            }
            if (!hierarchy.isAncestorOrSelf(startNodeId, goalId)) {
                throw new InvalidGoalSetException("goal node " + hierarchy.nameOf(goalId)
                        + " is not a descendant of the start node " + hierarchy.nameOf(startNodeId));
            }
            Integer parent = hierarchy.parentOf(goalId);
            while (parent != null && hierarchy.isAncestorOrSelf(startNodeId, parent)) {
                if (goalSet.contains(parent)) {
                    throw nested(hierarchy, parent, goalId);
                }
                parent = hierarchy.parentOf(parent);
            }
            int nodeId = goalId;
            while (!reached[nodeId]) {
                int parentId = hierarchy.parentOf(nodeId);
                sets.get(parentId).add(nodeId);
                reached[nodeId] = true;
                nodeId = parentId;
            }
        }
        List<List<Integer>> result = new ArrayList<>(nNode);
        for (TreeSet<Integer> set : sets) {
            result.add(Collections.unmodifiableList(new ArrayList<>(set)));
        }
        return new FitChildren(result);
    }

    private static InvalidGoalSetException nested(NodeHierarchy hierarchy, int ancestor, int goal) {
        return new InvalidGoalSetException("goal node " + hierarchy.nameOf(ancestor)
                + " is an ancestor of goal node " + hierarchy.nameOf(goal)
                + "; goal nodes are not descended so the second goal cannot be reached");
    }

    /** Fit children of a node, increasing node id. */
    public List<Integer> of(int nodeId) {
        return fitChildren.get(nodeId);
    }
}
