package com.atcascade.core.config;

import com.atcascade.core.ConfigurationException;
import com.atcascade.core.engine.FitMode;
import com.atcascade.core.hierarchy.NodeHierarchy;
import com.atcascade.core.hierarchy.SplitReferenceTable;
import com.atcascade.core.job.CascadeInputs;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the name-based configuration file into id-based cascade inputs.
 */
public final class CascadeConfigConverter {

    private CascadeConfigConverter() {
    }

    public static CascadeInputs toInputs(CascadeConfig config) {
        if (config.nodes == null || config.nodes.isEmpty()) {
            throw new ConfigurationException("configuration has no nodes");
        }
        if (config.rootNodeName == null || config.rootNodeName.isEmpty()) {
            throw new ConfigurationException("rootNodeName is required");
        }
        List<String> names = new ArrayList<>();
        List<String> parents = new ArrayList<>();
        for (CascadeConfig.NodeConfig node : config.nodes) {
            names.add(node.name);
            parents.add(node.parent);
        }
        NodeHierarchy hierarchy = NodeHierarchy.fromNames(names, parents);

        List<String> splitNames = new ArrayList<>();
        List<Double> splitValues = new ArrayList<>();
        if (config.splitReferences != null) {
            for (CascadeConfig.SplitReferenceConfig ref : config.splitReferences) {
                splitNames.add(ref.name);
                splitValues.add(ref.value);
            }
        }
        SplitReferenceTable splitTable;
        Integer rootSplit = null;
        if (splitNames.isEmpty()) {
            if (config.rootSplitReferenceName != null && !config.rootSplitReferenceName.isEmpty()) {
                throw new ConfigurationException("rootSplitReferenceName is set but there are no splitReferences");
            }
            splitTable = SplitReferenceTable.empty();
        } else {
            if (config.rootSplitReferenceName == null) {
                throw new ConfigurationException("rootSplitReferenceName is required when splitReferences is set");
            }
            splitTable = SplitReferenceTable.of(splitNames, splitValues, config.rootSplitReferenceName);
            rootSplit = splitTable.rootId();
        }

        Set<Integer> splitNodes = idsOf(hierarchy, config.nodeSplit);
        Set<Integer> goals = idsOf(hierarchy, config.fitGoal);

        List<String> fitTypes = new ArrayList<>();
        if (config.fitTypeList != null) {
            for (String fitType : config.fitTypeList) {
                fitTypes.add(FitMode.fromLabel(fitType).label());
            }
        }
        return new CascadeInputs(
                hierarchy,
                splitTable,
                splitNodes,
                hierarchy.idOf(config.rootNodeName),
                rootSplit,
                goals,
                config.refitSplit,
                config.maxNumberCpu,
                fitTypes);
    }

    private static Set<Integer> idsOf(NodeHierarchy hierarchy, List<String> names) {
        Set<Integer> ids = new LinkedHashSet<>();
        if (names != null) {
            for (String name : names) {
                ids.add(hierarchy.idOf(name));
            }
        }
        return ids;
    }
}
