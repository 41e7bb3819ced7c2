package com.atcascade.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of {@code cascade_config.json}, mapped by Jackson onto public fields.
 */
public class CascadeConfig {
    public String resultDir;
    public String rootDatabase;
    public String rootNodeName;
    public String rootSplitReferenceName;
    public List<NodeConfig> nodes = new ArrayList<>();
    public List<SplitReferenceConfig> splitReferences = new ArrayList<>();
    public List<String> nodeSplit = new ArrayList<>();
    public List<String> fitGoal = new ArrayList<>();
    public int maxNumberCpu = 1;
    public boolean refitSplit = false;
    public List<String> fitTypeList = new ArrayList<>(List.of("both", "fixed"));
    public EngineConfig engine = new EngineConfig();

    public static class NodeConfig {
        public String name;
        public String parent;

        public NodeConfig() {
        }

        public NodeConfig(String name, String parent) {
            this.name = name;
            this.parent = parent;
        }
    }

    public static class SplitReferenceConfig {
        public String name;
        public double value;

        public SplitReferenceConfig() {
        }

        public SplitReferenceConfig(String name, double value) {
            this.name = name;
            this.value = value;
        }
    }

    /**
     * External fit engine. Command arguments may contain the placeholders
     * {@code {database}}, {@code {mode}}, {@code {output}} and {@code {target}}.
     */
    public static class EngineConfig {
        public String type = "process";
        public List<String> fitCommand = new ArrayList<>();
        public List<String> predictCommand = new ArrayList<>();
        public long timeoutSeconds = 3600;
    }
}
