package com.atcascade.core.hierarchy;

public class SplitReference {
    private final int splitReferenceId;
    private final String name;
    private final double value;

    public SplitReference(int splitReferenceId, String name, double value) {
        this.splitReferenceId = splitReferenceId;
        this.name = name;
        this.value = value;
    }

    public int getSplitReferenceId() {
        return splitReferenceId;
    }

    public String getName() {
        return name;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "SplitReference{id=" + splitReferenceId + ", name='" + name + "', value=" + value + "}";
    }
}
