package com.atcascade.core.hierarchy;

import com.atcascade.core.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Values of the splitting covariate (e.g. female, both, male) with one root
 * value that is used before any split happens. An empty table means the
 * cascade does not split and every split reference id is null.
 */
public class SplitReferenceTable {

    private static final SplitReferenceTable EMPTY = new SplitReferenceTable(Collections.emptyList(), null);

    private final List<SplitReference> references;
    private final Integer rootId;

    public SplitReferenceTable(List<SplitReference> references, Integer rootId) {
        this.references = Collections.unmodifiableList(new ArrayList<>(references));
        Set<String> names = new HashSet<>();
        for (int i = 0; i < references.size(); i++) {
            SplitReference ref = references.get(i);
            if (ref.getSplitReferenceId() != i) {
                throw new ConfigurationException("split reference " + ref.getName() + " has id "
                        + ref.getSplitReferenceId() + " but is at index " + i);
            }
            if (!names.add(ref.getName())) {
                throw new ConfigurationException("split reference name " + ref.getName()
                        + " appears more than once");
            }
        }
        if (references.isEmpty()) {
            if (rootId != null) {
                throw new ConfigurationException("root split reference given but split reference table is empty");
            }
        } else if (rootId == null || rootId < 0 || rootId >= references.size()) {
            throw new ConfigurationException("root split reference id " + rootId
                    + " is not valid for a split reference table of size " + references.size());
        }
        this.rootId = rootId;
    }

    public static SplitReferenceTable empty() {
        return EMPTY;
    }

    public static SplitReferenceTable of(List<String> names, List<Double> values, String rootName) {
        List<SplitReference> refs = new ArrayList<>();
        Integer root = null;
        for (int i = 0; i < names.size(); i++) {
            refs.add(new SplitReference(i, names.get(i), values.get(i)));
            if (names.get(i).equals(rootName)) {
                root = i;
            }
        }
        if (!names.isEmpty() && root == null) {
            throw new ConfigurationException("root split reference " + rootName
                    + " is not in the split reference table");
        }
        return new SplitReferenceTable(refs, root);
    }

    public boolean isEmpty() {
        return references.isEmpty();
    }

    public int size() {
        return references.size();
    }

    public List<SplitReference> references() {
        return references;
    }

    public SplitReference get(int splitReferenceId) {
        return references.get(splitReferenceId);
    }

    public String nameOf(int splitReferenceId) {
        return references.get(splitReferenceId).getName();
    }

    /** Null when the table is empty. */
    public Integer rootId() {
        return rootId;
    }

    public boolean isValidId(Integer splitReferenceId) {
        if (references.isEmpty()) {
            return splitReferenceId == null;
        }
        return splitReferenceId != null && splitReferenceId >= 0 && splitReferenceId < references.size();
    }

    public int idOf(String name) {
        for (SplitReference ref : references) {
            if (ref.getName().equals(name)) {
                return ref.getSplitReferenceId();
            }
        }
        throw new ConfigurationException("cannot find split reference " + name);
    }

    /** Every id except the root one, increasing. */
    public List<Integer> nonRootIds() {
        List<Integer> ids = new ArrayList<>();
        for (SplitReference ref : references) {
            if (rootId == null || ref.getSplitReferenceId() != rootId) {
                ids.add(ref.getSplitReferenceId());
            }
        }
        return ids;
    }
}
