package com.atcascade.core;

import com.atcascade.core.hierarchy.NodeHierarchy;
import com.atcascade.core.hierarchy.SplitReferenceTable;
import com.atcascade.core.job.CascadeInputs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Small cascades shared by the tests.
 */
public final class CascadeFixtures {

    private CascadeFixtures() {
    }

    /** n0 is the root; n1, n2 are children of n0; n3, n4 of n1; n5, n6 of n2. */
    public static NodeHierarchy sevenNodes() {
        return NodeHierarchy.fromNames(
                Arrays.asList("n0", "n1", "n2", "n3", "n4", "n5", "n6"),
                Arrays.asList(null, "n0", "n0", "n1", "n1", "n2", "n2"));
    }

    /** n0 -> n1 -> ... -> n(size-1) */
    public static NodeHierarchy chain(int size) {
        List<String> names = new ArrayList<>();
        List<String> parents = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            names.add("n" + i);
            parents.add(i == 0 ? null : "n" + (i - 1));
        }
        return NodeHierarchy.fromNames(names, parents);
    }

    /** female = 0, both = 1 (root), male = 2 */
    public static SplitReferenceTable sexSplit() {
        return SplitReferenceTable.of(
                List.of("female", "both", "male"),
                List.of(-0.5, 0.0, 0.5),
                "both");
    }

    public static Set<Integer> ids(Integer... ids) {
        return new LinkedHashSet<>(Arrays.asList(ids));
    }

    /**
     * Seven nodes split by sex at n1 with goals n3..n6: eleven jobs.
     */
    public static CascadeInputs splitAtN1(boolean refitSplit, int maxNumberCpu) {
        SplitReferenceTable split = sexSplit();
        return new CascadeInputs(
                sevenNodes(),
                split,
                ids(1),
                0,
                split.rootId(),
                ids(3, 4, 5, 6),
                refitSplit,
                maxNumberCpu,
                null);
    }
}
