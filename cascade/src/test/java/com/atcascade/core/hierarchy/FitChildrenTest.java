package com.atcascade.core.hierarchy;

import com.atcascade.core.CascadeFixtures;
import com.atcascade.core.InvalidGoalSetException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.atcascade.core.CascadeFixtures.ids;
import static org.junit.jupiter.api.Assertions.*;

public class FitChildrenTest {

    private final NodeHierarchy h = CascadeFixtures.sevenNodes();

    @Test
    public void testOnlyNodesLeadingToGoals() {
        FitChildren fc = FitChildren.compute(h, 0, ids(5, 3));
        assertEquals(List.of(1, 2), fc.of(0));
        assertEquals(List.of(3), fc.of(1));
        assertEquals(List.of(5), fc.of(2));
        assertTrue(fc.of(3).isEmpty());
        assertTrue(fc.of(4).isEmpty());
    }

    @Test
    public void testGoalAtInteriorNodeIsNotDescended() {
        FitChildren fc = FitChildren.compute(h, 0, ids(1, 6));
        assertEquals(List.of(1, 2), fc.of(0));
        assertTrue(fc.of(1).isEmpty());
        assertEquals(List.of(6), fc.of(2));
    }

    @Test
    public void testStartBelowRoot() {
        FitChildren fc = FitChildren.compute(h, 2, ids(5, 6));
        assertEquals(List.of(5, 6), fc.of(2));
        assertTrue(fc.of(0).isEmpty());
    }

    @Test
    public void testInvalidGoalSets() {
        assertThrows(InvalidGoalSetException.class, () -> FitChildren.compute(h, 0, Set.of()));
        assertThrows(InvalidGoalSetException.class, () -> FitChildren.compute(h, 1, ids(5)));
        assertThrows(InvalidGoalSetException.class, () -> FitChildren.compute(h, 0, ids(1, 3)));
        assertThrows(InvalidGoalSetException.class, () -> FitChildren.compute(h, 0, ids(7)));
    }
}
