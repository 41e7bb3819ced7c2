package com.atcascade.core.job;

import com.atcascade.core.CascadeFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

public class JobRelationsTest {

    // jobs 3 and 4 split n1 into female and male; job 7 is n3.female below job 3
    private final JobTable table = CascadeFixtures.splitAtN1(false, 1).buildJobTable();

    @Test
    public void testGenerationWithoutRefitSplit() {
        JobRelations relations = new JobRelations(table, false);
        assertEquals(OptionalInt.of(0), relations.descendantGeneration(0, 0));
        assertEquals(OptionalInt.of(1), relations.descendantGeneration(0, 1));
        assertEquals(OptionalInt.of(0), relations.descendantGeneration(1, 3));
        assertEquals(OptionalInt.of(2), relations.descendantGeneration(0, 7));
        assertEquals(OptionalInt.of(2), relations.descendantGeneration(0, 5));
    }

    @Test
    public void testGenerationWithRefitSplit() {
        JobRelations relations = new JobRelations(table, true);
        assertEquals(OptionalInt.of(0), relations.descendantGeneration(3, 3));
        assertEquals(OptionalInt.of(1), relations.descendantGeneration(1, 3));
        assertEquals(OptionalInt.of(3), relations.descendantGeneration(0, 7));
        assertEquals(OptionalInt.of(1), relations.descendantGeneration(3, 7));
        // same split all the way down
        assertEquals(OptionalInt.of(2), relations.descendantGeneration(0, 5));
    }

    @Test
    public void testNotADescendant() {
        JobRelations relations = new JobRelations(table, true);
        assertFalse(relations.descendantGeneration(2, 7).isPresent());
        assertFalse(relations.descendantGeneration(5, 2).isPresent());
        assertFalse(relations.descendantGeneration(3, 9).isPresent());
    }

    @Test
    public void testAncestorsAndDescendants() {
        JobRelations relations = new JobRelations(table, false);
        assertEquals(List.of(3, 4, 7, 8, 9, 10), relations.descendants(1));
        assertEquals(List.of(5, 6), relations.descendants(2));
        assertTrue(relations.descendants(10).isEmpty());
        assertEquals(List.of(4, 1, 0), relations.ancestors(9));
        assertTrue(relations.ancestors(0).isEmpty());
        assertTrue(relations.isAncestorOrSelf(1, 9));
        assertTrue(relations.isAncestorOrSelf(9, 9));
        assertFalse(relations.isAncestorOrSelf(2, 9));
    }
}
