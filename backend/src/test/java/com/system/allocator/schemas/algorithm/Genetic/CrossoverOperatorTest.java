package com.system.allocator.schemas.algorithm.Genetic;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.system.allocator.schemas.algorithm.Genetic.GeneticTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

public class CrossoverOperatorTest {

    private static final double[][] THREE_BY_THREE = {
        {1, 2, 3},
        {2, 1, 3},
        {3, 3, 1}
    };

    private final CrossoverOperator crossover = new CrossoverOperator(context(THREE_BY_THREE, 3L));

    @Test
    public void testSingleParentIsReturnedUnchanged() {
        Candidate parent = candidate(pair(0, 1, 2), pair(1, 2, 3), pair(2, 0, 3));
        List<Candidate> parents = List.of(parent);

        List<Candidate> result = crossover.crossover(parents);

        assertSame(parents, result);
        assertSame(parent, result.get(0));
    }

    @Test
    public void testCheapestPairingsFormTheFirstOffspring() {
        Candidate shifted = candidate(pair(0, 1, 2), pair(1, 2, 3), pair(2, 0, 3));
        Candidate diagonal = candidate(pair(0, 0, 1), pair(1, 1, 1), pair(2, 2, 1));

        List<Candidate> result = crossover.crossover(List.of(shifted, diagonal));

        // two offspring (the second one padded if needed) followed by the two parents
        assertEquals(4, result.size());
        Candidate first = result.get(0);
        assertEquals(3.0, first.getTotalCost());
        assertEquals(List.of(pair(0, 0, 1), pair(1, 1, 1), pair(2, 2, 1)), first.getAssignment());
        assertEquals(shifted.getAssignment(), result.get(2).getAssignment());
        assertEquals(diagonal.getAssignment(), result.get(3).getAssignment());
    }

    @Test
    public void testOffspringNeverRepeatRowOrColumn() {
        Candidate a = candidate(pair(0, 1, 2), pair(1, 2, 3), pair(2, 0, 3));
        Candidate b = candidate(pair(0, 2, 3), pair(1, 0, 2), pair(2, 1, 3));
        Candidate c = candidate(pair(0, 0, 1), pair(1, 1, 1), pair(2, 2, 1));
        Candidate d = candidate(pair(0, 1, 2), pair(1, 2, 3), pair(2, 0, 3));

        List<Candidate> result = crossover.crossover(List.of(a, b, c, d));

        assertEquals(8, result.size());
        for (Candidate offspring : result) {
            assertTrue(offspring.getAssignment().size() <= 3);
            Set<Integer> rows = new HashSet<>();
            Set<Integer> cols = new HashSet<>();
            for (Assignment pairing : offspring.getAssignment()) {
                assertTrue(rows.add(pairing.getRow()), "row repeated in " + offspring);
                assertTrue(cols.add(pairing.getCol()), "column repeated in " + offspring);
            }
            assertEquals(Candidate.calculateTotalCost(offspring.getAssignment()), offspring.getTotalCost());
        }
    }

    @Test
    public void testNoCompletableOffspringReturnsParents() {
        // Every pairing sits in row 0, so no offspring of length 2 can be built
        Candidate a = new Candidate(List.of(pair(0, 0, 1), pair(0, 1, 1)));
        Candidate b = new Candidate(List.of(pair(0, 2, 1), pair(0, 0, 1)));
        List<Candidate> parents = List.of(a, b);

        List<Candidate> result = crossover.crossover(parents);

        assertSame(parents, result);
    }

    @Test
    public void testMissingOffspringArePaddedWithDuplicates() {
        // Shifted permutations only: the pool yields one full offspring, the rest are dropped
        Candidate a = candidate(pair(0, 1, 2), pair(1, 2, 3), pair(2, 0, 3));
        Candidate b = candidate(pair(0, 2, 3), pair(1, 0, 2), pair(2, 1, 3));
        Candidate c = candidate(pair(0, 1, 2), pair(1, 2, 3), pair(2, 0, 3));

        List<Candidate> result = crossover.crossover(List.of(a, b, c));

        assertEquals(6, result.size());
        List<Assignment> onlyOffspring = List.of(pair(0, 1, 2), pair(1, 2, 3), pair(2, 0, 3));
        for (int i = 0; i < 3; i++) {
            assertEquals(onlyOffspring, result.get(i).getAssignment());
        }
        assertNotSame(result.get(0), result.get(1));
        assertNotSame(result.get(0), result.get(2));
    }

    @Test
    public void testLowestCostTieGoesToFirstOccurrence() {
        List<Assignment> pool = List.of(pair(0, 1, 5), pair(1, 0, 2), pair(2, 2, 2), pair(1, 1, 2));

        assertEquals(1, CrossoverOperator.findLowestCostValidIndex(pool, List.of()));
        // row 1 is taken, so the next 2-cost pairing wins
        assertEquals(2, CrossoverOperator.findLowestCostValidIndex(pool, List.of(pair(1, 0, 2))));
        assertEquals(-1, CrossoverOperator.findLowestCostValidIndex(List.of(pair(0, 0, 1)), List.of(pair(0, 2, 1))));
    }
}
