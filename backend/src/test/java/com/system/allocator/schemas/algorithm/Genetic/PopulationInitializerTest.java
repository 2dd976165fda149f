package com.system.allocator.schemas.algorithm.Genetic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.system.allocator.schemas.algorithm.Genetic.GeneticTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

public class PopulationInitializerTest {

    private static final double[][] THREE_BY_FIVE = {
        {1, 2, 3, 4, 5},
        {5, 4, 3, 2, 1},
        {2, 2, 2, 2, 2}
    };

    @Test
    public void testPopulationHasRequestedSize() {
        PopulationInitializer initializer = new PopulationInitializer(context(THREE_BY_FIVE, 8L));

        List<Candidate> population = initializer.generatePopulation(12);

        assertEquals(12, population.size());
        for (Candidate candidate : population) {
            assertEquals(3, candidate.getAssignment().size());
            assertTrue(candidate.isStructurallyValid(3));
            assertEquals(Candidate.calculateTotalCost(candidate.getAssignment()), candidate.getTotalCost());
        }
    }

    @Test
    public void testRandomAssignmentWalksDiagonallyWithWrap() {
        PopulationInitializer initializer = new PopulationInitializer(context(THREE_BY_FIVE, 21L));

        for (int run = 0; run < 30; run++) {
            List<Assignment> assignment = initializer.randomAssignment();
            for (int i = 1; i < assignment.size(); i++) {
                Assignment previous = assignment.get(i - 1);
                Assignment current = assignment.get(i);
                assertEquals((previous.getRow() + 1) % 3, current.getRow());
                assertEquals((previous.getCol() + 1) % 5, current.getCol());
                assertEquals(THREE_BY_FIVE[current.getRow()][current.getCol()], current.getCost());
            }
        }
    }

    @Test
    public void testGroupCapsShortenTheAssignment() {
        double[][] fourByFour = {
            {1, 1, 1, 1},
            {1, 1, 1, 1},
            {1, 1, 1, 1},
            {1, 1, 1, 1}
        };
        GeneticContext context = context(fourByFour, 2L, group(1, "t0", "t1"), group(1, "t2", "t3"));
        PopulationInitializer initializer = new PopulationInitializer(context);

        assertEquals(2, context.getMaxAssignments());
        for (Candidate candidate : initializer.generatePopulation(10)) {
            assertEquals(2, candidate.getAssignment().size());
        }
    }

    @Test
    public void testSameSeedSamePopulation() {
        List<Candidate> first = new PopulationInitializer(context(THREE_BY_FIVE, 77L)).generatePopulation(8);
        List<Candidate> second = new PopulationInitializer(context(THREE_BY_FIVE, 77L)).generatePopulation(8);

        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).getAssignment(), second.get(i).getAssignment());
        }
    }
}
