package com.system.allocator.schemas.algorithm.Genetic;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.system.allocator.schemas.algorithm.Genetic.GeneticTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

public class MutationOperatorTest {

    private static final double[][] COSTS = {
        {4, 1, 3},
        {2, 0, 5},
        {3, 2, 2}
    };

    private MutationOperator operator(GeneticContext context) {
        PopulationInitializer initializer = new PopulationInitializer(context);
        return new MutationOperator(context, initializer, new DistanceEvaluator(context));
    }

    private List<Candidate> unevaluatedPopulation(int size) {
        List<Candidate> population = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            population.add(candidate(pair(0, 0, 4), pair(1, 1, 0), pair(2, 2, 2)));
        }
        return population;
    }

    @Test
    public void testZeroChanceLeavesPopulationAlone() {
        GeneticContext context = context(COSTS, 4L);
        List<Candidate> population = unevaluatedPopulation(10);
        List<List<Assignment>> before = new ArrayList<>();
        population.forEach(c -> before.add(c.getAssignment()));

        List<Candidate> result = operator(context).mutate(population, 0.0);

        assertSame(population, result);
        for (int i = 0; i < population.size(); i++) {
            assertSame(before.get(i), population.get(i).getAssignment());
            assertFalse(population.get(i).isEvaluated());
        }
    }

    @Test
    public void testFullChanceReplacesEveryCandidate() {
        GeneticContext context = context(COSTS, 4L);
        List<Candidate> population = unevaluatedPopulation(10);
        List<List<Assignment>> before = new ArrayList<>();
        population.forEach(c -> before.add(c.getAssignment()));

        operator(context).mutate(population, 1.0);

        for (int i = 0; i < population.size(); i++) {
            Candidate mutated = population.get(i);
            assertNotSame(before.get(i), mutated.getAssignment());
            assertTrue(mutated.isEvaluated());
            assertEquals(Candidate.calculateTotalCost(mutated.getAssignment()), mutated.getTotalCost());
            assertEquals(DistanceEvaluator.calculateDistance(mutated.getTotalCost(), 3, 0), mutated.getDistance());
        }
    }
}
