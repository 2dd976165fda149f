package com.system.allocator.schemas.algorithm.Genetic;

import com.system.allocator.schemas.GroupSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.system.allocator.schemas.algorithm.Genetic.GeneticTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

public class GeneticSolverTest {

    private static final double[][] THREE_BY_THREE = {
        {1, 2, 3},
        {2, 1, 3},
        {3, 3, 1}
    };

    private static GeneticOptions options(int populationSize, int maxGenerations, double threshold,
                                          String seed, GroupSchema... groups) {
        return GeneticOptions.builder()
            .populationSize(populationSize)
            .maxGenerations(maxGenerations)
            .distanceThreshold(threshold)
            .mutationChance(0.3)
            .returnedCandidates(3)
            .groups(List.of(groups))
            .seed(seed)
            .loggingEnabled(false)
            .build();
    }

    private static GeneticRunResult solve(double[][] costs, GeneticOptions options) {
        CostMatrix matrix = new CostMatrix(costs);
        GeneticContext context = GeneticContext.create(matrix, colNames(matrix.getCols()), options);
        return new GeneticSolver(context, options).solve();
    }

    @Test
    public void testConvergesToTheDiagonal() {
        GeneticRunResult result = solve(THREE_BY_THREE, options(10, 20, 1.01, "42"));

        Candidate best = result.getBest();
        assertEquals(3.0, best.getTotalCost());
        assertEquals(2.0, best.getDistance());
        assertEquals(List.of(pair(0, 0, 1), pair(1, 1, 1), pair(2, 2, 1)),
            best.getAssignment().stream()
                .sorted((a, b) -> Integer.compare(a.getRow(), b.getRow()))
                .collect(Collectors.toList()));
        // (1 + 1)^1 never drops below 1.01, so every generation runs
        assertEquals(TerminationReason.MAX_GENERATIONS, result.getTerminationReason());
        assertEquals(20, result.getGenerationsRun());
    }

    @Test
    public void testStopsOnceBelowThreshold() {
        GeneticRunResult result = solve(THREE_BY_THREE, options(10, 50, 100.0, "42"));

        assertEquals(TerminationReason.DISTANCE_THRESHOLD, result.getTerminationReason());
        assertEquals(1, result.getGenerationsRun());
    }

    @Test
    public void testPopulationIsSortedAndEvaluated() {
        GeneticRunResult result = solve(THREE_BY_THREE, options(9, 5, 0.0, "3"));

        List<Candidate> population = result.getPopulation();
        // ceil(9 / 2) parents breed 5 offspring, so an odd population grows to the next even size
        assertEquals(10, population.size());
        for (int i = 1; i < population.size(); i++) {
            assertTrue(population.get(i - 1).getDistance() <= population.get(i).getDistance());
        }
        for (Candidate candidate : population) {
            assertTrue(candidate.isStructurallyValid(3));
            assertEquals(DistanceEvaluator.calculateDistance(candidate.getTotalCost(), 3, 0), candidate.getDistance());
        }
    }

    @Test
    public void testSingleParentFallsBackToMutatedPopulation() {
        GeneticOptions options = options(2, 1, 0.0, "fallback");
        CostMatrix matrix = new CostMatrix(THREE_BY_THREE);
        GeneticContext context = GeneticContext.create(matrix, colNames(matrix.getCols()), options);
        GeneticSolver solver = new GeneticSolver(context, options);
        List<Candidate> population = new PopulationInitializer(context).generatePopulation(2);

        // two candidates give a single parent, which crossover cannot breed from
        List<Candidate> next = solver.advanceGeneration(new DistanceEvaluator(context).evaluateAll(population));

        assertEquals(2, next.size());
        for (Candidate candidate : next) {
            assertTrue(population.stream().anyMatch(original -> original == candidate));
            assertTrue(candidate.isEvaluated());
            assertTrue(candidate.isStructurallyValid(3));
            assertEquals(DistanceEvaluator.calculateDistance(candidate.getTotalCost(), 3, 0), candidate.getDistance());
        }
    }

    @Test
    public void testPopulationOfTwoKeepsItsSizeAcrossGenerations() {
        GeneticRunResult result = solve(THREE_BY_THREE, options(2, 10, 0.0, "fallback"));

        assertEquals(10, result.getGenerationsRun());
        assertEquals(2, result.getPopulation().size());
        for (Candidate candidate : result.getPopulation()) {
            assertTrue(candidate.isEvaluated());
        }
    }

    @Test
    public void testSameSeedSameRun() {
        GeneticRunResult first = solve(THREE_BY_THREE, options(12, 15, 0.0, "seed-1"));
        GeneticRunResult second = solve(THREE_BY_THREE, options(12, 15, 0.0, "seed-1"));

        assertEquals(first.getPopulation().size(), second.getPopulation().size());
        for (int i = 0; i < first.getPopulation().size(); i++) {
            Candidate a = first.getPopulation().get(i);
            Candidate b = second.getPopulation().get(i);
            assertEquals(a.getAssignment(), b.getAssignment());
            assertEquals(a.getDistance(), b.getDistance());
        }
    }

    @Test
    public void testGroupCapsAreRespectedByTheBestCandidate() {
        double[][] fourByFour = {
            {1, 2, 1, 2},
            {2, 1, 2, 1},
            {1, 2, 2, 1},
            {2, 1, 1, 2}
        };
        GroupSchema first = group(1, "t0", "t1");
        GroupSchema second = group(1, "t2", "t3");

        GeneticRunResult result = solve(fourByFour, options(20, 30, 0.0, "9", first, second));

        Candidate best = result.getBest();
        assertEquals(2, best.getAssignment().size());
        long inFirst = best.getAssignment().stream().filter(a -> a.getCol() <= 1).count();
        long inSecond = best.getAssignment().stream().filter(a -> a.getCol() >= 2).count();
        assertEquals(1, inFirst);
        assertEquals(1, inSecond);
        assertTrue(best.getDistance() <= 3.0);
    }
}
