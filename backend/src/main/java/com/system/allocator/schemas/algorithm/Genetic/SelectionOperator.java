package com.system.allocator.schemas.algorithm.Genetic;

import java.util.ArrayList;
import java.util.List;

/**
 * Fitness proportionate (roulette wheel) selection. Distance is minimised, so each
 * candidate is weighted by the inverse of its distance.
 */
public class SelectionOperator {

    private final SeededRandom random;

    public SelectionOperator(GeneticContext context) {
        this(context.getRandom());
    }

    public SelectionOperator(SeededRandom random) {
        this.random = random;
    }

    /**
     * Draws ceil(n / 2) parents with replacement; a candidate may be picked several times.
     */
    public List<Candidate> selectParents(List<Candidate> population) {
        double totalDistance = 0;
        for (Candidate candidate : population) {
            totalDistance += candidate.getDistance();
        }

        double[] weights = new double[population.size()];
        for (int i = 0; i < population.size(); i++) {
            double distance = population.get(i).getDistance();
            weights[i] = totalDistance / (distance * totalDistance);
        }

        int parentCount = (population.size() + 1) / 2;
        List<Candidate> parents = new ArrayList<>(parentCount);
        while (parents.size() < parentCount) {
            parents.add(population.get(selectByRoulette(weights)));
        }
        return parents;
    }

    /**
     * Spins the wheel once. The scan runs from the last index down to 1, subtracting each
     * weight from the drawn point; what is left over lands on index 0.
     */
    public int selectByRoulette(double[] weights) {
        double totalWeight = 0;
        for (double weight : weights) {
            totalWeight += weight;
        }

        double section = random.realBetween(0, totalWeight);
        for (int i = weights.length - 1; i > 0; i--) {
            section -= weights[i];
            if (section < 0) {
                return i;
            }
        }
        return 0;
    }
}
