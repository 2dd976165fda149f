package com.system.allocator.schemas.algorithm.Genetic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Replaces whole solutions at random. A mutated candidate keeps nothing of its previous
 * assignment.
 */
public class MutationOperator {

    private static final Logger logger = LoggerFactory.getLogger(MutationOperator.class);

    private final GeneticContext context;
    private final PopulationInitializer initializer;
    private final DistanceEvaluator evaluator;

    public MutationOperator(GeneticContext context, PopulationInitializer initializer, DistanceEvaluator evaluator) {
        this.context = context;
        this.initializer = initializer;
        this.evaluator = evaluator;
    }

    /**
     * @param candidates population, changed in place
     * @param mutationChance probability in [0, 1] that a candidate is replaced
     * @return the same list
     */
    public List<Candidate> mutate(List<Candidate> candidates, double mutationChance) {
        int mutationsThisGeneration = 0;
        for (Candidate candidate : candidates) {
            if (context.getRandom().realBetween(0, 1) < mutationChance) {
                mutationsThisGeneration++;
                candidate.replaceAssignment(initializer.randomAssignment());
                evaluator.evaluate(candidate);
            }
        }
        if (context.isLoggingEnabled()) {
            logger.debug("\tMutated: {}", mutationsThisGeneration);
        }
        return candidates;
    }
}
