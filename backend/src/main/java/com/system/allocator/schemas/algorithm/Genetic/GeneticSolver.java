package com.system.allocator.schemas.algorithm.Genetic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Generation loop of the genetic assignment search.
 *
 * <p>Each generation sorts the population, mutates part of it, selects parents by
 * roulette and breeds the next generation through crossover. The loop stops after
 * maxGenerations or as soon as the best distance is below the threshold.
 * A solver is bound to one {@link GeneticContext} and is not meant to be shared.
 */
public class GeneticSolver {

    private static final Logger logger = LoggerFactory.getLogger(GeneticSolver.class);

    static final Comparator<Candidate> BY_DISTANCE = Comparator.comparingDouble(Candidate::getDistance);

    private final GeneticContext context;
    private final GeneticOptions options;
    private final DistanceEvaluator evaluator;
    private final PopulationInitializer initializer;
    private final MutationOperator mutationOperator;
    private final SelectionOperator selectionOperator;
    private final CrossoverOperator crossoverOperator;

    public GeneticSolver(GeneticContext context, GeneticOptions options) {
        this.context = context;
        this.options = options;
        this.evaluator = new DistanceEvaluator(context);
        this.initializer = new PopulationInitializer(context);
        this.mutationOperator = new MutationOperator(context, initializer, evaluator);
        this.selectionOperator = new SelectionOperator(context);
        this.crossoverOperator = new CrossoverOperator(context);
    }

    public GeneticRunResult solve() {
        if (context.isLoggingEnabled()) {
            logger.info("Genetic run: {}x{} matrix, {} groups, maxAssignments={}, populationSize={}, maxGenerations={}, seed={}",
                context.getCostMatrix().getRows(), context.getCostMatrix().getCols(), context.getGroups().size(),
                context.getMaxAssignments(), options.getPopulationSize(), options.getMaxGenerations(),
                context.getRandom().isSeeded() ? context.getRandom().getSeed() : "none");
        }

        List<Candidate> population = initializer.generatePopulation(options.getPopulationSize());
        TerminationReason reason = TerminationReason.MAX_GENERATIONS;
        int generation = 0;

        while (generation < options.getMaxGenerations()) {
            population = sortByDistance(advanceGeneration(evaluator.evaluateAll(population)));

            if (context.isLoggingEnabled()) {
                logger.debug("Generation {}: best distance {}", generation + 1, population.get(0).getDistance());
            }

            if (population.get(0).getDistance() < options.getDistanceThreshold()) {
                reason = TerminationReason.DISTANCE_THRESHOLD;
                generation++;
                break;
            }
            generation++;
        }

        if (!population.get(0).isEvaluated()) {
            // maxGenerations of zero leaves the initial population unscored
            population = sortByDistance(evaluator.evaluateAll(population));
        }

        Candidate best = population.get(0);
        if (context.isLoggingEnabled()) {
            logger.info("Genetic run finished after {} generations ({}): best distance {}, total cost {}",
                generation, reason, best.getDistance(), best.getTotalCost());
        }
        return new GeneticRunResult(population, generation, reason);
    }

    /**
     * sort, mutate, re-evaluate, select, crossover. When crossover cannot refill the
     * population, the mutated population carries on instead.
     */
    List<Candidate> advanceGeneration(List<Candidate> population) {
        List<Candidate> sortedCandidates = sortByDistance(population);
        List<Candidate> mutatedCandidates = sortByDistance(
            evaluator.evaluateAll(mutationOperator.mutate(sortedCandidates, options.getMutationChance())));

        List<Candidate> parents = selectionOperator.selectParents(mutatedCandidates);

        List<Candidate> nextGeneration = crossoverOperator.crossover(parents);
        if (nextGeneration.size() < population.size()) {
            if (context.isLoggingEnabled()) {
                logger.debug("No offspring created");
            }
            nextGeneration = mutatedCandidates;
        }
        return evaluator.evaluateAll(nextGeneration);
    }

    static List<Candidate> sortByDistance(List<Candidate> population) {
        List<Candidate> sorted = new ArrayList<>(population);
        sorted.sort(BY_DISTANCE);
        return sorted;
    }

    public GeneticContext getContext() {
        return context;
    }
}
