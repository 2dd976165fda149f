package com.system.allocator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Default genetic options, bound from {@code genetic.*} in application.properties.
 */
@Data
@ConfigurationProperties(prefix = "genetic")
public class GeneticProperties {

    /**
     * Upper bound on the number of generations per run.
     */
    private int maxGenerations = Constants.DEFAULT_MAX_GENERATIONS;

    /**
     * Probability in [0, 1] that a candidate is replaced by a random one each generation.
     */
    private double mutationChance = Constants.DEFAULT_MUTATION_CHANCE;

    /**
     * Number of best candidates returned to the caller.
     */
    private int returnedCandidates = Constants.DEFAULT_RETURNED_CANDIDATES;

    private int populationSize = Constants.DEFAULT_POPULATION_SIZE;

    /**
     * A run stops early once the best distance is below this value.
     */
    private double distanceThreshold = Constants.DEFAULT_DISTANCE_THRESHOLD;

    /**
     * Seed used when a request does not carry one. Empty means non-reproducible runs.
     */
    private String seed;

    private boolean loggingEnabled = true;
}
