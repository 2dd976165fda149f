package com.system.allocator.schemas.algorithm.Genetic;

import com.system.allocator.schemas.GroupSchema;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Resolved options of one run. Built after request values have been merged over the
 * configured defaults, so every field is set.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class GeneticOptions {
    private final int maxGenerations;
    private final double mutationChance;
    private final int returnedCandidates;
    private final int populationSize;
    private final double distanceThreshold;
    private final List<GroupSchema> groups;
    private final String seed;
    @Builder.Default
    private final boolean loggingEnabled = true;
}
