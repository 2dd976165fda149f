package com.system.allocator.bll.service;

import com.system.allocator.config.GeneticProperties;
import com.system.allocator.schemas.GeneticOptionsSchema;
import com.system.allocator.schemas.algorithm.Genetic.GeneticOptions;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fills the options a request leaves out with the configured defaults.
 */
@Service
@RequiredArgsConstructor
public class GeneticOptionsResolver {

  private final GeneticProperties properties;

  public GeneticOptions resolve(GeneticOptionsSchema requested) {
    GeneticOptionsSchema r = requested != null ? requested : new GeneticOptionsSchema();

    return GeneticOptions.builder()
        .maxGenerations(r.getMaxGenerations() != null ? r.getMaxGenerations() : properties.getMaxGenerations())
        .mutationChance(r.getMutationChance() != null ? r.getMutationChance() : properties.getMutationChance())
        .returnedCandidates(r.getReturnedCandidates() != null ? r.getReturnedCandidates() : properties.getReturnedCandidates())
        .populationSize(r.getPopulationSize() != null ? r.getPopulationSize() : properties.getPopulationSize())
        .distanceThreshold(r.getDistanceThreshold() != null ? r.getDistanceThreshold() : properties.getDistanceThreshold())
        .groups(r.getGroups() != null ? r.getGroups() : List.of())
        .seed(r.getSeed() != null ? r.getSeed() : properties.getSeed())
        .loggingEnabled(r.getLoggingEnabled() != null ? r.getLoggingEnabled() : properties.isLoggingEnabled())
        .build();
  }

  public GeneticOptionsSchema defaults() {
    return GeneticOptionsSchema.builder()
        .maxGenerations(properties.getMaxGenerations())
        .mutationChance(properties.getMutationChance())
        .returnedCandidates(properties.getReturnedCandidates())
        .populationSize(properties.getPopulationSize())
        .distanceThreshold(properties.getDistanceThreshold())
        .groups(List.of())
        .seed(properties.getSeed())
        .loggingEnabled(properties.isLoggingEnabled())
        .build();
  }
}
