package com.system.allocator.schemas;

import lombok.*;
import java.util.List;

/**
 * Options as they arrive on a request. Every field is optional; missing ones are
 * taken from the configured defaults.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneticOptionsSchema {
    private Integer maxGenerations;
    private Double mutationChance;      // 0..1
    private Integer returnedCandidates;
    private Integer populationSize;
    private Double distanceThreshold;
    private List<GroupSchema> groups;
    private String seed;                // null = not reproducible
    private Boolean loggingEnabled;
}
