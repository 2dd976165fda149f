package com.system.allocator.schemas.algorithm.Genetic;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Final population of a run, sorted ascending by distance, with how the run ended.
 */
@Getter
@AllArgsConstructor
public class GeneticRunResult {
    private final List<Candidate> population;
    private final int generationsRun;
    private final TerminationReason terminationReason;

    public Candidate getBest() {
        return population.get(0);
    }
}
