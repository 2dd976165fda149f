package com.system.allocator.schemas.algorithm.Genetic;

public enum TerminationReason {
    MAX_GENERATIONS,    // every generation was run
    DISTANCE_THRESHOLD  // best distance dropped below the threshold
}
