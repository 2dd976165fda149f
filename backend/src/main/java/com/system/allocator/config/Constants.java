package com.system.allocator.config;

public class Constants {
    // Genetic defaults, used when neither the request nor application.properties sets a value
    public static final int DEFAULT_MAX_GENERATIONS = 15;
    public static final double DEFAULT_MUTATION_CHANCE = 0.3;
    public static final int DEFAULT_RETURNED_CANDIDATES = 3;
    public static final int DEFAULT_POPULATION_SIZE = 30;
    public static final double DEFAULT_DISTANCE_THRESHOLD = 3.0;

    // A pairing below this cost counts as a good match in the assignment rating
    public static final double ASSIGNMENT_RATING_COST_LIMIT = 3.0;

    // Placeholder names for raw matrices submitted without names
    public static final String PLACEHOLDER_AGENT_PREFIX = "Agent ";
    public static final String PLACEHOLDER_TASK_PREFIX = "Task ";
}
