package com.system.allocator.schemas.algorithm.Genetic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds random candidates by walking the cost matrix diagonally.
 */
public class PopulationInitializer {

    private static final Logger logger = LoggerFactory.getLogger(PopulationInitializer.class);

    private final GeneticContext context;

    public PopulationInitializer(GeneticContext context) {
        this.context = context;
    }

    public List<Candidate> generatePopulation(int size) {
        List<Candidate> population = new ArrayList<>(size);
        while (population.size() < size) {
            population.add(new Candidate(randomAssignment()));
        }
        if (context.isLoggingEnabled()) {
            logger.debug("Initial population of {} candidates generated", population.size());
        }
        return population;
    }

    /**
     * Starts at a random cell and steps one row and one column at a time, wrapping at
     * the edges, until maxAssignments pairings are collected.
     *
     * <p>Row and column exclusivity is only as good as the walk: it holds while
     * maxAssignments does not exceed either dimension, which group caps larger than
     * their group can break.
     */
    public List<Assignment> randomAssignment() {
        CostMatrix matrix = context.getCostMatrix();
        int rows = matrix.getRows();
        int cols = matrix.getCols();

        int colIndex = context.getRandom().intBetween(0, cols - 1);
        int rowIndex = context.getRandom().intBetween(0, rows - 1);

        List<Assignment> assignments = new ArrayList<>(context.getMaxAssignments());
        while (assignments.size() < context.getMaxAssignments()) {
            assignments.add(matrix.pairing(rowIndex, colIndex));
            rowIndex = rowIndex + 1 > rows - 1 ? 0 : rowIndex + 1;
            colIndex = colIndex + 1 > cols - 1 ? 0 : colIndex + 1;
        }
        return assignments;
    }
}
