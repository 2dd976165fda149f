package com.system.allocator.schemas.algorithm.Genetic;

import com.system.allocator.schemas.GroupSchema;
import com.system.allocator.schemas.TaskSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Builders shared by the genetic operator tests.
 */
final class GeneticTestSupport {

    private GeneticTestSupport() {
    }

    static List<String> colNames(int cols) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < cols; i++) {
            names.add("t" + i);
        }
        return names;
    }

    static GroupSchema group(int maxAssignments, String... taskIds) {
        List<TaskSchema> tasks = new ArrayList<>();
        for (String taskId : taskIds) {
            tasks.add(new TaskSchema(taskId, taskId));
        }
        return new GroupSchema(null, maxAssignments, tasks);
    }

    static GeneticContext context(double[][] costs, long seed, GroupSchema... groups) {
        CostMatrix matrix = new CostMatrix(costs);
        return GeneticContext.create(matrix, colNames(matrix.getCols()), List.of(groups),
            SeededRandom.fromSeed(seed), false);
    }

    static Candidate candidate(Assignment... assignments) {
        return new Candidate(List.of(assignments));
    }

    static Assignment pair(int row, int col, double cost) {
        return new Assignment(row, col, cost);
    }
}
