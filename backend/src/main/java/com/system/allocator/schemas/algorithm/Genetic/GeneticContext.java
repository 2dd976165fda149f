package com.system.allocator.schemas.algorithm.Genetic;

import com.system.allocator.exceptions.AlgorithmFailureException;
import com.system.allocator.schemas.GroupSchema;
import com.system.allocator.schemas.TaskSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one genetic run reads: the cost matrix, the group constraints derived
 * from task names, the assignment bounds and the run's random source.
 * A context is owned by exactly one run and is never shared between runs.
 */
public class GeneticContext {

    private final CostMatrix costMatrix;
    private final List<Group> groups;
    private final int maxColumnAssignments;
    private final int maxAssignments;
    private final SeededRandom random;
    private final boolean loggingEnabled;

    private GeneticContext(CostMatrix costMatrix, List<Group> groups, SeededRandom random, boolean loggingEnabled) {
        this.costMatrix = costMatrix;
        this.groups = Collections.unmodifiableList(groups);
        this.random = random;
        this.loggingEnabled = loggingEnabled;
        this.maxColumnAssignments = maxColumnAssignments(costMatrix.getCols(), this.groups);
        this.maxAssignments = Math.min(costMatrix.getRows(), maxColumnAssignments);

        if (maxAssignments < 1) {
            throw new AlgorithmFailureException("No assignable pairings: rows=" + costMatrix.getRows()
                + ", maxColumnAssignments=" + maxColumnAssignments);
        }
    }

    public static GeneticContext create(CostMatrix costMatrix, List<String> colNames,
                                        GeneticOptions options) {
        return create(costMatrix, colNames, options.getGroups(),
            SeededRandom.fromSeed(options.getSeed()), options.isLoggingEnabled());
    }

    public static GeneticContext create(CostMatrix costMatrix, List<String> colNames, List<GroupSchema> groups,
                                        SeededRandom random, boolean loggingEnabled) {
        return new GeneticContext(costMatrix, toGroups(groups, colNames), random, loggingEnabled);
    }

    /**
     * Maps each group's task identifiers to column indices of the cost matrix.
     */
    static List<Group> toGroups(List<GroupSchema> groups, List<String> colNames) {
        List<Group> result = new ArrayList<>();
        if (groups == null) {
            return result;
        }
        for (int g = 0; g < groups.size(); g++) {
            GroupSchema schema = groups.get(g);
            List<Integer> cols = new ArrayList<>();
            for (TaskSchema task : schema.getTasks()) {
                int index = colNames.indexOf(task.getTaskId());
                if (index < 0) {
                    throw new IllegalArgumentException("Group task " + task.getTaskId() + " is not a known task");
                }
                cols.add(index);
            }
            String name = schema.getName() != null ? schema.getName() : "group-" + g;
            result.add(new Group(name, cols, schema.getMaxAssignments()));
        }
        return result;
    }

    /**
     * Columns outside every group can each take one pairing; each group adds its cap.
     * Groups are assumed not to overlap.
     */
    static int maxColumnAssignments(int cols, List<Group> groups) {
        if (groups.isEmpty()) {
            return cols;
        }
        int constrainedColumns = 0;
        int allowedInGroups = 0;
        for (Group group : groups) {
            constrainedColumns += group.getCols().size();
            allowedInGroups += group.getMaxAssignments();
        }
        return (cols - constrainedColumns) + allowedInGroups;
    }

    public CostMatrix getCostMatrix() {
        return costMatrix;
    }

    public List<Group> getGroups() {
        return groups;
    }

    public int getMaxColumnAssignments() {
        return maxColumnAssignments;
    }

    public int getMaxAssignments() {
        return maxAssignments;
    }

    public SeededRandom getRandom() {
        return random;
    }

    public boolean isLoggingEnabled() {
        return loggingEnabled;
    }
}
