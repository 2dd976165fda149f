package com.system.allocator.schemas.algorithm.Genetic;

import java.util.List;

/**
 * Fitness of a candidate, called distance: the lower, the closer to an ideal assignment.
 *
 * <p>The average pairing cost is raised to the power of the surplus assignments plus one,
 * so a candidate that breaks a group cap is pushed far behind every candidate that does not.
 * A candidate with zero cost and no surplus scores exactly 1.
 */
public class DistanceEvaluator {

    private final List<Group> groups;

    public DistanceEvaluator(GeneticContext context) {
        this(context.getGroups());
    }

    public DistanceEvaluator(List<Group> groups) {
        this.groups = groups;
    }

    public Candidate evaluate(Candidate candidate) {
        int surplus = surplusAssignments(candidate.getAssignment());
        int possible = candidate.getAssignment().size();
        candidate.setDistance(calculateDistance(candidate.getTotalCost(), possible, surplus));
        return candidate;
    }

    public List<Candidate> evaluateAll(List<Candidate> population) {
        for (Candidate candidate : population) {
            evaluate(candidate);
        }
        return population;
    }

    /**
     * Pairings beyond each group's cap, summed over all groups.
     */
    public int surplusAssignments(List<Assignment> assignment) {
        int surplus = 0;
        for (Group group : groups) {
            surplus += Math.max(group.countAssignments(assignment) - group.getMaxAssignments(), 0);
        }
        return surplus;
    }

    public static double calculateDistance(double totalCost, int possibleAssignments, int surplusAssignments) {
        double costTaskRatio = totalCost / possibleAssignments;
        return Math.pow(costTaskRatio + 1, surplusAssignments + 1);
    }
}
