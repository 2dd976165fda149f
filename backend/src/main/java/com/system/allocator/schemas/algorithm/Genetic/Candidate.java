package com.system.allocator.schemas.algorithm.Genetic;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A full proposed solution. The distance is derived: it is cleared whenever the
 * assignment changes and must be evaluated again before it can be read.
 */
@Getter
public class Candidate {

    private List<Assignment> assignment;
    private double totalCost;
    private Double distance;

    public Candidate(List<Assignment> assignment) {
        replaceAssignment(assignment);
    }

    private Candidate(List<Assignment> assignment, double totalCost, Double distance) {
        this.assignment = assignment;
        this.totalCost = totalCost;
        this.distance = distance;
    }

    public static double calculateTotalCost(List<Assignment> assignment) {
        double total = 0;
        for (Assignment a : assignment) {
            total += a.getCost();
        }
        return total;
    }

    /**
     * Swaps in a new solution and recomputes its cost. The distance becomes stale.
     */
    public void replaceAssignment(List<Assignment> newAssignment) {
        this.assignment = Collections.unmodifiableList(new ArrayList<>(newAssignment));
        this.totalCost = calculateTotalCost(this.assignment);
        this.distance = null;
    }

    void setDistance(double distance) {
        this.distance = distance;
    }

    public boolean isEvaluated() {
        return distance != null;
    }

    public double getDistance() {
        if (distance == null) {
            throw new IllegalStateException("Candidate distance has not been evaluated");
        }
        return distance;
    }

    /**
     * True when no two pairings share a row or a column and the length matches.
     */
    public boolean isStructurallyValid(int maxAssignments) {
        if (assignment.size() != maxAssignments) {
            return false;
        }
        Set<Integer> rows = new HashSet<>();
        Set<Integer> cols = new HashSet<>();
        for (Assignment a : assignment) {
            if (!rows.add(a.getRow()) || !cols.add(a.getCol())) {
                return false;
            }
        }
        return true;
    }

    public Candidate copy() {
        return new Candidate(assignment, totalCost, distance);
    }

    @Override
    public String toString() {
        return "Candidate{totalCost=" + totalCost + ", distance=" + distance + ", assignment=" + assignment + "}";
    }
}
