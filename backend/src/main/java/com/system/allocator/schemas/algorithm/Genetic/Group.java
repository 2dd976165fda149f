package com.system.allocator.schemas.algorithm.Genetic;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A set of task columns that together may receive at most {@code maxAssignments} pairings.
 */
@Getter
@ToString
public final class Group {
    private final String name;
    private final Set<Integer> cols;
    private final int maxAssignments;

    public Group(String name, List<Integer> cols, int maxAssignments) {
        this.name = name;
        this.cols = Collections.unmodifiableSet(new LinkedHashSet<>(cols));
        this.maxAssignments = maxAssignments;
    }

    public boolean covers(int col) {
        return cols.contains(col);
    }

    /**
     * Number of pairings in {@code assignment} that land on one of this group's columns.
     */
    public int countAssignments(List<Assignment> assignment) {
        int count = 0;
        for (Assignment a : assignment) {
            if (covers(a.getCol())) {
                count++;
            }
        }
        return count;
    }
}
