package com.system.allocator.schemas.algorithm.Genetic;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One agent-to-task pairing: the cell (row, col) of the cost matrix and its cost.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class Assignment {
    private final int row;
    private final int col;
    private final double cost;

    public boolean conflictsWith(Assignment other) {
        return row == other.row || col == other.col;
    }
}
