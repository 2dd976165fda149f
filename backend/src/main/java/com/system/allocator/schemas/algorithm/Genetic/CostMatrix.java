package com.system.allocator.schemas.algorithm.Genetic;

/**
 * Rectangular, read-only grid of costs. Rows are agents, columns are tasks.
 */
public final class CostMatrix {

    private final double[][] costs;
    private final int rows;
    private final int cols;

    public CostMatrix(double[][] costs) {
        if (costs == null || costs.length == 0 || costs[0] == null || costs[0].length == 0) {
            throw new IllegalArgumentException("Cost matrix must have at least one row and one column");
        }
        this.rows = costs.length;
        this.cols = costs[0].length;
        this.costs = new double[rows][];
        for (int i = 0; i < rows; i++) {
            if (costs[i] == null || costs[i].length != cols) {
                throw new IllegalArgumentException("Cost matrix row " + i + " does not have " + cols + " columns");
            }
            this.costs[i] = costs[i].clone();
        }
    }

    public double cost(int row, int col) {
        return costs[row][col];
    }

    public Assignment pairing(int row, int col) {
        return new Assignment(row, col, costs[row][col]);
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }
}
