package com.system.allocator.bll.dto;

import com.system.allocator.schemas.algorithm.Genetic.CostMatrix;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Cost matrix plus the names of its rows (agents) and columns (tasks).
 */
@Getter
@AllArgsConstructor
public class ProblemInput {
    private final CostMatrix costMatrix;
    private final List<String> rowNames;
    private final List<String> colNames;
}
