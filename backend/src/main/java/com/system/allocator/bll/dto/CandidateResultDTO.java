package com.system.allocator.bll.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One of the top candidates returned by a run.
 * {@code solution} and {@code assignmentRating} are only filled for raw-matrix input.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CandidateResultDTO {
    private Double totalCost;
    private Double distance;
    private List<AssignmentPairDTO> assignment;
    private int[][] solution;
    private Double assignmentRating;
    private ResultStatsDTO stats;
}
