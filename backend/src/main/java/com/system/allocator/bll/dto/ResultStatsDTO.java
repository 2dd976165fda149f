package com.system.allocator.bll.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary figures of one returned candidate (used in the result view)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResultStatsDTO {
    private Integer agentsAssigned;
    private Integer tasksAssigned;
    private Integer totalAgents;
    private Integer totalTasks;
    private Double meanCost;
    private Double inverseCostRating;   // mean of 1/cost
    private Double assignmentRating;    // share of pairings below the rating cost limit
}
