package com.system.allocator.bll.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named agent-to-task pairing of a returned candidate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentPairDTO {
    private AgentDTO agent;
    private TaskDTO task;
    private Double cost;
}
