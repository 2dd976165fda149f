package com.system.allocator.schemas;

import lombok.*;
import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentAssignmentRequest {
    private List<AgentSchema> agents;
    private GeneticOptionsSchema options;
}
