package com.system.allocator.schemas;

import lombok.*;
import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSchema {
    private String agentId;
    private String email;
    // Same length and task order for every agent
    private List<AnswerSchema> answers;
}
