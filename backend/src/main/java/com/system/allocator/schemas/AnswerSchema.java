package com.system.allocator.schemas;

import lombok.*;

/**
 * One survey answer: how much it costs to give {@code taskId} to the answering agent.
 * Lower cost means a stronger preference.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerSchema {
    private String taskId;
    private String taskName;
    private Double cost;
}
