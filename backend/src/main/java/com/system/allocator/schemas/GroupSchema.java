package com.system.allocator.schemas;

import lombok.*;
import java.util.List;

/**
 * Named subset of tasks with a cap on how many of them may be assigned in total.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupSchema {
    private String name;
    private Integer maxAssignments;
    private List<TaskSchema> tasks;
}
