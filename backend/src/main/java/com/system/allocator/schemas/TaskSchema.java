package com.system.allocator.schemas;

import lombok.*;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSchema {
    private String taskId;
    private String taskName;
}
