package com.system.allocator.schemas;

import com.system.allocator.bll.dto.CandidateResultDTO;
import com.system.allocator.schemas.algorithm.Genetic.TerminationReason;
import lombok.*;
import java.time.LocalDateTime;
import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentResultSchema {
    private Boolean success;
    private String message;
    private AssignmentErrorType errorType;   // null on success

    // Execution metrics
    private LocalDateTime executionStartTime;
    private LocalDateTime executionEndTime;
    private Long executionTimeMillis;
    private Integer generationsRun;
    private TerminationReason terminationReason;

    // Problem shape
    private Integer rows;
    private Integer cols;
    private Integer maxAssignments;

    // Best candidates, ascending by distance
    private List<CandidateResultDTO> candidates;
}
