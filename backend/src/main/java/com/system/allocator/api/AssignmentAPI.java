package com.system.allocator.api;

import com.system.allocator.bll.controller.AssignmentController;
import com.system.allocator.bll.service.GeneticOptionsResolver;
import com.system.allocator.schemas.AgentAssignmentRequest;
import com.system.allocator.schemas.AssignmentErrorType;
import com.system.allocator.schemas.AssignmentResultSchema;
import com.system.allocator.schemas.GeneticOptionsSchema;
import com.system.allocator.schemas.MatrixAssignmentRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/assignment")
@RequiredArgsConstructor
public class AssignmentAPI {

  private final AssignmentController assignmentController;
  private final GeneticOptionsResolver optionsResolver;

  /**
   * Assign agents to tasks from survey answers
   * POST /api/assignment/agents
   *
   * Request body example:
   * {
   *   "agents": [
   *     {"agentId": "a1", "email": "a1@mail.com",
   *      "answers": [{"taskId": "t1", "taskName": "Kiln", "cost": 1}, {"taskId": "t2", "taskName": "Glaze", "cost": 2}]}
   *   ],
   *   "options": {"populationSize": 30, "maxGenerations": 15, "seed": "42",
   *               "groups": [{"maxAssignments": 1, "tasks": [{"taskId": "t1"}]}]}
   * }
   */
  @PostMapping("/agents")
  public ResponseEntity<AssignmentResultSchema> assignAgents(@RequestBody AgentAssignmentRequest request) {
    return toResponse(assignmentController.assignAgents(request));
  }

  /**
   * Solve a raw cost matrix
   * POST /api/assignment/matrix
   *
   * Request body example:
   * {
   *   "matrix": [[1, 2, 3], [2, 1, 3], [3, 3, 1]],
   *   "rowNames": ["r1", "r2", "r3"],
   *   "colNames": ["c1", "c2", "c3"],
   *   "options": {"distanceThreshold": 1.01}
   * }
   *
   * rowNames/colNames are optional.
   */
  @PostMapping("/matrix")
  public ResponseEntity<AssignmentResultSchema> assignMatrix(@RequestBody MatrixAssignmentRequest request) {
    return toResponse(assignmentController.assignMatrix(request));
  }

  /**
   * Options applied when a request leaves them out
   * GET /api/assignment/defaults
   */
  @GetMapping("/defaults")
  public ResponseEntity<GeneticOptionsSchema> getDefaults() {
    return ResponseEntity.ok(optionsResolver.defaults());
  }

  private ResponseEntity<AssignmentResultSchema> toResponse(AssignmentResultSchema result) {
    if (Boolean.TRUE.equals(result.getSuccess())) {
      return ResponseEntity.ok(result);
    }
    if (result.getErrorType() == AssignmentErrorType.INVALID_INPUT) {
      return ResponseEntity.badRequest().body(result);
    }
    return ResponseEntity.internalServerError().body(result);
  }
}
