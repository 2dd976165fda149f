package com.system.allocator.bll.controller;

import com.system.allocator.bll.adapter.AssignmentInputAdapter;
import com.system.allocator.bll.adapter.AssignmentResultAdapter;
import com.system.allocator.bll.dto.CandidateResultDTO;
import com.system.allocator.bll.dto.ProblemInput;
import com.system.allocator.bll.service.GeneticInputValidator;
import com.system.allocator.bll.service.GeneticOptionsResolver;
import com.system.allocator.exceptions.InvalidInputException;
import com.system.allocator.schemas.AgentAssignmentRequest;
import com.system.allocator.schemas.AssignmentErrorType;
import com.system.allocator.schemas.AssignmentResultSchema;
import com.system.allocator.schemas.MatrixAssignmentRequest;
import com.system.allocator.schemas.algorithm.Genetic.Candidate;
import com.system.allocator.schemas.algorithm.Genetic.GeneticContext;
import com.system.allocator.schemas.algorithm.Genetic.GeneticOptions;
import com.system.allocator.schemas.algorithm.Genetic.GeneticRunResult;
import com.system.allocator.schemas.algorithm.Genetic.GeneticSolver;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.function.Function;

/**
 * Runs the genetic assignment for agent survey answers or for a raw cost matrix.
 *
 * <p>Never throws: invalid input and failures inside the run come back as an
 * unsuccessful {@link AssignmentResultSchema} with an error type and no candidates.
 */
@Service
@RequiredArgsConstructor
public class AssignmentController {

  private static final Logger logger = LoggerFactory.getLogger(AssignmentController.class);

  private final GeneticInputValidator validator;
  private final GeneticOptionsResolver optionsResolver;
  private final AssignmentInputAdapter inputAdapter;
  private final AssignmentResultAdapter resultAdapter;

  public AssignmentResultSchema assignAgents(AgentAssignmentRequest request) {
    LocalDateTime startTime = LocalDateTime.now();

    ProblemInput input;
    GeneticOptions options;
    try {
      validator.validateAgents(request != null ? request.getAgents() : null);
      input = inputAdapter.fromAgents(request.getAgents());
      options = optionsResolver.resolve(request.getOptions());
      validator.validateOptions(options, input.getColNames());
    } catch (InvalidInputException e) {
      return invalidInput(e, startTime);
    }

    return run(input, options, startTime,
        population -> resultAdapter.withRealAgents(request.getAgents(), population, options.getReturnedCandidates()));
  }

  public AssignmentResultSchema assignMatrix(MatrixAssignmentRequest request) {
    LocalDateTime startTime = LocalDateTime.now();

    ProblemInput input;
    GeneticOptions options;
    try {
      if (request == null) {
        throw new InvalidInputException("No request body");
      }
      validator.validateMatrix(request.getMatrix(), request.getRowNames(), request.getColNames());
      input = inputAdapter.fromMatrix(request.getMatrix(), request.getRowNames(), request.getColNames());
      options = optionsResolver.resolve(request.getOptions());
      validator.validateOptions(options, input.getColNames());
    } catch (InvalidInputException e) {
      return invalidInput(e, startTime);
    }

    return run(input, options, startTime,
        population -> resultAdapter.withDummyNames(input.getCostMatrix(), population,
            options.getReturnedCandidates(), input.getRowNames(), input.getColNames()));
  }

  private AssignmentResultSchema run(ProblemInput input, GeneticOptions options, LocalDateTime startTime,
                                     Function<List<Candidate>, List<CandidateResultDTO>> formatter) {
    try {
      GeneticContext context = GeneticContext.create(input.getCostMatrix(), input.getColNames(), options);
      GeneticRunResult runResult = new GeneticSolver(context, options).solve();
      List<CandidateResultDTO> candidates = formatter.apply(runResult.getPopulation());

      LocalDateTime endTime = LocalDateTime.now();
      return AssignmentResultSchema.builder()
          .success(true)
          .message("Genetic assignment finished after " + runResult.getGenerationsRun() + " generations")
          .executionStartTime(startTime)
          .executionEndTime(endTime)
          .executionTimeMillis(ChronoUnit.MILLIS.between(startTime, endTime))
          .generationsRun(runResult.getGenerationsRun())
          .terminationReason(runResult.getTerminationReason())
          .rows(input.getCostMatrix().getRows())
          .cols(input.getCostMatrix().getCols())
          .maxAssignments(context.getMaxAssignments())
          .candidates(candidates)
          .build();

    } catch (Exception e) {
      logger.error("Genetic assignment failed", e);
      LocalDateTime endTime = LocalDateTime.now();
      return AssignmentResultSchema.builder()
          .success(false)
          .errorType(AssignmentErrorType.ALGORITHM_ERROR)
          .message("Algorithm execution failed: " + e.getMessage())
          .executionStartTime(startTime)
          .executionEndTime(endTime)
          .executionTimeMillis(ChronoUnit.MILLIS.between(startTime, endTime))
          .build();
    }
  }

  private AssignmentResultSchema invalidInput(InvalidInputException e, LocalDateTime startTime) {
    logger.warn("Rejected genetic input: {}", e.getMessage());
    LocalDateTime endTime = LocalDateTime.now();
    return AssignmentResultSchema.builder()
        .success(false)
        .errorType(AssignmentErrorType.INVALID_INPUT)
        .message(e.getMessage())
        .executionStartTime(startTime)
        .executionEndTime(endTime)
        .executionTimeMillis(ChronoUnit.MILLIS.between(startTime, endTime))
        .build();
  }
}
