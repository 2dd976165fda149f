package com.system.allocator.bll.adapter;

import com.system.allocator.bll.dto.AgentDTO;
import com.system.allocator.bll.dto.AssignmentPairDTO;
import com.system.allocator.bll.dto.CandidateResultDTO;
import com.system.allocator.bll.dto.ResultStatsDTO;
import com.system.allocator.bll.dto.TaskDTO;
import com.system.allocator.config.Constants;
import com.system.allocator.schemas.AgentSchema;
import com.system.allocator.schemas.AnswerSchema;
import com.system.allocator.schemas.algorithm.Genetic.Assignment;
import com.system.allocator.schemas.algorithm.Genetic.Candidate;
import com.system.allocator.schemas.algorithm.Genetic.CostMatrix;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Translates the best candidates of a run back into named pairings.
 */
@Component
public class AssignmentResultAdapter {

  /**
   * Top candidates paired with the real agents and tasks of the survey answers.
   */
  public List<CandidateResultDTO> withRealAgents(List<AgentSchema> agents, List<Candidate> population,
                                                 int returnedCandidates) {
    List<AnswerSchema> tasks = agents.get(0).getAnswers();
    List<CandidateResultDTO> results = new ArrayList<>();

    for (Candidate candidate : sortedByDistance(population)) {
      if (results.size() >= returnedCandidates) {
        break;
      }
      List<AssignmentPairDTO> pairs = new ArrayList<>();
      for (Assignment a : candidate.getAssignment()) {
        AgentSchema agent = agents.get(a.getRow());
        AnswerSchema task = tasks.get(a.getCol());
        pairs.add(AssignmentPairDTO.builder()
            .agent(new AgentDTO(agent.getAgentId(), agent.getEmail()))
            .task(new TaskDTO(task.getTaskId(), task.getTaskName()))
            .cost(a.getCost())
            .build());
      }
      results.add(CandidateResultDTO.builder()
          .totalCost(candidate.getTotalCost())
          .distance(candidate.getDistance())
          .assignment(pairs)
          .stats(stats(pairs, agents.size(), tasks.size()))
          .build());
    }
    return results;
  }

  /**
   * Top candidates with distinct distances, each with a 0/1 solution matrix the shape
   * of the cost matrix and pairings named after the row and column names.
   */
  public List<CandidateResultDTO> withDummyNames(CostMatrix matrix, List<Candidate> population, int returnedCandidates,
                                                 List<String> rowNames, List<String> colNames) {
    Set<Double> seenDistances = new HashSet<>();
    List<CandidateResultDTO> results = new ArrayList<>();

    for (Candidate candidate : sortedByDistance(population)) {
      if (results.size() >= returnedCandidates) {
        break;
      }
      if (!seenDistances.add(candidate.getDistance())) {
        continue;
      }

      int[][] solution = getSolution(matrix, candidate.getAssignment());
      List<AssignmentPairDTO> pairs = getAssignmentPairs(solution, matrix, rowNames, colNames);
      results.add(CandidateResultDTO.builder()
          .solution(solution)
          .assignment(pairs)
          .assignmentRating(getAssignmentRating(pairs))
          .totalCost(candidate.getTotalCost())
          .distance(candidate.getDistance())
          .stats(stats(pairs, matrix.getRows(), matrix.getCols()))
          .build());
    }
    return results;
  }

  int[][] getSolution(CostMatrix matrix, List<Assignment> assignment) {
    int[][] solution = new int[matrix.getRows()][matrix.getCols()];
    for (Assignment a : assignment) {
      solution[a.getRow()][a.getCol()] = 1;
    }
    return solution;
  }

  // Walks the mask row by row, so pairs come out in row order
  List<AssignmentPairDTO> getAssignmentPairs(int[][] solution, CostMatrix matrix,
                                             List<String> rowNames, List<String> colNames) {
    List<AssignmentPairDTO> pairs = new ArrayList<>();
    for (int i = 0; i < rowNames.size(); i++) {
      for (int j = 0; j < colNames.size(); j++) {
        if (solution[i][j] == 1) {
          pairs.add(AssignmentPairDTO.builder()
              .agent(new AgentDTO(rowNames.get(i), rowNames.get(i)))
              .task(new TaskDTO(colNames.get(j), colNames.get(j)))
              .cost(matrix.cost(i, j))
              .build());
        }
      }
    }
    return pairs;
  }

  public double getAssignmentRating(List<AssignmentPairDTO> pairs) {
    if (pairs.isEmpty()) {
      return 0.0;
    }
    long good = pairs.stream().filter(p -> p.getCost() < Constants.ASSIGNMENT_RATING_COST_LIMIT).count();
    return (double) good / pairs.size();
  }

  public ResultStatsDTO stats(List<AssignmentPairDTO> pairs, int totalAgents, int totalTasks) {
    double costSum = 0;
    double inverseSum = 0;
    for (AssignmentPairDTO pair : pairs) {
      costSum += pair.getCost();
      inverseSum += pair.getCost() > 0 ? 1 / pair.getCost() : 1;
    }
    int n = pairs.size();
    return ResultStatsDTO.builder()
        .agentsAssigned(n)
        .tasksAssigned(n)
        .totalAgents(totalAgents)
        .totalTasks(totalTasks)
        .meanCost(n > 0 ? costSum / n : 0.0)
        .inverseCostRating(n > 0 ? inverseSum / n : 0.0)
        .assignmentRating(getAssignmentRating(pairs))
        .build();
  }

  private List<Candidate> sortedByDistance(List<Candidate> population) {
    List<Candidate> sorted = new ArrayList<>(population);
    sorted.sort(Comparator.comparingDouble(Candidate::getDistance));
    return sorted;
  }
}
