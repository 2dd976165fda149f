package com.system.allocator.bll.service;

import com.system.allocator.exceptions.InvalidInputException;
import com.system.allocator.schemas.AgentSchema;
import com.system.allocator.schemas.AnswerSchema;
import com.system.allocator.schemas.GroupSchema;
import com.system.allocator.schemas.TaskSchema;
import com.system.allocator.schemas.algorithm.Genetic.GeneticOptions;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks agent answers, raw matrices and resolved options before a run is attempted.
 * Every problem found is reported at once in a single {@link InvalidInputException}.
 */
@Service
public class GeneticInputValidator {

  public void validateAgents(List<AgentSchema> agents) {
    List<String> problems = new ArrayList<>();

    if (agents == null || agents.isEmpty()) {
      throw new InvalidInputException("No agents supplied");
    }

    if (agents.get(0) == null) {
      throw new InvalidInputException("Agent 0 is null");
    }

    List<AnswerSchema> reference = agents.get(0).getAnswers();
    if (reference == null || reference.isEmpty()) {
      throw new InvalidInputException("Agent 0 has no answers");
    }

    for (int i = 0; i < agents.size(); i++) {
      AgentSchema agent = agents.get(i);
      if (agent == null) {
        problems.add("agent " + i + " is null");
        continue;
      }
      if (agent.getAgentId() == null || agent.getAgentId().isBlank()) {
        problems.add("agent " + i + " has no agentId");
      }
      List<AnswerSchema> answers = agent.getAnswers();
      if (answers == null || answers.size() != reference.size()) {
        problems.add("agent " + i + " has " + (answers == null ? 0 : answers.size())
            + " answers, expected " + reference.size());
        continue;
      }
      for (int j = 0; j < answers.size(); j++) {
        AnswerSchema answer = answers.get(j);
        if (answer == null || answer.getTaskId() == null) {
          problems.add("agent " + i + " answer " + j + " has no taskId");
          continue;
        }
        // A missing reference answer is already reported against agent 0
        AnswerSchema expected = reference.get(j);
        if (i > 0 && expected != null && expected.getTaskId() != null
            && !Objects.equals(answer.getTaskId(), expected.getTaskId())) {
          problems.add("agent " + i + " answer " + j + " is for task " + answer.getTaskId()
              + ", expected " + expected.getTaskId());
        }
        checkCost(answer.getCost(), "agent " + i + " answer " + j, problems);
      }
    }

    throwIfAny("Invalid agent data", problems);
  }

  public void validateMatrix(List<List<Double>> matrix, List<String> rowNames, List<String> colNames) {
    List<String> problems = new ArrayList<>();

    if (matrix == null || matrix.isEmpty() || matrix.get(0) == null || matrix.get(0).isEmpty()) {
      throw new InvalidInputException("Cost matrix is empty");
    }

    int cols = matrix.get(0).size();
    for (int i = 0; i < matrix.size(); i++) {
      List<Double> row = matrix.get(i);
      if (row == null || row.size() != cols) {
        problems.add("row " + i + " has " + (row == null ? 0 : row.size()) + " columns, expected " + cols);
        continue;
      }
      for (int j = 0; j < row.size(); j++) {
        checkCost(row.get(j), "cell [" + i + "][" + j + "]", problems);
      }
    }

    if (rowNames != null && rowNames.size() != matrix.size()) {
      problems.add(rowNames.size() + " row names for " + matrix.size() + " rows");
    }
    if (colNames != null && colNames.size() != cols) {
      problems.add(colNames.size() + " column names for " + cols + " columns");
    }

    throwIfAny("Invalid cost matrix", problems);
  }

  public void validateOptions(GeneticOptions options, List<String> colNames) {
    List<String> problems = new ArrayList<>();

    if (options.getMaxGenerations() <= 0) {
      problems.add("maxGenerations must be greater than 0");
    }
    if (Double.isNaN(options.getMutationChance()) || options.getMutationChance() < 0 || options.getMutationChance() > 1) {
      problems.add("mutationChance must be between 0 and 1");
    }
    if (options.getReturnedCandidates() <= 0) {
      problems.add("returnedCandidates must be greater than 0");
    }
    if (options.getPopulationSize() <= 0) {
      problems.add("populationSize must be greater than 0");
    }
    if (Double.isNaN(options.getDistanceThreshold()) || options.getDistanceThreshold() < 0) {
      problems.add("distanceThreshold must not be negative");
    }

    List<GroupSchema> groups = options.getGroups();
    if (groups != null) {
      for (int g = 0; g < groups.size(); g++) {
        GroupSchema group = groups.get(g);
        if (group == null) {
          problems.add("group " + g + " is null");
          continue;
        }
        if (group.getMaxAssignments() == null || group.getMaxAssignments() < 0) {
          problems.add("group " + g + " needs a non-negative maxAssignments");
        }
        if (group.getTasks() == null || group.getTasks().isEmpty()) {
          problems.add("group " + g + " has no tasks");
          continue;
        }
        for (TaskSchema task : group.getTasks()) {
          if (task == null || !colNames.contains(task.getTaskId())) {
            problems.add("group " + g + " refers to unknown task " + (task == null ? null : task.getTaskId()));
          }
        }
      }
    }

    throwIfAny("Invalid genetic options", problems);
  }

  private void checkCost(Double cost, String where, List<String> problems) {
    if (cost == null || cost.isNaN() || cost.isInfinite()) {
      problems.add(where + " has no numeric cost");
    } else if (cost < 0) {
      problems.add(where + " has negative cost " + cost);
    }
  }

  private void throwIfAny(String message, List<String> problems) {
    if (!problems.isEmpty()) {
      throw new InvalidInputException(message, problems);
    }
  }
}
