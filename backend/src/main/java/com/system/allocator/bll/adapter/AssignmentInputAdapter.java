package com.system.allocator.bll.adapter;

import com.system.allocator.bll.dto.ProblemInput;
import com.system.allocator.config.Constants;
import com.system.allocator.schemas.AgentSchema;
import com.system.allocator.schemas.AnswerSchema;
import com.system.allocator.schemas.algorithm.Genetic.CostMatrix;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns validated request data into a cost matrix with row and column names.
 */
@Component
public class AssignmentInputAdapter {

  /**
   * One row per agent, one column per answered task, in answer order.
   */
  public ProblemInput fromAgents(List<AgentSchema> agents) {
    double[][] costs = new double[agents.size()][];
    List<String> rowNames = new ArrayList<>(agents.size());

    for (int i = 0; i < agents.size(); i++) {
      AgentSchema agent = agents.get(i);
      List<AnswerSchema> answers = agent.getAnswers();
      costs[i] = new double[answers.size()];
      for (int j = 0; j < answers.size(); j++) {
        costs[i][j] = answers.get(j).getCost();
      }
      rowNames.add(agent.getAgentId());
    }

    List<String> colNames = new ArrayList<>();
    for (AnswerSchema answer : agents.get(0).getAnswers()) {
      colNames.add(answer.getTaskId());
    }

    return new ProblemInput(new CostMatrix(costs), rowNames, colNames);
  }

  public ProblemInput fromMatrix(List<List<Double>> matrix, List<String> rowNames, List<String> colNames) {
    double[][] costs = new double[matrix.size()][];
    for (int i = 0; i < matrix.size(); i++) {
      List<Double> row = matrix.get(i);
      costs[i] = new double[row.size()];
      for (int j = 0; j < row.size(); j++) {
        costs[i][j] = row.get(j);
      }
    }

    int cols = costs[0].length;
    return new ProblemInput(
        new CostMatrix(costs),
        rowNames != null ? List.copyOf(rowNames) : placeholders(Constants.PLACEHOLDER_AGENT_PREFIX, costs.length),
        colNames != null ? List.copyOf(colNames) : placeholders(Constants.PLACEHOLDER_TASK_PREFIX, cols));
  }

  private List<String> placeholders(String prefix, int count) {
    List<String> names = new ArrayList<>(count);
    for (int i = 1; i <= count; i++) {
      names.add(prefix + i);
    }
    return names;
  }
}
