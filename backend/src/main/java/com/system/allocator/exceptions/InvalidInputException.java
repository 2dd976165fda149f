package com.system.allocator.exceptions;

import java.util.Collections;
import java.util.List;

/**
 * Raised before a run starts when the agent/cost data or the options cannot be used.
 */
public class InvalidInputException extends RuntimeException {

  private final List<String> problems;

  public InvalidInputException(String message) {
    this(message, Collections.emptyList());
  }

  public InvalidInputException(String message, List<String> problems) {
    super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems));
    this.problems = List.copyOf(problems);
  }

  public List<String> getProblems() {
    return problems;
  }
}
