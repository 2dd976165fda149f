package com.system.allocator.exceptions;

/**
 * Raised when a genetic run cannot proceed, e.g. when no pairing can be assigned at all.
 */
public class AlgorithmFailureException extends RuntimeException {

  public AlgorithmFailureException(String message) {
    super(message);
  }

  public AlgorithmFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
