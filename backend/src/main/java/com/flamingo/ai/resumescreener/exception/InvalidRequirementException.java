package com.flamingo.ai.resumescreener.exception;

/** Exception thrown when screening criteria are malformed. */
public class InvalidRequirementException extends RuntimeException {

  private final String field;

  public InvalidRequirementException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
