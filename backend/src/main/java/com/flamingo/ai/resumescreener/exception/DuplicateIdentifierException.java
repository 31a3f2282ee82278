package com.flamingo.ai.resumescreener.exception;

/** Exception thrown when a candidate is stored under an identifier that is already taken. */
public class DuplicateIdentifierException extends RuntimeException {

  private final String candidateId;

  public DuplicateIdentifierException(String candidateId) {
    super("Candidate identifier already exists: " + candidateId);
    this.candidateId = candidateId;
  }

  public String getCandidateId() {
    return candidateId;
  }
}
