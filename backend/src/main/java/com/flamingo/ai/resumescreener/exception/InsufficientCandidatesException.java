package com.flamingo.ai.resumescreener.exception;

/** Exception thrown when a comparison resolves fewer than two stored candidates. */
public class InsufficientCandidatesException extends RuntimeException {

  public static final int MINIMUM = 2;

  private final int requested;
  private final int resolved;

  public InsufficientCandidatesException(int requested, int resolved) {
    super(
        String.format(
            "At least %d valid candidates required for comparison (requested %d, found %d)",
            MINIMUM, requested, resolved));
    this.requested = requested;
    this.resolved = resolved;
  }

  public int getRequested() {
    return requested;
  }

  public int getResolved() {
    return resolved;
  }
}
