package com.flamingo.ai.resumescreener.domain.model;

import java.util.List;

/**
 * Pass/reject outcome for one match result.
 *
 * @param passed whether the candidate passed the policy of the requested mode
 * @param reasons human-readable rejection reasons, empty iff {@code passed}
 */
public record Decision(boolean passed, List<String> reasons) {

  public Decision {
    reasons = reasons == null ? List.of() : List.copyOf(reasons);
    if (passed != reasons.isEmpty()) {
      throw new IllegalArgumentException("A decision has reasons iff it rejects the candidate");
    }
  }

  public static Decision pass() {
    return new Decision(true, List.of());
  }

  public static Decision reject(List<String> reasons) {
    return new Decision(false, reasons);
  }
}
