package com.github.spud.sample.ai.dispatcher.domain.dispatch;

import com.github.spud.sample.ai.dispatcher.domain.DispatchException;

/**
 * 所有候选都已尝试且失败；携带完整的尝试轨迹
 */
public class AllCandidatesFailedException extends DispatchException {

  public static final String CODE = "ALL_CANDIDATES_FAILED";

  private final DispatchResult result;

  public AllCandidatesFailedException(DispatchResult result) {
    super(CODE, result.getErrorMessage());
    this.result = result;
  }

  public DispatchResult getResult() {
    return result;
  }
}
