package com.subgate.integrationcheck.proof;

import com.subgate.integrationcheck.common.error.ErrorKind;
import com.subgate.integrationcheck.common.error.IntegrationException;

/** A pipeline operation was called from a state that does not allow it. */
public class InvalidTransitionException extends IntegrationException {

  private final ProofStage stage;

  public InvalidTransitionException(ProofStage stage, String message) {
    super(ErrorKind.INVALID_TRANSITION, message);
    this.stage = stage;
  }

  public ProofStage stage() {
    return stage;
  }
}
