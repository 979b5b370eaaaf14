package com.subgate.integrationcheck.proof;

import com.subgate.integrationcheck.common.error.ErrorKind;
import com.subgate.integrationcheck.common.error.IntegrationException;

/** The selected file is not an accepted image or is too large. */
public class ProofConstraintException extends IntegrationException {
  public ProofConstraintException(String message) {
    super(ErrorKind.CONSTRAINT_VIOLATION, message);
  }
}
