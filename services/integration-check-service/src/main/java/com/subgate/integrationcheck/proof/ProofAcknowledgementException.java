package com.subgate.integrationcheck.proof;

import com.subgate.integrationcheck.common.error.ErrorKind;
import com.subgate.integrationcheck.common.error.IntegrationException;

/** The invoice owner did not accept the proof; the upload stays pending and can be re-confirmed. */
public class ProofAcknowledgementException extends IntegrationException {
  public ProofAcknowledgementException(String message, Throwable cause) {
    super(ErrorKind.AUTHORITY_REJECTED, message, cause);
  }
}
