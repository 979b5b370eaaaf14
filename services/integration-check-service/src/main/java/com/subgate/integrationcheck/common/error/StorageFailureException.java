package com.subgate.integrationcheck.common.error;

/** Upload or signed URL issuance failed. */
public class StorageFailureException extends IntegrationException {
  public StorageFailureException(String message) {
    super(ErrorKind.STORAGE_FAILURE, message);
  }

  public StorageFailureException(String message, Throwable cause) {
    super(ErrorKind.STORAGE_FAILURE, message, cause);
  }
}
