package com.subgate.integrationcheck.common.error;

/** Base for failures scoped to a single validation or upload attempt. */
public abstract class IntegrationException extends RuntimeException {

  private final ErrorKind kind;

  protected IntegrationException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected IntegrationException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
