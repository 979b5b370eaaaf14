package com.subgate.integrationcheck.common.error;

public enum ErrorKind {
  MALFORMED_INPUT("malformed-input"),
  AUTHORITY_REJECTED("authority-rejected"),
  AUTHORITY_UNREACHABLE("authority-unreachable"),
  STORAGE_FAILURE("storage-failure"),
  CONSTRAINT_VIOLATION("constraint-violation"),
  INVALID_TRANSITION("invalid-transition");

  private final String code;

  ErrorKind(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Local precondition failures are surfaced immediately and are never worth retrying with the
   * same input.
   */
  public boolean isLocal() {
    return this == MALFORMED_INPUT || this == CONSTRAINT_VIOLATION || this == INVALID_TRANSITION;
  }
}
