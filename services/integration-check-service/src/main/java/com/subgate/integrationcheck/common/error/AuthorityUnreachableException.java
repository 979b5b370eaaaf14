package com.subgate.integrationcheck.common.error;

/** Transport-level failure talking to a third-party authority. */
public class AuthorityUnreachableException extends IntegrationException {
  public AuthorityUnreachableException(String message, Throwable cause) {
    super(ErrorKind.AUTHORITY_UNREACHABLE, message, cause);
  }
}
