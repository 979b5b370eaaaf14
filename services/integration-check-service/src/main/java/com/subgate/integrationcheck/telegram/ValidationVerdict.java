package com.subgate.integrationcheck.telegram;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a bot credential check. {@code step} names the check that failed ({@code bot_token},
 * {@code channel} or {@code permissions}) when the platform rejected the credentials.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationVerdict(boolean valid, String error, String step, Subject subject) {

  public static ValidationVerdict valid(Subject subject) {
    return new ValidationVerdict(true, null, null, subject);
  }

  public static ValidationVerdict invalid(String error) {
    return new ValidationVerdict(false, error, null, null);
  }

  public static ValidationVerdict rejectedAt(String step, String error) {
    return new ValidationVerdict(false, error, step, null);
  }

  public record Subject(String botUsername, String channelTitle) {}
}
