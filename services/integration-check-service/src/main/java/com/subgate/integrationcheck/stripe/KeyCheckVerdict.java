package com.subgate.integrationcheck.stripe;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeyCheckVerdict(
    boolean valid, String error, String accountName, String accountId, Boolean liveMode) {

  public static KeyCheckVerdict valid(String accountName, String accountId, boolean liveMode) {
    return new KeyCheckVerdict(true, null, accountName, accountId, liveMode);
  }

  public static KeyCheckVerdict invalid(String error) {
    return new KeyCheckVerdict(false, error, null, null, null);
  }
}
