package com.subgate.integrationcheck.stripe;

public record AccountLookup(
    boolean found, String error, String accountId, String accountName, boolean chargesEnabled) {

  public static AccountLookup found(String accountId, String accountName, boolean chargesEnabled) {
    return new AccountLookup(true, null, accountId, accountName, chargesEnabled);
  }

  public static AccountLookup refused(String error) {
    return new AccountLookup(false, error, null, null, false);
  }
}
