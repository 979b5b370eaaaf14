package com.subgate.integrationcheck.stripe;

import java.util.Optional;

/** Recognized secret key prefixes. */
public enum SecretKeyMode {
  LIVE("sk_live_"),
  TEST("sk_test_");

  private final String prefix;

  SecretKeyMode(String prefix) {
    this.prefix = prefix;
  }

  public String prefix() {
    return prefix;
  }

  public static Optional<SecretKeyMode> of(String secretKey) {
    if (secretKey == null) {
      return Optional.empty();
    }
    for (SecretKeyMode mode : values()) {
      if (secretKey.startsWith(mode.prefix)) {
        return Optional.of(mode);
      }
    }
    return Optional.empty();
  }
}
