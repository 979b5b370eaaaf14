package com.subgate.integrationcheck.stripe;

import com.subgate.integrationcheck.common.error.AuthorityUnreachableException;
import com.subgate.integrationcheck.common.error.ErrorKind;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Checks a payment processor secret key: prefix first, then a live account lookup.
 *
 * <p>{@code liveMode} reflects what the account can actually do: a live-prefixed key on an account
 * without charging enabled is reported as not live.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaymentGatewayKeyValidator {

  static final String REQUIRED_MESSAGE = "Secret key is required";
  static final String FORMAT_MESSAGE =
      "Invalid key format. Key should start with 'sk_live_' or 'sk_test_'";
  static final String FALLBACK_ERROR = "validation failed";

  private final PaymentAccountAuthority authority;

  public KeyCheckVerdict validate(KeyCheckRequest request) {
    String secretKey =
        request == null || request.secretKey() == null ? "" : request.secretKey().trim();
    if (secretKey.isEmpty()) {
      log.info("Secret key check rejected locally: {}", ErrorKind.MALFORMED_INPUT.code());
      return KeyCheckVerdict.invalid(REQUIRED_MESSAGE);
    }

    Optional<SecretKeyMode> mode = SecretKeyMode.of(secretKey);
    if (mode.isEmpty()) {
      log.info("Secret key check rejected locally: unrecognized key prefix");
      return KeyCheckVerdict.invalid(FORMAT_MESSAGE);
    }

    AccountLookup lookup;
    try {
      lookup = authority.fetchAccount(secretKey);
    } catch (AuthorityUnreachableException e) {
      log.warn("Secret key check failed: {} ({})", e.getMessage(), e.kind().code());
      return KeyCheckVerdict.invalid(orFallback(e.getMessage()));
    }

    if (lookup == null || !lookup.found()) {
      String error = lookup == null ? null : lookup.error();
      log.info("Secret key ({} mode) refused by processor: {}", mode.get(), error);
      return KeyCheckVerdict.invalid(orFallback(error));
    }

    boolean liveMode = lookup.chargesEnabled() && mode.get() == SecretKeyMode.LIVE;
    log.info("Payment account {} validated, liveMode={}", lookup.accountId(), liveMode);
    return KeyCheckVerdict.valid(lookup.accountName(), lookup.accountId(), liveMode);
  }

  private static String orFallback(String message) {
    return message == null || message.isBlank() ? FALLBACK_ERROR : message;
  }
}
