package com.subgate.integrationcheck.api;

import com.subgate.integrationcheck.common.concurrency.LatestCallTracker;
import com.subgate.integrationcheck.stripe.KeyCheckRequest;
import com.subgate.integrationcheck.stripe.KeyCheckVerdict;
import com.subgate.integrationcheck.stripe.PaymentGatewayKeyValidator;
import com.subgate.integrationcheck.telegram.CredentialValidator;
import com.subgate.integrationcheck.telegram.ValidationRequest;
import com.subgate.integrationcheck.telegram.ValidationVerdict;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Bot and payment key checks used by onboarding and billing.
 *
 * <p>Verdicts are always returned with 200; {@code valid} carries the outcome. The response of a
 * call is also recorded as the user's latest verdict unless a newer call for the same check
 * started in the meantime.
 */
@RestController
@RequestMapping("/api/integrations")
public class IntegrationValidationController {

  static final String USER_HEADER = "X-User-Id";

  private final CredentialValidator credentialValidator;
  private final PaymentGatewayKeyValidator keyValidator;
  private final LatestVerdicts latest;

  public IntegrationValidationController(
      CredentialValidator credentialValidator,
      PaymentGatewayKeyValidator keyValidator,
      LatestVerdicts latest) {
    this.credentialValidator = credentialValidator;
    this.keyValidator = keyValidator;
    this.latest = latest;
  }

  @PostMapping("/telegram/validate")
  public ValidationVerdict validateBot(
      @RequestHeader(USER_HEADER) String userId, @RequestBody ValidationRequest request) {
    LatestCallTracker.Ticket<String> ticket = latest.botChecks().begin(userId);
    ValidationVerdict verdict = credentialValidator.validate(request);
    latest.botChecks().publish(ticket, verdict);
    return verdict;
  }

  @GetMapping("/telegram/validate/latest")
  public ResponseEntity<ValidationVerdict> latestBotVerdict(
      @RequestHeader(USER_HEADER) String userId) {
    return ResponseEntity.of(latest.botChecks().latest(userId));
  }

  @PostMapping("/stripe/validate")
  public KeyCheckVerdict validateKey(
      @RequestHeader(USER_HEADER) String userId, @RequestBody KeyCheckRequest request) {
    LatestCallTracker.Ticket<String> ticket = latest.keyChecks().begin(userId);
    KeyCheckVerdict verdict = keyValidator.validate(request);
    latest.keyChecks().publish(ticket, verdict);
    return verdict;
  }

  @GetMapping("/stripe/validate/latest")
  public ResponseEntity<KeyCheckVerdict> latestKeyVerdict(
      @RequestHeader(USER_HEADER) String userId) {
    return ResponseEntity.of(latest.keyChecks().latest(userId));
  }
}
