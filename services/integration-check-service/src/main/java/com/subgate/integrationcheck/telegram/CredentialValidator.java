package com.subgate.integrationcheck.telegram;

import com.subgate.integrationcheck.common.error.AuthorityUnreachableException;
import com.subgate.integrationcheck.common.error.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Checks a bot token and channel identifier against the messaging platform before a project is
 * activated.
 *
 * <p>Every call goes to the authority; nothing is cached because a bot can be removed from a
 * channel between two checks. An unreachable platform and a rejected credential produce the same
 * kind of verdict, so callers present both as "check token/permissions and try again".
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CredentialValidator {

  static final String REQUIRED_MESSAGE = "Bot token and channel ID are required";
  static final String FALLBACK_ERROR = "validation failed";

  private final BotCapabilityAuthority authority;

  public ValidationVerdict validate(ValidationRequest request) {
    if (request == null || isBlank(request.botToken()) || isBlank(request.channelId())) {
      log.info("Bot credential check rejected locally: {}", ErrorKind.MALFORMED_INPUT.code());
      return ValidationVerdict.invalid(REQUIRED_MESSAGE);
    }

    String channelId = request.channelId().trim();
    CapabilityCheck check;
    try {
      check = authority.check(request.botToken().trim(), channelId);
    } catch (AuthorityUnreachableException e) {
      log.warn(
          "Bot credential check for channel {} failed: {} ({})",
          channelId,
          e.getMessage(),
          e.kind().code());
      return ValidationVerdict.invalid(orFallback(e.getMessage()));
    }

    if (check == null || !check.valid()) {
      String error = check == null ? null : check.error();
      String step = check == null ? null : check.failedStep();
      log.info(
          "Bot credential check for channel {} rejected at step {}: {}", channelId, step, error);
      return ValidationVerdict.rejectedAt(step, orFallback(error));
    }

    String botUsername = check.bot() == null ? null : check.bot().username();
    String channelTitle = check.channel() == null ? null : check.channel().title();
    log.info("Bot @{} validated for channel '{}'", botUsername, channelTitle);
    return ValidationVerdict.valid(new ValidationVerdict.Subject(botUsername, channelTitle));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static String orFallback(String message) {
    return message == null || message.isBlank() ? FALLBACK_ERROR : message;
  }
}
