package com.subgate.integrationcheck.telegram;

/** Answer of a {@link BotCapabilityAuthority}; {@code failedStep} is set only when rejected. */
public record CapabilityCheck(
    boolean valid, String error, String failedStep, Bot bot, Channel channel) {

  public static final String STEP_BOT_TOKEN = "bot_token";
  public static final String STEP_CHANNEL = "channel";
  public static final String STEP_PERMISSIONS = "permissions";

  public static CapabilityCheck granted(Bot bot, Channel channel) {
    return new CapabilityCheck(true, null, null, bot, channel);
  }

  public static CapabilityCheck rejected(String failedStep, String error) {
    return new CapabilityCheck(false, error, failedStep, null, null);
  }

  public record Bot(long id, String username, String firstName) {}

  public record Channel(long id, String title, String type, String username) {}
}
