package com.subgate.integrationcheck.telegram;

/**
 * Messaging platform that decides whether a bot token and a channel belong together and whether
 * the bot may issue invite links there.
 *
 * <p>Implementations report a negative answer as a rejected {@link CapabilityCheck} and throw
 * {@link com.subgate.integrationcheck.common.error.AuthorityUnreachableException} only when the
 * platform could not be reached.
 */
public interface BotCapabilityAuthority {

  CapabilityCheck check(String botToken, String channelId);
}
