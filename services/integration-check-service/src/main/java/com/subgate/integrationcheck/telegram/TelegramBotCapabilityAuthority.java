package com.subgate.integrationcheck.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.subgate.integrationcheck.common.error.AuthorityUnreachableException;
import com.subgate.integrationcheck.config.TelegramProperties;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Telegram Bot API rendition of the capability check: {@code getMe}, then {@code getChat}, then
 * {@code getChatMember} for the bot itself. Each step runs only if the previous one succeeded.
 */
@Service
@Slf4j
public class TelegramBotCapabilityAuthority implements BotCapabilityAuthority {

  private static final Pattern BOT_TOKEN = Pattern.compile("^\\d+:[A-Za-z0-9_-]+$");

  private final RestClient rest;

  public TelegramBotCapabilityAuthority(RestClient.Builder builder, TelegramProperties properties) {
    this.rest = builder.baseUrl(properties.baseUrl()).build();
  }

  @Override
  public CapabilityCheck check(String botToken, String channelId) {
    // the token is spliced into the request path, so it must be checked before any call
    if (!BOT_TOKEN.matcher(botToken).matches()) {
      return CapabilityCheck.rejected(
          CapabilityCheck.STEP_BOT_TOKEN,
          "Invalid bot token format. Expected format: 123456789:ABCdefGHIjklMNOpqrSTUvwxYZ");
    }
    if (!channelId.startsWith("-100") && !channelId.startsWith("@")) {
      return CapabilityCheck.rejected(
          CapabilityCheck.STEP_CHANNEL,
          "Invalid channel ID format. Should start with -100 or @ for username");
    }

    JsonNode me = call(botToken, "/getMe", null, null);
    if (!isOk(me)) {
      return CapabilityCheck.rejected(
          CapabilityCheck.STEP_BOT_TOKEN, description(me, "Invalid bot token"));
    }
    JsonNode botNode = me.path("result");
    CapabilityCheck.Bot bot =
        new CapabilityCheck.Bot(
            botNode.path("id").asLong(),
            botNode.path("username").asText(null),
            botNode.path("first_name").asText(null));

    JsonNode chatResponse = call(botToken, "/getChat?chat_id={chatId}", channelId, null);
    if (!isOk(chatResponse)) {
      return CapabilityCheck.rejected(
          CapabilityCheck.STEP_CHANNEL,
          description(chatResponse, "Invalid channel ID or bot not added to channel"));
    }
    JsonNode chatNode = chatResponse.path("result");
    String chatType = chatNode.path("type").asText("");
    if (!"channel".equals(chatType) && !"supergroup".equals(chatType)) {
      return CapabilityCheck.rejected(
          CapabilityCheck.STEP_CHANNEL, "The chat must be a channel or supergroup");
    }
    CapabilityCheck.Channel channel =
        new CapabilityCheck.Channel(
            chatNode.path("id").asLong(),
            chatNode.path("title").asText(null),
            chatType,
            chatNode.path("username").asText(null));

    JsonNode memberResponse =
        call(botToken, "/getChatMember?chat_id={chatId}&user_id={userId}", channelId, bot.id());
    if (!isOk(memberResponse)) {
      return CapabilityCheck.rejected(
          CapabilityCheck.STEP_PERMISSIONS, "Could not verify bot permissions");
    }
    JsonNode member = memberResponse.path("result");
    String status = member.path("status").asText("");
    if (!"administrator".equals(status) && !"creator".equals(status)) {
      return CapabilityCheck.rejected(
          CapabilityCheck.STEP_PERMISSIONS, "Bot must be an administrator in the channel");
    }
    if (!member.path("can_invite_users").asBoolean(false)) {
      return CapabilityCheck.rejected(
          CapabilityCheck.STEP_PERMISSIONS, "Bot needs 'Invite Users via Link' permission");
    }

    return CapabilityCheck.granted(bot, channel);
  }

  private JsonNode call(String botToken, String methodTemplate, String chatId, Long userId) {
    String uri = "/bot" + botToken + methodTemplate;
    try {
      RestClient.RequestHeadersSpec<?> request;
      if (userId != null) {
        request = rest.get().uri(uri, chatId, userId);
      } else if (chatId != null) {
        request = rest.get().uri(uri, chatId);
      } else {
        request = rest.get().uri(uri);
      }
      // Telegram answers 4xx with {"ok":false,"description":...}; read the body whatever the status
      return request.exchange((req, res) -> res.bodyTo(JsonNode.class));
    } catch (RestClientException e) {
      log.warn("Telegram call {} failed: {}", methodName(methodTemplate), e.getMessage());
      throw new AuthorityUnreachableException("Failed to connect to Telegram API", e);
    }
  }

  private static boolean isOk(JsonNode response) {
    return response != null && response.path("ok").asBoolean(false);
  }

  private static String description(JsonNode response, String fallback) {
    if (response == null) {
      return fallback;
    }
    String description = response.path("description").asText("");
    return description.isBlank() ? fallback : description;
  }

  private static String methodName(String methodTemplate) {
    int q = methodTemplate.indexOf('?');
    return q < 0 ? methodTemplate.substring(1) : methodTemplate.substring(1, q);
  }
}
