package com.subgate.integrationcheck.telegram;

import com.fasterxml.jackson.annotation.JsonAlias;

public record ValidationRequest(
    @JsonAlias("bot_token") String botToken, @JsonAlias("channel_id") String channelId) {

  @Override
  public String toString() {
    return "ValidationRequest[botToken=***, channelId=" + channelId + "]";
  }
}
