package com.subgate.integrationcheck.stripe;

import com.fasterxml.jackson.databind.JsonNode;
import com.subgate.integrationcheck.common.error.AuthorityUnreachableException;
import com.subgate.integrationcheck.config.StripeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Service
@Slf4j
public class StripeAccountClient implements PaymentAccountAuthority {

  private static final String DEFAULT_ACCOUNT_NAME = "Stripe Account";

  private final RestClient rest;

  public StripeAccountClient(RestClient.Builder builder, StripeProperties properties) {
    this.rest = builder.baseUrl(properties.baseUrl()).build();
  }

  @Override
  public AccountLookup fetchAccount(String secretKey) {
    try {
      return rest.get()
          .uri("/v1/account")
          .header(HttpHeaders.AUTHORIZATION, "Bearer " + secretKey)
          .accept(MediaType.APPLICATION_JSON)
          .exchange(
              (req, res) -> {
                JsonNode body = res.bodyTo(JsonNode.class);
                if (!res.getStatusCode().is2xxSuccessful()) {
                  String message =
                      body == null ? "" : body.path("error").path("message").asText("");
                  log.warn("Stripe account lookup refused with status {}", res.getStatusCode());
                  return AccountLookup.refused(message.isBlank() ? "Invalid API key" : message);
                }
                if (body == null) {
                  throw new AuthorityUnreachableException(
                      "Stripe returned an empty response", null);
                }
                return AccountLookup.found(
                    body.path("id").asText(null),
                    accountName(body),
                    body.path("charges_enabled").asBoolean(false));
              });
    } catch (RestClientException e) {
      log.warn("Stripe account lookup failed: {}", e.getMessage());
      throw new AuthorityUnreachableException("Failed to connect to Stripe API", e);
    }
  }

  private static String accountName(JsonNode account) {
    String[] candidates = {
      account.path("business_profile").path("name").asText(""),
      account.path("settings").path("dashboard").path("display_name").asText(""),
      account.path("email").asText("")
    };
    for (String candidate : candidates) {
      if (!candidate.isBlank()) {
        return candidate;
      }
    }
    return DEFAULT_ACCOUNT_NAME;
  }
}
