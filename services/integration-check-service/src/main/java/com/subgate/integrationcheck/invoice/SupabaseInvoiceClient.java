package com.subgate.integrationcheck.invoice;

import com.fasterxml.jackson.databind.JsonNode;
import com.subgate.integrationcheck.config.SupabaseProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

/**
 * Attaches an uploaded proof to its invoice row through PostgREST.
 *
 * <p>The service key bypasses row level security, so the update is filtered on the invoice's
 * {@code client_id} as well as its id, and the updated rows are read back to make sure one matched.
 */
@Service
@Slf4j
public class SupabaseInvoiceClient implements InvoiceProofSink {

  static final String REVIEW_NOTE = "Payment proof uploaded, awaiting review";
  static final String OWNER_COLUMN = "client_id";

  private final RestClient rest;
  private final String table;

  public SupabaseInvoiceClient(RestClient.Builder builder, SupabaseProperties properties) {
    String serviceKey = properties.serviceKey() == null ? "" : properties.serviceKey().trim();
    String baseUrl = properties.baseUrl() == null ? "" : properties.baseUrl().trim();
    if (baseUrl.endsWith("/")) {
      baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
    this.table = properties.invoicesTable();
    this.rest =
        builder
            .baseUrl(baseUrl + "/rest/v1")
            .defaultHeader("apikey", serviceKey)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + serviceKey)
            .build();
  }

  @Override
  public void onProofReady(String ownerId, String invoiceId, String retrievalUrl) {
    Map<String, Object> patch = new LinkedHashMap<>();
    patch.put("payment_proof_url", retrievalUrl);
    patch.put("notes", REVIEW_NOTE);
    JsonNode updated =
        rest.patch()
            .uri(
                "/" + table + "?id=eq.{id}&" + OWNER_COLUMN + "=eq.{owner}&select=id",
                invoiceId,
                ownerId)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .header("Prefer", "return=representation")
            .body(patch)
            .retrieve()
            .body(JsonNode.class);

    if (updated == null || !updated.isArray() || updated.isEmpty()) {
      log.warn("Invoice {} not found for client {}, proof not attached", invoiceId, ownerId);
      throw new InvoiceNotFoundException("Invoice " + invoiceId + " not found");
    }
    log.info("Invoice {} now references its payment proof", invoiceId);
  }
}
