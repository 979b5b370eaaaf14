package com.subgate.integrationcheck.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.subgate.integrationcheck.common.error.StorageFailureException;
import com.subgate.integrationcheck.config.SupabaseProperties;
import java.time.Duration;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Supabase Storage REST API, authenticated with the service key. */
@Service
@Slf4j
public class SupabaseStorageClient implements ProofStorage {

  private final RestClient rest;
  private final String baseUrl;
  private final String bucket;

  public SupabaseStorageClient(RestClient.Builder builder, SupabaseProperties properties) {
    String serviceKey = properties.serviceKey() == null ? "" : properties.serviceKey().trim();
    this.baseUrl = trimTrailingSlash(properties.baseUrl());
    this.bucket = properties.proofBucket();
    this.rest =
        builder
            .baseUrl(baseUrl + "/storage/v1")
            .defaultHeader("apikey", serviceKey)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + serviceKey)
            .build();
  }

  @Override
  public void put(String path, byte[] content, String contentType, boolean overwrite) {
    try {
      rest.post()
          .uri("/object/" + bucket + "/" + path)
          .contentType(MediaType.parseMediaType(contentType))
          .header("x-upsert", String.valueOf(overwrite))
          .body(content)
          .retrieve()
          .toBodilessEntity();
      log.info("Stored {} bytes at {}/{}", content.length, bucket, path);
    } catch (RestClientException e) {
      log.warn("Upload to {}/{} failed: {}", bucket, path, e.getMessage());
      throw new StorageFailureException("Upload to object storage failed", e);
    }
  }

  @Override
  public String signedUrl(String path, Duration ttl) {
    JsonNode response;
    try {
      response =
          rest.post()
              .uri("/object/sign/" + bucket + "/" + path)
              .contentType(MediaType.APPLICATION_JSON)
              .body(Map.of("expiresIn", ttl.toSeconds()))
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientException e) {
      log.warn("Signing {}/{} failed: {}", bucket, path, e.getMessage());
      throw new StorageFailureException("Signed URL issuance failed", e);
    }
    String signed = response == null ? "" : response.path("signedURL").asText("");
    if (signed.isBlank()) {
      throw new StorageFailureException("Object storage returned no signed URL for " + path);
    }
    if (signed.startsWith("http://") || signed.startsWith("https://")) {
      return signed;
    }
    return baseUrl + "/storage/v1" + (signed.startsWith("/") ? signed : "/" + signed);
  }

  private static String trimTrailingSlash(String url) {
    if (url == null) {
      return "";
    }
    String out = url.trim();
    while (out.endsWith("/")) {
      out = out.substring(0, out.length() - 1);
    }
    return out;
  }
}
