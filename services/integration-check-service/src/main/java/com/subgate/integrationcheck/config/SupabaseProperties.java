package com.subgate.integrationcheck.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Managed backend that owns object storage and the invoice records.
 *
 * <p>{@code serviceKey} is sent both as the {@code apikey} header and as a bearer token, which is
 * what the storage and PostgREST endpoints expect from a server-side caller.
 */
@Validated
@ConfigurationProperties(prefix = "integrations.supabase")
public record SupabaseProperties(
    @NotBlank String baseUrl,
    String serviceKey,
    @DefaultValue("invoice-proofs") @NotBlank String proofBucket,
    @DefaultValue("invoices") String invoicesTable) {}
