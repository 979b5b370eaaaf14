package com.subgate.integrationcheck.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "integrations.proof")
public record ProofProperties(
    @DefaultValue("365d") Duration signedUrlTtl, @DefaultValue("30m") Duration pipelineIdleTtl) {}
