package com.subgate.integrationcheck.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "integrations.telegram")
public record TelegramProperties(
    @DefaultValue("https://api.telegram.org") @NotBlank String baseUrl) {}
