package com.flagship.tenant_ledger.gateway;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the settlement gateway ({@code gateway.*}).
 */
@ConfigurationProperties(prefix = "gateway")
@Getter
@Setter
public class GatewayProperties {

    private String baseUrl;
    private String clientId;
    private String clientSecret;
    private String webhookSecret;
    private String signatureHeader = "X-Signature";
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(30);
    private Duration tokenSafetyMargin = Duration.ofSeconds(60);
    private int maxConnections = 50;
    private boolean warmUpToken = true;
}
