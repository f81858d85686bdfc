package com.flagship.tenant_ledger.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Process-wide holder of the gateway bearer token.
 *
 * Refreshes are serialized so a burst of requests at expiry triggers a single
 * token call.
 */
@Component
@Slf4j
public class GatewayTokenCache {

    private final GatewayProperties properties;
    private final Clock clock;

    private GatewayToken token;

    @Autowired
    public GatewayTokenCache(GatewayProperties properties) {
        this(properties, Clock.systemUTC());
    }

    GatewayTokenCache(GatewayProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Returns the cached access token, fetching a new one when it is missing or
     * inside the safety margin.
     */
    public synchronized String getOrRefresh(Supplier<GatewayToken> refresher) {
        if (token == null || !token.isUsableAt(clock.instant(), properties.getTokenSafetyMargin())) {
            log.debug("Gateway token missing or near expiry, refreshing");
            token = refresher.get();
        }
        return token.getAccessToken();
    }

    public synchronized void store(GatewayToken newToken) {
        this.token = newToken;
    }

    public synchronized void invalidate() {
        this.token = null;
    }

    public synchronized Optional<Instant> currentExpiry() {
        return Optional.ofNullable(token).map(GatewayToken::getExpiresAt);
    }

    public Instant now() {
        return clock.instant();
    }
}
