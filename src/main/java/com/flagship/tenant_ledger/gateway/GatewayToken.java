package com.flagship.tenant_ledger.gateway;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
public class GatewayToken {
    String accessToken;
    Instant expiresAt;

    /**
     * A token is reused until {@code now >= expiresAt - safetyMargin}.
     */
    public boolean isUsableAt(Instant now, Duration safetyMargin) {
        return now.isBefore(expiresAt.minus(safetyMargin));
    }
}
