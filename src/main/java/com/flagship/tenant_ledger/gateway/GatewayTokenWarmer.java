package com.flagship.tenant_ledger.gateway;

import com.flagship.tenant_ledger.exception.GatewayException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Fetches the gateway token once the application is ready, so the first money
 * movement does not also pay for the token round trip and bad credentials show
 * up in the startup log instead of on a tenant's request.
 *
 * A failure here does not stop the application; the adapter fetches a token
 * on demand anyway.
 */
@Component
@ConditionalOnProperty(prefix = "gateway", name = "warm-up-token", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class GatewayTokenWarmer {

    private final GatewayAdapter gatewayAdapter;

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        try {
            gatewayAdapter.authenticate();
            log.info("Gateway token warmed up on startup");
        } catch (GatewayException e) {
            log.warn("Gateway token warm-up failed, tokens will be fetched on demand: errorCode={}, message={}",
                    e.getErrorCode(), e.getMessage());
        }
    }
}
