package com.flagship.tenant_ledger.gateway;

import java.util.Arrays;

/**
 * Gateway status vocabulary normalised for the ledger.
 */
public enum GatewayTransactionStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED,
    EXPIRED,
    UNKNOWN;

    public boolean isTerminalSuccess() {
        return this == COMPLETED;
    }

    public boolean isTerminalFailure() {
        return this == FAILED || this == CANCELLED || this == EXPIRED;
    }

    public boolean isTerminal() {
        return isTerminalSuccess() || isTerminalFailure();
    }

    /**
     * Whether a stored status name is one of the terminal statuses. Names outside
     * this vocabulary, such as an escalation marker, are not terminal.
     */
    public static boolean isTerminalName(String name) {
        return name != null && Arrays.stream(values())
                .anyMatch(status -> status.isTerminal() && status.name().equals(name));
    }
}
