package com.flagship.tenant_ledger.transactionlog;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Partial update for a transaction log row. Null fields leave the stored value untouched.
 */
@Value
@Builder
public class TransactionLogUpdate {
    String gatewayTransactionId;
    UUID ledgerEntryId;
    String responsePayload;
    String webhookPayload;
    Integer httpStatus;
    String gatewayStatus;
    BigDecimal fee;
    BigDecimal netAmount;
    Boolean successful;
    String errorMessage;
    Instant webhookTimestamp;
}
