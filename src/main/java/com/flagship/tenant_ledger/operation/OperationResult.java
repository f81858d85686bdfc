package com.flagship.tenant_ledger.operation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.tenant_ledger.ledger.EntryStatus;
import com.flagship.tenant_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a cash-in or cash-out, as returned to the business layer.
 *
 * {@code transactionId} is the correlation id of the gateway call; it is known
 * even when the gateway never answered.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationResult {
    boolean success;
    String transactionId;
    OperationStatus status;
    String message;
    ErrorCode errorCode;
    UUID entryId;
    String externalId;
    boolean duplicate;
    boolean outcomeUnknown;
    String qrCodeOrBarcode;
    Instant expiresAt;
    BigDecimal fee;

    public static OperationResult failed(ErrorCode errorCode, String message) {
        return OperationResult.builder()
                .success(false)
                .status(OperationStatus.FAILED)
                .errorCode(errorCode)
                .message(message)
                .build();
    }

    /**
     * Result for an entry that already exists, e.g. a retried request.
     */
    public static OperationResult forEntry(LedgerEntry entry, String transactionId, String message) {
        OperationStatus status = switch (entry.getStatus()) {
            case CONFIRMED -> OperationStatus.COMPLETED;
            case PENDING -> OperationStatus.PENDING;
            case FAILED, REVERSED -> OperationStatus.FAILED;
        };
        return OperationResult.builder()
                .success(entry.getStatus() != EntryStatus.FAILED && entry.getStatus() != EntryStatus.REVERSED)
                .transactionId(transactionId)
                .status(status)
                .message(message)
                .entryId(entry.getId())
                .externalId(entry.getExternalTransactionId())
                .build();
    }
}
