package com.flagship.tenant_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One immutable, signed monetary fact belonging to a tenant.
 *
 * Credits are positive, debits negative. Corrections never edit an entry;
 * they append a REVERSAL that points back at the original.
 */
@Value
@Builder(toBuilder = true)
public class LedgerEntry {
    UUID id;
    Long tenantId;
    EntryType type;
    BigDecimal amount;
    String referenceId;
    String externalTransactionId;   // null until the gateway assigns one
    EntryStatus status;
    String statusReason;
    UUID reversalOf;
    String description;
    Map<String, Object> metadata;
    Instant createdAt;
    Instant confirmedAt;
    Long sequenceNumber;            // assigned by database

    /**
     * Creates a new pending entry. Debit types are stored with a negative amount
     * regardless of the sign of {@code amount}.
     */
    public static LedgerEntry pending(Long tenantId, EntryType type, BigDecimal amount,
                                      String referenceId, String externalTransactionId,
                                      String description, Map<String, Object> metadata) {
        return LedgerEntry.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .type(type)
                .amount(signed(type, amount))
                .referenceId(referenceId)
                .externalTransactionId(externalTransactionId)
                .status(EntryStatus.PENDING)
                .description(description)
                .metadata(metadata == null ? Map.of() : metadata)
                .build();
    }

    private static BigDecimal signed(EntryType type, BigDecimal amount) {
        BigDecimal magnitude = amount.abs();
        return switch (type) {
            case CASH_IN -> magnitude;
            case CASH_OUT, FEE -> magnitude.negate();
            default -> amount;
        };
    }

    public boolean isPending() {
        return status == EntryStatus.PENDING;
    }

    public boolean isConfirmed() {
        return status == EntryStatus.CONFIRMED;
    }

    public boolean isDebit() {
        return amount.signum() < 0;
    }
}
