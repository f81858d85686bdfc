package com.flagship.tenant_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tenant_ledger.exception.DuplicateExternalTransactionException;
import com.flagship.tenant_ledger.exception.DuplicateReferenceException;
import com.flagship.tenant_ledger.exception.EntryNotFoundException;
import com.flagship.tenant_ledger.exception.InsufficientBalanceException;
import com.flagship.tenant_ledger.exception.InvalidStateTransitionException;
import com.flagship.tenant_ledger.exception.WithdrawalLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only persistence of signed ledger entries per tenant.
 *
 * This store enforces the core invariants:
 * 1. Entries are never edited; only the status lifecycle moves forward
 *    (a database trigger rejects anything else, including DELETE)
 * 2. The balance is a fold over CONFIRMED entries, never a stored field
 * 3. A debit is appended only when the tenant's available balance covers it,
 *    checked and written under a per-tenant advisory lock in one transaction
 *
 * JDBC is used directly so that every statement the balance depends on is visible here.
 */
@Service
@Slf4j
public class LedgerStore {

    private static final String ENTRY_COLUMNS =
        "id, tenant_id, entry_type, amount, reference_id, external_transaction_id, status, status_reason, " +
        "reversal_of, description, metadata, created_at, confirmed_at, sequence_number";

    private static final String ACTIVE_REFERENCE_INDEX = "ux_ledger_entries_active_reference";
    private static final String EXTERNAL_TXN_INDEX = "ux_ledger_entries_external_txn";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public LedgerStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Appends an entry.
     *
     * @return the id of the stored entry
     * @throws DuplicateReferenceException if an active entry already exists for
     *         the same tenant, reference and type
     */
    @Transactional
    public UUID append(LedgerEntry entry) {
        validate(entry);

        if (findActiveByReference(entry.getTenantId(), entry.getReferenceId(), entry.getType()).isPresent()) {
            throw new DuplicateReferenceException(entry.getTenantId(), entry.getReferenceId(), entry.getType().name());
        }

        insert(entry);
        log.info("Ledger entry appended: entryId={}, tenantId={}, type={}, amount={}, status={}, referenceId={}",
                entry.getId(), entry.getTenantId(), entry.getType(), entry.getAmount(),
                entry.getStatus(), entry.getReferenceId());
        return entry.getId();
    }

    /**
     * Appends a debit only if the tenant can cover it.
     *
     * The tenant lock, the balance re-fold, the daily total and the insert all
     * happen in one transaction, so two concurrent withdrawals for the full
     * balance cannot both pass the check.
     *
     * @param debit pending debit entry (negative amount)
     * @param dailyLimit maximum total debited per UTC day, or null for no limit
     * @throws InsufficientBalanceException if available balance is lower than the debit
     * @throws WithdrawalLimitExceededException if the debit would exceed the daily limit
     */
    @Transactional
    public UUID appendDebitIfCovered(LedgerEntry debit, BigDecimal dailyLimit) {
        validate(debit);
        if (!debit.isDebit()) {
            throw new IllegalArgumentException("Conditional append requires a debit, got amount=" + debit.getAmount());
        }

        Long tenantId = debit.getTenantId();
        lockTenant(tenantId);

        if (findActiveByReference(tenantId, debit.getReferenceId(), debit.getType()).isPresent()) {
            throw new DuplicateReferenceException(tenantId, debit.getReferenceId(), debit.getType().name());
        }

        BigDecimal requested = debit.getAmount().negate();
        BigDecimal available = getAvailableBalance(tenantId);
        if (available.compareTo(requested) < 0) {
            log.warn("Debit rejected, insufficient balance: tenantId={}, available={}, requested={}",
                    tenantId, available, requested);
            throw new InsufficientBalanceException(tenantId, available, requested);
        }

        if (dailyLimit != null) {
            BigDecimal withdrawnToday = debitedSince(tenantId, startOfTodayUtc());
            if (withdrawnToday.add(requested).compareTo(dailyLimit) > 0) {
                throw new WithdrawalLimitExceededException(tenantId, withdrawnToday, requested, dailyLimit);
            }
        }

        insert(debit);
        log.info("Debit appended: entryId={}, tenantId={}, amount={}, availableBefore={}",
                debit.getId(), tenantId, debit.getAmount(), available);
        return debit.getId();
    }

    /**
     * Serializes ledger writes for one tenant until the surrounding transaction ends.
     * Other tenants are not blocked.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockTenant(Long tenantId) {
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", (ResultSetExtractor<Void>) rs -> null, tenantId);
    }

    /**
     * Confirmed balance: the fold of all CONFIRMED entries.
     */
    @Transactional(readOnly = true)
    public BigDecimal getBalance(Long tenantId) {
        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_entries WHERE tenant_id = ? AND status = 'CONFIRMED'",
            BigDecimal.class,
            tenantId
        );
        return balance != null ? balance : BigDecimal.ZERO;
    }

    /**
     * Confirmed balance minus funds reserved by pending debits.
     */
    @Transactional(readOnly = true)
    public BigDecimal getAvailableBalance(Long tenantId) {
        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_entries " +
            "WHERE tenant_id = ? AND (status = 'CONFIRMED' OR (status = 'PENDING' AND amount < 0))",
            BigDecimal.class,
            tenantId
        );
        return balance != null ? balance : BigDecimal.ZERO;
    }

    /**
     * Pending credits, shown to tenants as money on its way in.
     */
    @Transactional(readOnly = true)
    public BigDecimal getPendingCredits(Long tenantId) {
        BigDecimal pending = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_entries " +
            "WHERE tenant_id = ? AND status = 'PENDING' AND amount > 0",
            BigDecimal.class,
            tenantId
        );
        return pending != null ? pending : BigDecimal.ZERO;
    }

    @Transactional(readOnly = true)
    public Page<LedgerEntry> listEntries(Long tenantId, Pageable pageable) {
        List<LedgerEntry> entries = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE tenant_id = ? " +
            "ORDER BY sequence_number DESC LIMIT ? OFFSET ?",
            entryRowMapper(),
            tenantId, pageable.getPageSize(), pageable.getOffset()
        );
        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE tenant_id = ?", Long.class, tenantId);
        return new PageImpl<>(entries, pageable, total != null ? total : 0L);
    }

    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findById(UUID entryId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE id = ?",
            entryRowMapper(),
            entryId
        ).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findActiveByReference(Long tenantId, String referenceId, EntryType type) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries " +
            "WHERE tenant_id = ? AND reference_id = ? AND entry_type = ? AND status IN ('PENDING', 'CONFIRMED')",
            entryRowMapper(),
            tenantId, referenceId, type.name()
        ).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findByExternalTransactionId(String externalTransactionId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries " +
            "WHERE external_transaction_id = ? ORDER BY (status = 'REVERSED'), sequence_number DESC LIMIT 1",
            entryRowMapper(),
            externalTransactionId
        ).stream().findFirst();
    }

    /**
     * Entries that have stayed PENDING since before {@code cutoff}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> findPendingOlderThan(Instant cutoff, int limit) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries " +
            "WHERE status = 'PENDING' AND created_at < ? ORDER BY created_at LIMIT ?",
            entryRowMapper(),
            Timestamp.from(cutoff), limit
        );
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> findConfirmedBetween(Long tenantId, Collection<EntryType> types,
                                                  Instant from, Instant to) {
        String typePlaceholders = String.join(",", types.stream().map(t -> "?").toList());
        Object[] args = new Object[types.size() + 3];
        args[0] = tenantId;
        int i = 1;
        for (EntryType type : types) {
            args[i++] = type.name();
        }
        args[i++] = Timestamp.from(from);
        args[i] = Timestamp.from(to);

        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries " +
            "WHERE tenant_id = ? AND status = 'CONFIRMED' AND entry_type IN (" + typePlaceholders + ") " +
            "AND COALESCE(confirmed_at, created_at) >= ? AND COALESCE(confirmed_at, created_at) < ? " +
            "ORDER BY sequence_number",
            entryRowMapper(),
            args
        );
    }

    @Transactional(readOnly = true)
    public long countPending() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE status = 'PENDING'", Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Binds a gateway transaction id to a pending entry that does not have one yet.
     * Re-binding the same id is a no-op.
     */
    @Transactional
    public LedgerEntry assignExternalTransactionId(UUID entryId, String externalTransactionId) {
        LedgerEntry entry = lockEntry(entryId);
        if (externalTransactionId.equals(entry.getExternalTransactionId())) {
            return entry;
        }
        if (entry.getExternalTransactionId() != null) {
            throw new InvalidStateTransitionException(String.format(
                "Ledger entry %s already bound to external transaction %s",
                entryId, entry.getExternalTransactionId()));
        }
        try {
            jdbcTemplate.update(
                "UPDATE ledger_entries SET external_transaction_id = ? WHERE id = ?",
                externalTransactionId, entryId);
        } catch (DuplicateKeyException e) {
            throw new DuplicateExternalTransactionException(externalTransactionId);
        }
        return requireEntry(entryId);
    }

    /**
     * Moves a PENDING entry to CONFIRMED.
     *
     * @throws InvalidStateTransitionException if the entry is not PENDING
     */
    @Transactional
    public LedgerEntry markConfirmed(UUID entryId, String externalTransactionId) {
        LedgerEntry entry = lockEntry(entryId);
        requireTransition(entry, EntryStatus.CONFIRMED);
        return confirm(entry, externalTransactionId);
    }

    /**
     * Confirms the entry if it is still PENDING. An entry already CONFIRMED for
     * the same external transaction is returned unchanged.
     *
     * @throws InvalidStateTransitionException if the entry already failed or was reversed
     */
    @Transactional
    public LedgerEntry confirmIfPending(UUID entryId, String externalTransactionId) {
        LedgerEntry entry = lockEntry(entryId);
        if (entry.isConfirmed() && sameExternalId(entry, externalTransactionId)) {
            log.debug("Entry {} already confirmed, nothing to do", entryId);
            return entry;
        }
        requireTransition(entry, EntryStatus.CONFIRMED);
        return confirm(entry, externalTransactionId);
    }

    /**
     * Moves a PENDING entry to FAILED. Used when money never moved, for example an expired invoice.
     */
    @Transactional
    public LedgerEntry markFailed(UUID entryId, String reason) {
        LedgerEntry entry = lockEntry(entryId);
        requireTransition(entry, EntryStatus.FAILED);

        jdbcTemplate.update(
            "UPDATE ledger_entries SET status = 'FAILED', status_reason = ? WHERE id = ?",
            reason, entryId);

        log.info("Ledger entry failed: entryId={}, tenantId={}, reason={}", entryId, entry.getTenantId(), reason);
        return requireEntry(entryId);
    }

    /**
     * Reverses a PENDING or CONFIRMED entry by appending an offsetting REVERSAL entry.
     *
     * Both the original and the reversal end up REVERSED, so the pair nets to
     * zero and neither counts toward the confirmed balance.
     *
     * @return the new reversal entry
     */
    @Transactional
    public LedgerEntry reverse(UUID entryId, String reason) {
        LedgerEntry original = lockEntry(entryId);
        requireTransition(original, EntryStatus.REVERSED);
        return appendReversal(original, reason);
    }

    /**
     * Reverses the entry only while it is still PENDING. Returns empty when the
     * entry was already reversed or failed.
     *
     * @throws InvalidStateTransitionException if the entry is CONFIRMED
     */
    @Transactional
    public Optional<LedgerEntry> reverseIfPending(UUID entryId, String reason) {
        LedgerEntry original = lockEntry(entryId);
        if (original.getStatus().isTerminal()) {
            log.debug("Entry {} already {}, reversal skipped", entryId, original.getStatus());
            return Optional.empty();
        }
        if (!original.isPending()) {
            throw new InvalidStateTransitionException(String.format(
                "Ledger entry %s is %s, only pending entries are reversed on gateway failure",
                entryId, original.getStatus()));
        }
        return Optional.of(appendReversal(original, reason));
    }

    private LedgerEntry confirm(LedgerEntry entry, String externalTransactionId) {
        if (externalTransactionId != null && entry.getExternalTransactionId() != null
                && !externalTransactionId.equals(entry.getExternalTransactionId())) {
            throw new InvalidStateTransitionException(String.format(
                "Ledger entry %s is bound to external transaction %s, not %s",
                entry.getId(), entry.getExternalTransactionId(), externalTransactionId));
        }
        try {
            jdbcTemplate.update(
                "UPDATE ledger_entries SET status = 'CONFIRMED', confirmed_at = CURRENT_TIMESTAMP, " +
                "external_transaction_id = COALESCE(external_transaction_id, ?) WHERE id = ?",
                externalTransactionId, entry.getId());
        } catch (DuplicateKeyException e) {
            throw new DuplicateExternalTransactionException(externalTransactionId);
        }

        log.info("Ledger entry confirmed: entryId={}, tenantId={}, amount={}, externalTransactionId={}",
                entry.getId(), entry.getTenantId(), entry.getAmount(), externalTransactionId);
        return requireEntry(entry.getId());
    }

    private LedgerEntry appendReversal(LedgerEntry original, String reason) {
        jdbcTemplate.update(
            "UPDATE ledger_entries SET status = 'REVERSED', status_reason = ? WHERE id = ?",
            reason, original.getId());

        LedgerEntry reversal = LedgerEntry.builder()
                .id(UUID.randomUUID())
                .tenantId(original.getTenantId())
                .type(EntryType.REVERSAL)
                .amount(original.getAmount().negate())
                .referenceId(original.getReferenceId())
                .status(EntryStatus.REVERSED)
                .statusReason(reason)
                .reversalOf(original.getId())
                .description("Reversal of " + original.getType() + " " + original.getId())
                .metadata(Map.of("reason", reason == null ? "" : reason))
                .build();
        insert(reversal);

        log.info("Ledger entry reversed: entryId={}, reversalId={}, tenantId={}, amount={}, previousStatus={}, reason={}",
                original.getId(), reversal.getId(), original.getTenantId(), original.getAmount(),
                original.getStatus(), reason);
        return requireEntry(reversal.getId());
    }

    private void insert(LedgerEntry entry) {
        try {
            jdbcTemplate.update(
                "INSERT INTO ledger_entries (id, tenant_id, entry_type, amount, reference_id, external_transaction_id, " +
                "status, status_reason, reversal_of, description, metadata, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, CURRENT_TIMESTAMP)",
                entry.getId(),
                entry.getTenantId(),
                entry.getType().name(),
                entry.getAmount(),
                entry.getReferenceId(),
                entry.getExternalTransactionId(),
                entry.getStatus().name(),
                entry.getStatusReason(),
                entry.getReversalOf(),
                entry.getDescription(),
                writeMetadata(entry.getMetadata())
            );
        } catch (DuplicateKeyException e) {
            String detail = e.getMessage() != null ? e.getMessage() : "";
            if (detail.contains(EXTERNAL_TXN_INDEX)) {
                throw new DuplicateExternalTransactionException(entry.getExternalTransactionId());
            }
            if (detail.contains(ACTIVE_REFERENCE_INDEX)) {
                throw new DuplicateReferenceException(entry.getTenantId(), entry.getReferenceId(), entry.getType().name());
            }
            throw e;
        }
    }

    private BigDecimal debitedSince(Long tenantId, Instant since) {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(-amount), 0) FROM ledger_entries " +
            "WHERE tenant_id = ? AND entry_type = 'CASH_OUT' AND status IN ('PENDING', 'CONFIRMED') AND created_at >= ?",
            BigDecimal.class,
            tenantId, Timestamp.from(since)
        );
        return total != null ? total : BigDecimal.ZERO;
    }

    private LedgerEntry lockEntry(UUID entryId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE id = ? FOR UPDATE",
            entryRowMapper(),
            entryId
        ).stream().findFirst().orElseThrow(() -> new EntryNotFoundException(entryId));
    }

    private LedgerEntry requireEntry(UUID entryId) {
        return findById(entryId).orElseThrow(() -> new EntryNotFoundException(entryId));
    }

    private static void requireTransition(LedgerEntry entry, EntryStatus target) {
        if (!entry.getStatus().canTransitionTo(target)) {
            throw new InvalidStateTransitionException(entry.getId(), entry.getStatus().name(), target.name());
        }
    }

    private static boolean sameExternalId(LedgerEntry entry, String externalTransactionId) {
        return externalTransactionId == null || externalTransactionId.equals(entry.getExternalTransactionId());
    }

    private static Instant startOfTodayUtc() {
        return LocalDate.now(ZoneOffset.UTC).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    private static void validate(LedgerEntry entry) {
        if (entry.getTenantId() == null) {
            throw new IllegalArgumentException("Ledger entry requires a tenant");
        }
        if (entry.getAmount() == null || entry.getAmount().signum() == 0) {
            throw new IllegalArgumentException("Ledger entry amount must be non-zero");
        }
        if (entry.getReferenceId() == null || entry.getReferenceId().isBlank()) {
            throw new IllegalArgumentException("Ledger entry requires a reference id");
        }
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize entry metadata", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt entry metadata", e);
        }
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> {
            String reversalOf = rs.getString("reversal_of");
            Timestamp confirmedAt = rs.getTimestamp("confirmed_at");
            return LedgerEntry.builder()
                    .id(UUID.fromString(rs.getString("id")))
                    .tenantId(rs.getLong("tenant_id"))
                    .type(EntryType.valueOf(rs.getString("entry_type")))
                    .amount(rs.getBigDecimal("amount"))
                    .referenceId(rs.getString("reference_id"))
                    .externalTransactionId(rs.getString("external_transaction_id"))
                    .status(EntryStatus.valueOf(rs.getString("status")))
                    .statusReason(rs.getString("status_reason"))
                    .reversalOf(reversalOf != null ? UUID.fromString(reversalOf) : null)
                    .description(rs.getString("description"))
                    .metadata(readMetadata(rs.getString("metadata")))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .confirmedAt(confirmedAt != null ? confirmedAt.toInstant() : null)
                    .sequenceNumber(rs.getLong("sequence_number"))
                    .build();
        };
    }
}
