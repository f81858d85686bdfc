package com.flagship.tenant_ledger.operation;

import com.flagship.tenant_ledger.PostgresTestSupport;
import com.flagship.tenant_ledger.audit.event.ContradictoryOutcomeEvent;
import com.flagship.tenant_ledger.audit.event.InvalidWebhookSignatureEvent;
import com.flagship.tenant_ledger.exception.GatewayOutcomeUnknownException;
import com.flagship.tenant_ledger.exception.GatewayRejectedException;
import com.flagship.tenant_ledger.exception.GatewayTimeoutException;
import com.flagship.tenant_ledger.exception.GatewayUnavailableException;
import com.flagship.tenant_ledger.exception.InvalidWebhookSignatureException;
import com.flagship.tenant_ledger.gateway.GatewayPaymentRequest;
import com.flagship.tenant_ledger.gateway.GatewayPaymentResponse;
import com.flagship.tenant_ledger.gateway.GatewayTransactionStatus;
import com.flagship.tenant_ledger.gateway.GatewayWebhookEvent;
import com.flagship.tenant_ledger.gateway.GatewayWithdrawalRequest;
import com.flagship.tenant_ledger.gateway.GatewayWithdrawalResponse;
import com.flagship.tenant_ledger.gateway.PaymentMethod;
import com.flagship.tenant_ledger.ledger.EntryStatus;
import com.flagship.tenant_ledger.ledger.EntryType;
import com.flagship.tenant_ledger.ledger.LedgerEntry;
import com.flagship.tenant_ledger.ledger.LedgerStore;
import com.flagship.tenant_ledger.operation.dto.BalanceResponse;
import com.flagship.tenant_ledger.operation.dto.CashInRequest;
import com.flagship.tenant_ledger.operation.dto.CashOutRequest;
import com.flagship.tenant_ledger.outbox.OutboxService;
import com.flagship.tenant_ledger.transactionlog.TransactionLog;
import com.flagship.tenant_ledger.transactionlog.TransactionLogService;
import com.flagship.tenant_ledger.webhook.WebhookResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.net.ConnectException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Money movements end to end against a real database, with the gateway mocked.
 */
@SpringBootTest
class LedgerServiceTest extends PostgresTestSupport {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private TransactionLogService transactionLogService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long tenantId;

    @BeforeEach
    void setUp() {
        tenantId = registerTenant(jdbcTemplate);
    }

    // ==================== Helpers ====================

    private CashInRequest cashIn(String referenceId, String amount) {
        return CashInRequest.builder()
                .tenantId(tenantId)
                .referenceId(referenceId)
                .amount(new BigDecimal(amount))
                .method(PaymentMethod.PIX)
                .description("test cash-in")
                .build();
    }

    private CashOutRequest cashOut(String referenceId, String amount) {
        return CashOutRequest.builder()
                .tenantId(tenantId)
                .referenceId(referenceId)
                .amount(new BigDecimal(amount))
                .destination(new CashOutRequest.Destination("341", "0001", "12345-6", "CHECKING",
                        "Jane Tenant", "12345678900"))
                .build();
    }

    private static GatewayPaymentResponse payment(String externalId, GatewayTransactionStatus status) {
        return GatewayPaymentResponse.builder()
                .externalId(externalId)
                .status(status)
                .qrCodeOrBarcode("00020126-pix-key")
                .httpStatus(201)
                .rawResponse("{\"transactionId\":\"" + externalId + "\"}")
                .build();
    }

    private static GatewayWithdrawalResponse withdrawal(String externalId, GatewayTransactionStatus status,
                                                        String fee) {
        return GatewayWithdrawalResponse.builder()
                .externalId(externalId)
                .status(status)
                .fee(fee == null ? null : new BigDecimal(fee))
                .httpStatus(201)
                .rawResponse("{\"id\":\"" + externalId + "\"}")
                .build();
    }

    private void fund(String amount) {
        String externalId = "gw-fund-" + UUID.randomUUID();
        when(gatewayAdapter.createPayment(any())).thenReturn(payment(externalId, GatewayTransactionStatus.COMPLETED));
        OperationResult result = ledgerService.processCashIn(cashIn("FUND-" + UUID.randomUUID(), amount));
        assertEquals(OperationStatus.COMPLETED, result.getStatus());
    }

    private WebhookResult deliver(GatewayWebhookEvent event) {
        String payload = "{\"transactionId\":\"" + event.getGatewayTransactionId() + "\",\"correlationID\":\""
                + event.getCorrelationId() + "\",\"status\":\"" + event.getStatus() + "\"}";
        when(gatewayAdapter.verifyWebhookSignature(eq(payload), anyString())).thenReturn(true);
        when(gatewayAdapter.parseWebhook(payload)).thenReturn(event);
        return ledgerService.handleWebhook(payload, "sha256=valid");
    }

    private static GatewayWebhookEvent event(String gatewayId, String correlationId, GatewayTransactionStatus status,
                                             String amount) {
        return GatewayWebhookEvent.builder()
                .gatewayTransactionId(gatewayId)
                .correlationId(correlationId)
                .status(status)
                .amount(amount == null ? null : new BigDecimal(amount))
                .occurredAt(Instant.now())
                .build();
    }

    private BalanceResponse balance() {
        return ledgerService.getBalance(tenantId);
    }

    // ==================== Cash-in ====================

    @Nested
    @DisplayName("Cash-in")
    class CashIn {

        @Test
        @DisplayName("A payment the gateway reports paid is confirmed immediately")
        void confirmedSynchronously() {
            // Given
            when(gatewayAdapter.createPayment(any())).thenReturn(payment("gw-in-1-" + tenantId,
                    GatewayTransactionStatus.COMPLETED));

            // When
            OperationResult result = ledgerService.processCashIn(cashIn("ORDER-1", "100.00"));

            // Then
            assertTrue(result.isSuccess());
            assertEquals(OperationStatus.COMPLETED, result.getStatus());
            assertEquals("00020126-pix-key", result.getQrCodeOrBarcode());
            assertTrue(result.getTransactionId().startsWith("CI-"));
            assertEquals(0, balance().getConfirmed().compareTo(new BigDecimal("100.00")));
        }

        @Test
        @DisplayName("A pending payment shows as pending credit until the webhook confirms it")
        void pendingUntilWebhook() {
            String externalId = "gw-in-2-" + tenantId;
            when(gatewayAdapter.createPayment(any())).thenReturn(payment(externalId, GatewayTransactionStatus.PENDING));

            OperationResult result = ledgerService.processCashIn(cashIn("ORDER-2", "100.00"));

            assertEquals(OperationStatus.PENDING, result.getStatus());
            assertEquals(0, balance().getConfirmed().compareTo(BigDecimal.ZERO));
            assertEquals(0, balance().getPendingCredits().compareTo(new BigDecimal("100.00")));

            WebhookResult webhook = deliver(event(externalId, null, GatewayTransactionStatus.COMPLETED, "100.00"));

            assertEquals(WebhookResult.APPLIED, webhook);
            assertEquals(0, balance().getConfirmed().compareTo(new BigDecimal("100.00")));
            assertEquals(EntryStatus.CONFIRMED, ledgerStore.findById(result.getEntryId()).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("Repeating a reference returns the original entry without a second gateway call")
        void duplicateReference() {
            when(gatewayAdapter.createPayment(any())).thenReturn(payment("gw-in-3-" + tenantId,
                    GatewayTransactionStatus.COMPLETED));

            OperationResult first = ledgerService.processCashIn(cashIn("ORDER-3", "100.00"));
            OperationResult second = ledgerService.processCashIn(cashIn("ORDER-3", "100.00"));

            assertFalse(first.isDuplicate());
            assertTrue(second.isDuplicate());
            assertEquals(first.getEntryId(), second.getEntryId());
            assertEquals(first.getTransactionId(), second.getTransactionId());
            verify(gatewayAdapter, times(1)).createPayment(any());
            assertEquals(0, balance().getConfirmed().compareTo(new BigDecimal("100.00")));
        }

        @Test
        @DisplayName("After a timeout the payment is booked by the late webhook, exactly once")
        void timeoutThenLateWebhook() {
            // Given: the gateway never answers the create call
            when(gatewayAdapter.createPayment(any())).thenThrow(new GatewayTimeoutException("read timed out", null));

            OperationResult result = ledgerService.processCashIn(cashIn("ORDER-4", "100.00"));

            // Then: the outcome is unknown and no entry exists yet
            assertTrue(result.isOutcomeUnknown());
            assertEquals(OperationStatus.PENDING, result.getStatus());
            assertTrue(ledgerStore.findActiveByReference(tenantId, "ORDER-4", EntryType.CASH_IN).isEmpty());
            TransactionLog attempt = transactionLogService.find(result.getTransactionId()).orElseThrow();
            assertTrue(attempt.isAwaitingOutcome());

            // And: a retry while the outcome is unknown does not call the gateway again
            OperationResult retry = ledgerService.processCashIn(cashIn("ORDER-4", "100.00"));
            assertTrue(retry.isDuplicate());
            assertEquals(result.getTransactionId(), retry.getTransactionId());
            verify(gatewayAdapter, times(1)).createPayment(any());

            // When: the webhook arrives, twice
            String externalId = "gw-in-4-" + tenantId;
            GatewayWebhookEvent paid = event(externalId, result.getTransactionId(),
                    GatewayTransactionStatus.COMPLETED, "100.00");
            WebhookResult first = deliver(paid);
            WebhookResult second = deliver(paid);

            // Then: one confirmed entry, bound to the gateway id
            assertEquals(WebhookResult.APPLIED, first);
            assertEquals(WebhookResult.APPLIED, second);
            LedgerEntry entry = ledgerStore.findActiveByReference(tenantId, "ORDER-4", EntryType.CASH_IN).orElseThrow();
            assertEquals(EntryStatus.CONFIRMED, entry.getStatus());
            assertEquals(externalId, entry.getExternalTransactionId());
            assertEquals(0, balance().getConfirmed().compareTo(new BigDecimal("100.00")));
            assertEquals(entry.getId(),
                    transactionLogService.find(result.getTransactionId()).orElseThrow().getLedgerEntryId());
        }

        @Test
        @DisplayName("A gateway refusal books nothing")
        void rejectedPayment() {
            when(gatewayAdapter.createPayment(any()))
                    .thenThrow(new GatewayRejectedException("Gateway rejected createPixPayment: 400", 400,
                            "{\"error\":\"invalid payer\"}"));

            OperationResult result = ledgerService.processCashIn(cashIn("ORDER-5", "100.00"));

            assertFalse(result.isSuccess());
            assertEquals(ErrorCode.GATEWAY_REJECTED, result.getErrorCode());
            assertTrue(ledgerStore.findActiveByReference(tenantId, "ORDER-5", EntryType.CASH_IN).isEmpty());
            TransactionLog attempt = transactionLogService.find(result.getTransactionId()).orElseThrow();
            assertEquals(Boolean.FALSE, attempt.getSuccessful());
            assertTrue(attempt.getErrorMessage().contains("invalid payer"));
        }

        @Test
        @DisplayName("Amounts with more than two decimals and unknown tenants are refused")
        void validation() {
            OperationResult badAmount = ledgerService.processCashIn(cashIn("ORDER-6", "10.001"));
            OperationResult unknownTenant = ledgerService.processCashIn(
                    cashIn("ORDER-7", "10.00").withTenantId(newTenantId()));

            assertEquals(ErrorCode.VALIDATION_ERROR, badAmount.getErrorCode());
            assertEquals(ErrorCode.TENANT_ACCOUNT_NOT_FOUND, unknownTenant.getErrorCode());
            verify(gatewayAdapter, never()).createPayment(any());
        }
    }

    // ==================== Cash-out ====================

    @Nested
    @DisplayName("Cash-out")
    class CashOut {

        @Test
        @DisplayName("100 in, 60 out leaves 40; a second 60 is refused without calling the gateway")
        void insufficientBalance() {
            fund("100.00");
            when(gatewayAdapter.createWithdrawal(any()))
                    .thenReturn(withdrawal("gw-out-1-" + tenantId, GatewayTransactionStatus.COMPLETED, null));

            OperationResult first = ledgerService.processCashOut(cashOut("PAYOUT-1", "60.00"));
            OperationResult second = ledgerService.processCashOut(cashOut("PAYOUT-2", "60.00"));

            assertEquals(OperationStatus.COMPLETED, first.getStatus());
            assertEquals(ErrorCode.INSUFFICIENT_BALANCE, second.getErrorCode());
            verify(gatewayAdapter, times(1)).createWithdrawal(any());
            assertEquals(0, balance().getConfirmed().compareTo(new BigDecimal("40.00")));
        }

        @Test
        @DisplayName("A withdrawal fee comes out of the withdrawn amount, not on top of it")
        void feeIncludedInAmount() {
            fund("100.00");
            when(gatewayAdapter.createWithdrawal(any()))
                    .thenReturn(withdrawal("gw-out-2-" + tenantId, GatewayTransactionStatus.COMPLETED, "1.50"));

            OperationResult result = ledgerService.processCashOut(cashOut("PAYOUT-3", "60.00"));

            assertEquals(0, result.getFee().compareTo(new BigDecimal("1.50")));
            assertEquals(0, balance().getConfirmed().compareTo(new BigDecimal("40.00")));
            assertTrue(ledgerStore.findActiveByReference(tenantId, "PAYOUT-3", EntryType.FEE).isEmpty());
            TransactionLog attempt = transactionLogService.find(result.getTransactionId()).orElseThrow();
            assertEquals(0, attempt.getNetAmount().compareTo(new BigDecimal("58.50")));
        }

        @Test
        @DisplayName("Withdrawing the whole balance with a fee leaves exactly zero")
        void wholeBalanceWithFee() {
            // Given
            fund("100.00");
            when(gatewayAdapter.createWithdrawal(any()))
                    .thenReturn(withdrawal("gw-out-fee-" + tenantId, GatewayTransactionStatus.COMPLETED, "2.50"));

            // When
            OperationResult result = ledgerService.processCashOut(cashOut("PAYOUT-FEE", "100.00"));

            // Then
            assertEquals(OperationStatus.COMPLETED, result.getStatus());
            BalanceResponse after = balance();
            assertEquals(0, after.getConfirmed().compareTo(BigDecimal.ZERO));
            assertEquals(0, after.getAvailable().compareTo(BigDecimal.ZERO));
            assertEquals(0, transactionLogService.find(result.getTransactionId()).orElseThrow()
                    .getNetAmount().compareTo(new BigDecimal("97.50")));
        }

        @Test
        @DisplayName("A refused withdrawal releases the reserved funds")
        void rejectionReleasesFunds() {
            fund("100.00");
            when(gatewayAdapter.createWithdrawal(any()))
                    .thenThrow(new GatewayRejectedException("Gateway rejected createWithdrawal: 422", 422,
                            "{\"error\":\"closed account\"}"));

            OperationResult result = ledgerService.processCashOut(cashOut("PAYOUT-4", "60.00"));

            assertEquals(ErrorCode.GATEWAY_REJECTED, result.getErrorCode());
            assertEquals(EntryStatus.REVERSED, ledgerStore.findById(result.getEntryId()).orElseThrow().getStatus());
            assertEquals(0, balance().getAvailable().compareTo(new BigDecimal("100.00")));
            assertTrue(ledgerStore.findActiveByReference(tenantId, "PAYOUT-4", EntryType.CASH_OUT).isEmpty());
        }

        @Test
        @DisplayName("A timed-out withdrawal keeps the funds reserved")
        void timeoutKeepsReservation() {
            fund("100.00");
            when(gatewayAdapter.createWithdrawal(any())).thenThrow(new GatewayTimeoutException("read timed out", null));

            OperationResult result = ledgerService.processCashOut(cashOut("PAYOUT-5", "60.00"));

            assertTrue(result.isOutcomeUnknown());
            assertEquals(EntryStatus.PENDING, ledgerStore.findById(result.getEntryId()).orElseThrow().getStatus());
            assertEquals(0, balance().getConfirmed().compareTo(new BigDecimal("100.00")));
            assertEquals(0, balance().getAvailable().compareTo(new BigDecimal("40.00")));
        }

        @Test
        @DisplayName("A server error on the withdrawal call keeps the funds reserved until the outcome is known")
        void ambiguousAnswerKeepsReservation() {
            // Given: the gateway may have executed the payout but answered 500
            fund("100.00");
            when(gatewayAdapter.createWithdrawal(any())).thenThrow(new GatewayOutcomeUnknownException(
                    "Outcome of createWithdrawal unknown: Gateway error on createWithdrawal: 500", 500, null));

            // When
            OperationResult result = ledgerService.processCashOut(cashOut("PAYOUT-AMB", "60.00"));

            // Then: nothing is released, the attempt waits for a webhook or the resolver
            assertTrue(result.isSuccess());
            assertTrue(result.isOutcomeUnknown());
            assertEquals(OperationStatus.PENDING, result.getStatus());
            assertEquals(EntryStatus.PENDING, ledgerStore.findById(result.getEntryId()).orElseThrow().getStatus());
            assertEquals(0, balance().getAvailable().compareTo(new BigDecimal("40.00")));
            TransactionLog attempt = transactionLogService.find(result.getTransactionId()).orElseThrow();
            assertTrue(attempt.isAwaitingOutcome());
            assertEquals("UNKNOWN", attempt.getGatewayStatus());
            assertEquals(500, attempt.getHttpStatus());
        }

        @Test
        @DisplayName("A gateway that could not be reached releases the reserved funds")
        void unreachableGatewayReleasesFunds() {
            fund("100.00");
            when(gatewayAdapter.createWithdrawal(any())).thenThrow(new GatewayUnavailableException(
                    "Gateway unreachable on createWithdrawal", null, new ConnectException("connection refused")));

            OperationResult result = ledgerService.processCashOut(cashOut("PAYOUT-DOWN", "60.00"));

            assertEquals(ErrorCode.GATEWAY_ERROR, result.getErrorCode());
            assertEquals(EntryStatus.REVERSED, ledgerStore.findById(result.getEntryId()).orElseThrow().getStatus());
            assertEquals(0, balance().getAvailable().compareTo(new BigDecimal("100.00")));
        }

        @Test
        @DisplayName("Two concurrent withdrawals of the whole balance: one reserves, the other is refused")
        void concurrentWithdrawals() throws Exception {
            // Given
            fund("100.00");
            when(gatewayAdapter.createWithdrawal(any()))
                    .thenAnswer(invocation -> withdrawal("gw-out-c-" + UUID.randomUUID(),
                            GatewayTransactionStatus.PROCESSING, null));
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(2);

            // When
            List<Future<OperationResult>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < 2; i++) {
                    String referenceId = "PAYOUT-C-" + i;
                    futures.add(pool.submit(() -> {
                        start.await();
                        return ledgerService.processCashOut(cashOut(referenceId, "100.00"));
                    }));
                }
                start.countDown();
                pool.shutdown();
                assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
            } finally {
                pool.shutdownNow();
            }

            // Then
            List<OperationResult> results = new ArrayList<>();
            for (Future<OperationResult> future : futures) {
                results.add(future.get());
            }
            assertEquals(1, results.stream().filter(OperationResult::isSuccess).count());
            assertEquals(1, results.stream()
                    .filter(result -> result.getErrorCode() == ErrorCode.INSUFFICIENT_BALANCE).count());
            verify(gatewayAdapter, times(1)).createWithdrawal(any());
            assertEquals(0, balance().getAvailable().compareTo(BigDecimal.ZERO));
            assertEquals(0, balance().getConfirmed().compareTo(new BigDecimal("100.00")));
        }

        @Test
        @DisplayName("A withdrawal refused for balance does not use up a daily slot")
        @SuppressWarnings("unchecked")
        void refusedWithdrawalGivesSlotBack() {
            // Given: Redis counts attempts
            ValueOperations<String, String> counters = mock(ValueOperations.class);
            when(redisTemplate.opsForValue()).thenReturn(counters);
            when(counters.increment(anyString())).thenReturn(1L);

            // When: nothing was funded
            OperationResult result = ledgerService.processCashOut(cashOut("PAYOUT-NOFUNDS", "60.00"));

            // Then
            assertEquals(ErrorCode.INSUFFICIENT_BALANCE, result.getErrorCode());
            verify(counters).decrement(startsWith("ratelimit:withdrawal:" + tenantId + ":"));
            verify(gatewayAdapter, never()).createWithdrawal(any());
        }

        @Test
        @DisplayName("A failure webhook for a processing withdrawal reverses the debit")
        void failureWebhookReverses() {
            fund("100.00");
            String externalId = "gw-out-6-" + tenantId;
            when(gatewayAdapter.createWithdrawal(any()))
                    .thenReturn(withdrawal(externalId, GatewayTransactionStatus.PROCESSING, null));

            OperationResult result = ledgerService.processCashOut(cashOut("PAYOUT-6", "60.00"));
            assertEquals(OperationStatus.PENDING, result.getStatus());
            assertEquals(0, balance().getAvailable().compareTo(new BigDecimal("40.00")));

            WebhookResult webhook = deliver(event(externalId, null, GatewayTransactionStatus.FAILED, "60.00"));

            assertEquals(WebhookResult.APPLIED, webhook);
            assertEquals(EntryStatus.REVERSED, ledgerStore.findById(result.getEntryId()).orElseThrow().getStatus());
            assertEquals(0, balance().getAvailable().compareTo(new BigDecimal("100.00")));
        }

        @Test
        @DisplayName("Repeating a withdrawal reference returns the original without a second reservation")
        void duplicateWithdrawal() {
            fund("100.00");
            when(gatewayAdapter.createWithdrawal(any()))
                    .thenReturn(withdrawal("gw-out-7-" + tenantId, GatewayTransactionStatus.PROCESSING, null));

            OperationResult first = ledgerService.processCashOut(cashOut("PAYOUT-7", "30.00"));
            OperationResult second = ledgerService.processCashOut(cashOut("PAYOUT-7", "30.00"));

            assertTrue(second.isDuplicate());
            assertEquals(first.getEntryId(), second.getEntryId());
            verify(gatewayAdapter, times(1)).createWithdrawal(any());
            assertEquals(0, balance().getAvailable().compareTo(new BigDecimal("70.00")));
        }
    }

    // ==================== Webhook before response ====================

    @Nested
    @DisplayName("Webhook arriving while the gateway call is in flight")
    class WebhookFirst {

        @Test
        @DisplayName("A failure webhook followed by a pending response releases the withdrawal for good")
        void withdrawalFailedFirst() {
            // Given: the gateway fires the failure webhook before answering the create call
            fund("100.00");
            String externalId = "gw-race-out-1-" + tenantId;
            AtomicReference<WebhookResult> webhook = new AtomicReference<>();
            when(gatewayAdapter.createWithdrawal(any())).thenAnswer(invocation -> {
                GatewayWithdrawalRequest request = invocation.getArgument(0);
                webhook.set(deliver(event(externalId, request.getCorrelationId(),
                        GatewayTransactionStatus.FAILED, "60.00")));
                return withdrawal(externalId, GatewayTransactionStatus.PENDING, null);
            });

            // When
            OperationResult result = ledgerService.processCashOut(cashOut("PAYOUT-RACE-1", "60.00"));

            // Then: the response, the entry and the log all tell the same story
            assertEquals(WebhookResult.APPLIED, webhook.get());
            assertFalse(result.isSuccess());
            assertEquals(ErrorCode.GATEWAY_REJECTED, result.getErrorCode());
            assertEquals(EntryStatus.REVERSED, ledgerStore.findById(result.getEntryId()).orElseThrow().getStatus());
            assertEquals(0, balance().getAvailable().compareTo(new BigDecimal("100.00")));
            TransactionLog attempt = transactionLogService.find(result.getTransactionId()).orElseThrow();
            assertEquals("FAILED", attempt.getGatewayStatus());
            assertEquals(Boolean.FALSE, attempt.getSuccessful());
        }

        @Test
        @DisplayName("A completion webhook followed by a pending response reports the withdrawal completed")
        void withdrawalCompletedFirst() {
            fund("100.00");
            String externalId = "gw-race-out-2-" + tenantId;
            when(gatewayAdapter.createWithdrawal(any())).thenAnswer(invocation -> {
                GatewayWithdrawalRequest request = invocation.getArgument(0);
                deliver(event(externalId, request.getCorrelationId(), GatewayTransactionStatus.COMPLETED, "60.00"));
                return withdrawal(externalId, GatewayTransactionStatus.PENDING, null);
            });

            OperationResult result = ledgerService.processCashOut(cashOut("PAYOUT-RACE-2", "60.00"));

            assertEquals(OperationStatus.COMPLETED, result.getStatus());
            assertEquals(EntryStatus.CONFIRMED, ledgerStore.findById(result.getEntryId()).orElseThrow().getStatus());
            assertEquals(0, balance().getConfirmed().compareTo(new BigDecimal("40.00")));
            assertEquals("COMPLETED",
                    transactionLogService.find(result.getTransactionId()).orElseThrow().getGatewayStatus());
        }

        @Test
        @DisplayName("A failure webhook followed by a pending response books no cash-in")
        void paymentFailedFirst() {
            String externalId = "gw-race-in-1-" + tenantId;
            when(gatewayAdapter.createPayment(any())).thenAnswer(invocation -> {
                GatewayPaymentRequest request = invocation.getArgument(0);
                deliver(event(externalId, request.getCorrelationId(), GatewayTransactionStatus.FAILED, "100.00"));
                return payment(externalId, GatewayTransactionStatus.PENDING);
            });

            OperationResult result = ledgerService.processCashIn(cashIn("ORDER-RACE-1", "100.00"));

            assertFalse(result.isSuccess());
            assertEquals(ErrorCode.GATEWAY_REJECTED, result.getErrorCode());
            assertTrue(ledgerStore.findActiveByReference(tenantId, "ORDER-RACE-1", EntryType.CASH_IN).isEmpty());
            assertEquals(0, balance().getPendingCredits().compareTo(BigDecimal.ZERO));
            TransactionLog attempt = transactionLogService.find(result.getTransactionId()).orElseThrow();
            assertEquals("FAILED", attempt.getGatewayStatus());
            assertEquals(Boolean.FALSE, attempt.getSuccessful());
        }

        @Test
        @DisplayName("A completion webhook followed by a pending response books the cash-in exactly once")
        void paymentCompletedFirst() {
            String externalId = "gw-race-in-2-" + tenantId;
            when(gatewayAdapter.createPayment(any())).thenAnswer(invocation -> {
                GatewayPaymentRequest request = invocation.getArgument(0);
                deliver(event(externalId, request.getCorrelationId(), GatewayTransactionStatus.COMPLETED, "100.00"));
                return payment(externalId, GatewayTransactionStatus.PENDING);
            });

            OperationResult result = ledgerService.processCashIn(cashIn("ORDER-RACE-2", "100.00"));

            assertEquals(OperationStatus.COMPLETED, result.getStatus());
            LedgerEntry entry = ledgerStore.findActiveByReference(tenantId, "ORDER-RACE-2", EntryType.CASH_IN)
                    .orElseThrow();
            assertEquals(entry.getId(), result.getEntryId());
            assertEquals(EntryStatus.CONFIRMED, entry.getStatus());
            assertEquals(0, balance().getConfirmed().compareTo(new BigDecimal("100.00")));
            assertEquals(0, balance().getPendingCredits().compareTo(BigDecimal.ZERO));
        }
    }

    // ==================== Webhooks ====================

    @Nested
    @DisplayName("Webhooks")
    class Webhooks {

        @Test
        @DisplayName("A bad signature is refused before the payload is parsed")
        void invalidSignature() {
            String payload = "{\"transactionId\":\"forged-" + tenantId + "\",\"status\":\"paid\"}";
            when(gatewayAdapter.verifyWebhookSignature(eq(payload), any())).thenReturn(false);

            assertThrows(InvalidWebhookSignatureException.class,
                    () -> ledgerService.handleWebhook(payload, "sha256=forged"));

            verify(gatewayAdapter, never()).parseWebhook(any());
            assertEquals(0, balance().getConfirmed().compareTo(BigDecimal.ZERO));
        }

        @Test
        @DisplayName("A signed webhook matching nothing is kept as an orphan")
        void orphanWebhook() {
            WebhookResult result = deliver(event("gw-unknown-" + UUID.randomUUID(), "CI-unknown-" + UUID.randomUUID(),
                    GatewayTransactionStatus.COMPLETED, "10.00"));

            assertEquals(WebhookResult.ORPHANED, result);
        }

        @Test
        @DisplayName("A failure reported after confirmation is raised to operators, not applied")
        void contradictoryOutcome() {
            String externalId = "gw-in-9-" + tenantId;
            when(gatewayAdapter.createPayment(any())).thenReturn(payment(externalId, GatewayTransactionStatus.COMPLETED));
            ledgerService.processCashIn(cashIn("ORDER-9", "100.00"));

            WebhookResult result = deliver(event(externalId, null, GatewayTransactionStatus.FAILED, "100.00"));

            assertEquals(WebhookResult.IGNORED, result);
            assertEquals(0, balance().getConfirmed().compareTo(new BigDecimal("100.00")));
            assertEquals(1, outboxService.getEventsForTenant(tenantId, ContradictoryOutcomeEvent.EVENT_TYPE).size());
        }

        @Test
        @DisplayName("Unparseable payloads surface as invalid arguments")
        void malformedPayload() {
            String payload = "not-json-" + tenantId;
            when(gatewayAdapter.verifyWebhookSignature(eq(payload), any())).thenReturn(true);
            when(gatewayAdapter.parseWebhook(payload)).thenThrow(new IllegalArgumentException("not JSON"));

            assertThrows(IllegalArgumentException.class, () -> ledgerService.handleWebhook(payload, "sha256=x"));
            assertTrue(outboxService.getEventsForTenant(tenantId, InvalidWebhookSignatureEvent.EVENT_TYPE).isEmpty());
        }
    }
}
