package com.flagship.tenant_ledger.gateway.celcoin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tenant_ledger.exception.GatewayAuthenticationException;
import com.flagship.tenant_ledger.exception.GatewayOutcomeUnknownException;
import com.flagship.tenant_ledger.exception.GatewayRejectedException;
import com.flagship.tenant_ledger.exception.GatewayTimeoutException;
import com.flagship.tenant_ledger.exception.GatewayUnavailableException;
import com.flagship.tenant_ledger.gateway.GatewayPaymentRequest;
import com.flagship.tenant_ledger.gateway.GatewayProperties;
import com.flagship.tenant_ledger.gateway.GatewayTokenCache;
import com.flagship.tenant_ledger.gateway.GatewayTransactionStatus;
import com.flagship.tenant_ledger.gateway.GatewayWebhookEvent;
import com.flagship.tenant_ledger.gateway.GatewayWithdrawalRequest;
import com.flagship.tenant_ledger.gateway.GatewayWithdrawalResponse;
import com.flagship.tenant_ledger.gateway.GatewayStatementItem;
import com.flagship.tenant_ledger.gateway.PaymentMethod;
import com.flagship.tenant_ledger.gateway.WebhookSignatureVerifier;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

class CelcoinGatewayAdapterTest {

    private static final String BASE_URL = "http://gateway.test";

    private MockRestServiceServer server;
    private CelcoinGatewayAdapter adapter;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        GatewayProperties properties = new GatewayProperties();
        properties.setBaseUrl(BASE_URL);
        properties.setClientId("client");
        properties.setClientSecret("secret");
        properties.setWebhookSecret("webhook-secret");

        adapter = new CelcoinGatewayAdapter(restTemplate, properties, new GatewayTokenCache(properties),
                new WebhookSignatureVerifier(properties), new ObjectMapper(), mock(LedgerMetrics.class));
    }

    private void expectToken(String accessToken) {
        server.expect(requestTo(BASE_URL + "/token"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                .andRespond(withSuccess(
                        "{\"access_token\":\"" + accessToken + "\",\"expires_in\":3600,\"token_type\":\"Bearer\"}",
                        MediaType.APPLICATION_JSON));
    }

    private static String json(String body) {
        return body.replace('\'', '"');
    }

    @Nested
    @DisplayName("Authentication")
    class Authentication {

        @Test
        @DisplayName("The bearer token is fetched once and reused while valid")
        void tokenReused() {
            // Given: one token issued, two status queries
            expectToken("tok-1");
            server.expect(requestTo(BASE_URL + "/transactions/tx-1"))
                    .andExpect(header("Authorization", "Bearer tok-1"))
                    .andRespond(withSuccess(json("{'transactionId':'tx-1','status':'CONFIRMED'}"),
                            MediaType.APPLICATION_JSON));
            server.expect(requestTo(BASE_URL + "/transactions/tx-2"))
                    .andExpect(header("Authorization", "Bearer tok-1"))
                    .andRespond(withSuccess(json("{'transactionId':'tx-2','status':'processing'}"),
                            MediaType.APPLICATION_JSON));

            // When / Then
            assertEquals(GatewayTransactionStatus.COMPLETED, adapter.getStatus("tx-1"));
            assertEquals(GatewayTransactionStatus.PROCESSING, adapter.getStatus("tx-2"));
            server.verify();
        }

        @Test
        @DisplayName("A 401 invalidates the token, re-authenticates once and replays the call")
        void unauthorizedReplaysOnce() {
            expectToken("tok-stale");
            server.expect(requestTo(BASE_URL + "/transactions/tx-1"))
                    .andExpect(header("Authorization", "Bearer tok-stale"))
                    .andRespond(withUnauthorizedRequest());
            expectToken("tok-fresh");
            server.expect(requestTo(BASE_URL + "/transactions/tx-1"))
                    .andExpect(header("Authorization", "Bearer tok-fresh"))
                    .andRespond(withSuccess(json("{'transactionId':'tx-1','status':'expired'}"),
                            MediaType.APPLICATION_JSON));

            assertEquals(GatewayTransactionStatus.EXPIRED, adapter.getStatus("tx-1"));
            server.verify();
        }

        @Test
        @DisplayName("A second 401 with a fresh token is an authentication failure")
        void secondUnauthorizedFails() {
            expectToken("tok-1");
            server.expect(requestTo(BASE_URL + "/transactions/tx-1")).andRespond(withUnauthorizedRequest());
            expectToken("tok-2");
            server.expect(requestTo(BASE_URL + "/transactions/tx-1")).andRespond(withUnauthorizedRequest());

            assertThrows(GatewayAuthenticationException.class, () -> adapter.getStatus("tx-1"));
        }
    }

    @Nested
    @DisplayName("Error translation")
    class Errors {

        private GatewayWithdrawalRequest withdrawal() {
            return GatewayWithdrawalRequest.builder()
                    .accountId("acct-1")
                    .correlationId("CO-1")
                    .amount(new BigDecimal("60.00"))
                    .description("withdrawal")
                    .build();
        }

        @Test
        @DisplayName("A 4xx is a rejection carrying the response body")
        void badRequestIsRejection() {
            expectToken("tok");
            server.expect(requestTo(BASE_URL + "/account/withdrawal"))
                    .andRespond(withBadRequest()
                            .contentType(MediaType.APPLICATION_JSON)
                            .body(json("{'error':'invalid destination account'}")));

            GatewayRejectedException e = assertThrows(GatewayRejectedException.class,
                    () -> adapter.createWithdrawal(withdrawal()));

            assertEquals(400, e.getHttpStatus());
            assertTrue(e.getResponseBody().contains("invalid destination account"));
        }

        @Test
        @DisplayName("A 504 means the outcome is unknown")
        void gatewayTimeoutIsTimeout() {
            expectToken("tok");
            server.expect(requestTo(BASE_URL + "/account/withdrawal"))
                    .andRespond(withStatus(HttpStatus.GATEWAY_TIMEOUT));

            assertThrows(GatewayTimeoutException.class, () -> adapter.createWithdrawal(withdrawal()));
        }

        @Test
        @DisplayName("A socket timeout means the outcome is unknown")
        void readTimeoutIsTimeout() {
            expectToken("tok");
            server.expect(requestTo(BASE_URL + "/account/withdrawal"))
                    .andRespond(request -> {
                        throw new SocketTimeoutException("Read timed out");
                    });

            assertThrows(GatewayTimeoutException.class, () -> adapter.createWithdrawal(withdrawal()));
        }

        @Test
        @DisplayName("A 503 on a status query is unavailability")
        void serviceUnavailable() {
            expectToken("tok");
            server.expect(requestTo(BASE_URL + "/transactions/tx-1"))
                    .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

            GatewayUnavailableException e = assertThrows(GatewayUnavailableException.class,
                    () -> adapter.getStatus("tx-1"));
            assertEquals(503, e.getHttpStatus());
        }

        @Test
        @DisplayName("A 5xx on a withdrawal leaves the outcome unknown")
        void serverErrorOnWithdrawalIsUnknown() {
            expectToken("tok");
            server.expect(requestTo(BASE_URL + "/account/withdrawal"))
                    .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

            GatewayOutcomeUnknownException e = assertThrows(GatewayOutcomeUnknownException.class,
                    () -> adapter.createWithdrawal(withdrawal()));
            assertEquals(500, e.getHttpStatus());
            assertFalse(e instanceof GatewayTimeoutException);
        }

        @Test
        @DisplayName("A 2xx without a body on a withdrawal leaves the outcome unknown")
        void emptyBodyOnWithdrawalIsUnknown() {
            expectToken("tok");
            server.expect(requestTo(BASE_URL + "/account/withdrawal"))
                    .andRespond(withSuccess());

            GatewayOutcomeUnknownException e = assertThrows(GatewayOutcomeUnknownException.class,
                    () -> adapter.createWithdrawal(withdrawal()));
            assertEquals(200, e.getHttpStatus());
        }

        @Test
        @DisplayName("A 2xx with an unreadable body on a payment leaves the outcome unknown")
        void unreadableBodyOnPaymentIsUnknown() {
            expectToken("tok");
            server.expect(requestTo(BASE_URL + "/pix/payment"))
                    .andRespond(withSuccess("<html>upstream proxy</html>", MediaType.APPLICATION_JSON));

            assertThrows(GatewayOutcomeUnknownException.class, () -> adapter.createPayment(
                    GatewayPaymentRequest.builder()
                            .accountId("acct-1")
                            .correlationId("CI-1")
                            .amount(new BigDecimal("100.00"))
                            .method(PaymentMethod.PIX)
                            .build()));
        }

        @Test
        @DisplayName("A refused connection on a withdrawal is unavailability: nothing was sent")
        void connectionRefusedIsUnavailable() {
            expectToken("tok");
            server.expect(requestTo(BASE_URL + "/account/withdrawal"))
                    .andRespond(request -> {
                        throw new ConnectException("Connection refused");
                    });

            GatewayUnavailableException e = assertThrows(GatewayUnavailableException.class,
                    () -> adapter.createWithdrawal(withdrawal()));
            assertNull(e.getHttpStatus());
        }
    }

    @Test
    @DisplayName("Withdrawal response maps id, status and fee")
    void withdrawalMapped() {
        expectToken("tok");
        server.expect(requestTo(BASE_URL + "/account/withdrawal"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess(json("{'id':'wd-9','status':'PROCESSING','fee':'1.50'}"),
                        MediaType.APPLICATION_JSON));

        GatewayWithdrawalResponse response = adapter.createWithdrawal(GatewayWithdrawalRequest.builder()
                .accountId("acct-1").correlationId("CO-9").amount(new BigDecimal("10.00")).build());

        assertEquals("wd-9", response.getExternalId());
        assertEquals(GatewayTransactionStatus.PROCESSING, response.getStatus());
        assertEquals(0, response.getFee().compareTo(new BigDecimal("1.50")));
    }

    @Test
    @DisplayName("Balance and statement are read from the account endpoints")
    void balanceAndStatement() {
        expectToken("tok");
        server.expect(requestTo(BASE_URL + "/accounts/acct-1/balance"))
                .andRespond(withSuccess(json("{'available':'150.25','blocked':'0','total':'150.25'}"),
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(org.hamcrest.Matchers.startsWith(BASE_URL + "/accounts/acct-1/statement")))
                .andRespond(withSuccess(json("{'transactions':["
                                + "{'id':'tx-1','amount':'100.00','type':'CREDIT','status':'CONFIRMED','createdAt':'2024-03-01T10:00:00Z'},"
                                + "{'id':'tx-2','amount':'40.00','type':'DEBIT','status':'CONFIRMED','createdAt':'2024-03-01T11:00:00Z'},"
                                + "{'id':'tx-3','amount':'5.00','type':'CREDIT','status':'CONFIRMED','createdAt':'2024-03-05T11:00:00Z'}"
                                + "]}"),
                        MediaType.APPLICATION_JSON));

        assertEquals(0, adapter.getBalance("acct-1").compareTo(new BigDecimal("150.25")));

        List<GatewayStatementItem> items = adapter.getStatement("acct-1",
                Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-02T00:00:00Z"));

        assertEquals(2, items.size());
        assertEquals(0, items.get(0).getAmount().compareTo(new BigDecimal("100.00")));
        assertEquals(0, items.get(1).getAmount().compareTo(new BigDecimal("-40.00")));
    }

    @Nested
    @DisplayName("Webhooks")
    class Webhooks {

        @Test
        @DisplayName("A notification is parsed into the provider-neutral event")
        void parsesNotification() {
            GatewayWebhookEvent event = adapter.parseWebhook(json(
                    "{'transactionId':'tx-1','correlationID':'CI-1','status':'paid','amount':'100.00','fee':'0.50',"
                            + "'timestamp':'2024-03-01T10:00:00Z'}"));

            assertEquals("tx-1", event.getGatewayTransactionId());
            assertEquals("CI-1", event.getCorrelationId());
            assertEquals(GatewayTransactionStatus.COMPLETED, event.getStatus());
            assertEquals(0, event.getFee().compareTo(new BigDecimal("0.50")));
            assertEquals(Instant.parse("2024-03-01T10:00:00Z"), event.getOccurredAt());
        }

        @Test
        @DisplayName("Unknown status strings map to UNKNOWN, never to success")
        void unknownStatus() {
            GatewayWebhookEvent event = adapter.parseWebhook(json("{'transactionId':'tx-1','status':'on_hold'}"));

            assertEquals(GatewayTransactionStatus.UNKNOWN, event.getStatus());
        }

        @Test
        @DisplayName("Garbage and payloads without identifiers are refused")
        void malformedRefused() {
            assertThrows(IllegalArgumentException.class, () -> adapter.parseWebhook("not json"));
            assertThrows(IllegalArgumentException.class, () -> adapter.parseWebhook(json("{'status':'paid'}")));
        }
    }
}
