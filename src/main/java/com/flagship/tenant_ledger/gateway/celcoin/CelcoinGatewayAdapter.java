package com.flagship.tenant_ledger.gateway.celcoin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tenant_ledger.exception.GatewayAuthenticationException;
import com.flagship.tenant_ledger.exception.GatewayException;
import com.flagship.tenant_ledger.exception.GatewayOutcomeUnknownException;
import com.flagship.tenant_ledger.exception.GatewayRejectedException;
import com.flagship.tenant_ledger.exception.GatewayTimeoutException;
import com.flagship.tenant_ledger.exception.GatewayUnavailableException;
import com.flagship.tenant_ledger.gateway.BankAccountDetails;
import com.flagship.tenant_ledger.gateway.GatewayAdapter;
import com.flagship.tenant_ledger.gateway.GatewayPaymentRequest;
import com.flagship.tenant_ledger.gateway.GatewayPaymentResponse;
import com.flagship.tenant_ledger.gateway.GatewayProperties;
import com.flagship.tenant_ledger.gateway.GatewayStatementItem;
import com.flagship.tenant_ledger.gateway.GatewayToken;
import com.flagship.tenant_ledger.gateway.GatewayTokenCache;
import com.flagship.tenant_ledger.gateway.GatewayTransactionStatus;
import com.flagship.tenant_ledger.gateway.GatewayWebhookEvent;
import com.flagship.tenant_ledger.gateway.GatewayWithdrawalRequest;
import com.flagship.tenant_ledger.gateway.GatewayWithdrawalResponse;
import com.flagship.tenant_ledger.gateway.PayerDetails;
import com.flagship.tenant_ledger.gateway.PaymentMethod;
import com.flagship.tenant_ledger.gateway.WebhookSignatureVerifier;
import com.flagship.tenant_ledger.observability.CorrelationContext;
import com.flagship.tenant_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link GatewayAdapter} for the Celcoin banking-as-a-service API.
 *
 * Authentication is OAuth2 client credentials. The bearer token is cached and
 * reused until it enters the safety margin; a 401 from any call invalidates it,
 * re-authenticates once and replays the call exactly once.
 *
 * Calls that move money ({@link #createPayment}, {@link #createWithdrawal})
 * report any answer that does not prove a refusal as an unknown outcome:
 * a server error, an empty body or a body that cannot be read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CelcoinGatewayAdapter implements GatewayAdapter {

    private static final long DEFAULT_TOKEN_TTL_SECONDS = 3600;

    private final RestTemplate restTemplate;
    private final GatewayProperties properties;
    private final GatewayTokenCache tokenCache;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;

    @Override
    public void authenticate() {
        tokenCache.store(requestToken());
    }

    @Override
    public GatewayPaymentResponse createPayment(GatewayPaymentRequest request) {
        return request.getMethod() == PaymentMethod.BOLETO
                ? createBoletoPayment(request)
                : createPixPayment(request);
    }

    private GatewayPaymentResponse createPixPayment(GatewayPaymentRequest request) {
        CelcoinApi.PixPaymentRequest body = CelcoinApi.PixPaymentRequest.builder()
                .correlationId(request.getCorrelationId())
                .accountId(request.getAccountId())
                .amount(request.getAmount())
                .description(request.getDescription())
                .expiration(request.getExpiresInSeconds())
                .payer(toPayer(request.getPayer()))
                .build();

        ResponseEntity<CelcoinApi.PixPaymentResponse> response =
                exchangeMovingMoney("createPixPayment", uri("/pix/payment"), body,
                        CelcoinApi.PixPaymentResponse.class);
        CelcoinApi.PixPaymentResponse pix = requireMoneyBody(response, "createPixPayment");

        log.info("PIX payment created: correlationId={}, transactionId={}, status={}",
                request.getCorrelationId(), pix.getTransactionId(), pix.getStatus());

        return GatewayPaymentResponse.builder()
                .externalId(pix.getTransactionId())
                .status(CelcoinStatusMapper.map(pix.getStatus()))
                .qrCodeOrBarcode(pix.getPixCopiaECola() != null ? pix.getPixCopiaECola() : pix.getEmvqrcps())
                .expiresAt(parseInstant(pix.getExpirationDate()))
                .httpStatus(response.getStatusCode().value())
                .rawResponse(toJson(pix))
                .build();
    }

    private GatewayPaymentResponse createBoletoPayment(GatewayPaymentRequest request) {
        CelcoinApi.BoletoPaymentRequest body = CelcoinApi.BoletoPaymentRequest.builder()
                .correlationId(request.getCorrelationId())
                .accountId(request.getAccountId())
                .amount(request.getAmount())
                .dueDate(request.getDueDate() != null ? request.getDueDate().toString() : null)
                .description(request.getDescription())
                .payer(toPayer(request.getPayer()))
                .build();

        ResponseEntity<CelcoinApi.BoletoPaymentResponse> response =
                exchangeMovingMoney("createBoletoPayment", uri("/boleto/payment"), body,
                        CelcoinApi.BoletoPaymentResponse.class);
        CelcoinApi.BoletoPaymentResponse boleto = requireMoneyBody(response, "createBoletoPayment");

        log.info("Boleto created: correlationId={}, transactionId={}, status={}",
                request.getCorrelationId(), boleto.getTransactionId(), boleto.getStatus());

        return GatewayPaymentResponse.builder()
                .externalId(boleto.getTransactionId())
                .status(CelcoinStatusMapper.map(boleto.getStatus()))
                .qrCodeOrBarcode(boleto.getDigitableLine() != null ? boleto.getDigitableLine() : boleto.getBarCode())
                .paymentUrl(boleto.getPdf())
                .expiresAt(parseInstant(boleto.getDueDate()))
                .httpStatus(response.getStatusCode().value())
                .rawResponse(toJson(boleto))
                .build();
    }

    @Override
    public GatewayWithdrawalResponse createWithdrawal(GatewayWithdrawalRequest request) {
        BankAccountDetails destination = request.getDestination();
        CelcoinApi.WithdrawalRequest body = CelcoinApi.WithdrawalRequest.builder()
                .clientRequestId(request.getCorrelationId())
                .accountId(request.getAccountId())
                .amount(request.getAmount())
                .description(request.getDescription())
                .creditParty(destination == null ? null : CelcoinApi.CreditParty.builder()
                        .bank(destination.getBankCode())
                        .branch(destination.getBranch())
                        .account(destination.getAccountNumber())
                        .accountType(destination.getAccountType())
                        .name(destination.getHolderName())
                        .taxId(destination.getHolderDocument())
                        .build())
                .build();

        ResponseEntity<CelcoinApi.WithdrawalResponse> response =
                exchangeMovingMoney("createWithdrawal", uri("/account/withdrawal"), body,
                        CelcoinApi.WithdrawalResponse.class);
        CelcoinApi.WithdrawalResponse withdrawal = requireMoneyBody(response, "createWithdrawal");

        log.info("Withdrawal created: correlationId={}, transactionId={}, status={}, fee={}",
                request.getCorrelationId(), withdrawal.getTransactionId(), withdrawal.getStatus(), withdrawal.getFee());

        return GatewayWithdrawalResponse.builder()
                .externalId(withdrawal.getTransactionId())
                .status(CelcoinStatusMapper.map(withdrawal.getStatus()))
                .fee(withdrawal.getFee() != null ? withdrawal.getFee() : BigDecimal.ZERO)
                .httpStatus(response.getStatusCode().value())
                .rawResponse(toJson(withdrawal))
                .build();
    }

    @Override
    public GatewayTransactionStatus getStatus(String externalId) {
        URI target = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/transactions/{id}")
                .buildAndExpand(externalId)
                .toUri();
        ResponseEntity<CelcoinApi.TransactionStatusResponse> response =
                exchange("getStatus", HttpMethod.GET, target, null, CelcoinApi.TransactionStatusResponse.class);
        return CelcoinStatusMapper.map(requireBody(response, "getStatus").getStatus());
    }

    @Override
    public BigDecimal getBalance(String accountId) {
        URI target = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/accounts/{accountId}/balance")
                .buildAndExpand(accountId)
                .toUri();
        ResponseEntity<CelcoinApi.BalanceResponse> response =
                exchange("getBalance", HttpMethod.GET, target, null, CelcoinApi.BalanceResponse.class);
        BigDecimal available = requireBody(response, "getBalance").getAvailable();
        return available != null ? available : BigDecimal.ZERO;
    }

    @Override
    public List<GatewayStatementItem> getStatement(String accountId, Instant from, Instant to) {
        URI target = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/accounts/{accountId}/statement")
                .queryParam("startDate", LocalDate.ofInstant(from, ZoneOffset.UTC))
                .queryParam("endDate", LocalDate.ofInstant(to, ZoneOffset.UTC))
                .buildAndExpand(accountId)
                .toUri();
        ResponseEntity<CelcoinApi.StatementResponse> response =
                exchange("getStatement", HttpMethod.GET, target, null, CelcoinApi.StatementResponse.class);
        List<CelcoinApi.StatementTransaction> transactions = requireBody(response, "getStatement").getTransactions();
        if (transactions == null) {
            return List.of();
        }
        return transactions.stream()
                .map(this::toStatementItem)
                .filter(item -> item.getCreatedAt() == null
                        || (!item.getCreatedAt().isBefore(from) && item.getCreatedAt().isBefore(to)))
                .toList();
    }

    @Override
    public boolean verifyWebhookSignature(String payload, String signature) {
        return signatureVerifier.verify(payload, signature);
    }

    @Override
    public GatewayWebhookEvent parseWebhook(String payload) {
        CelcoinApi.WebhookBody body;
        try {
            body = objectMapper.readValue(payload, CelcoinApi.WebhookBody.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook payload is not valid JSON", e);
        }
        if (body == null || (body.getTransactionId() == null && body.getCorrelationId() == null)) {
            throw new IllegalArgumentException("Webhook payload carries neither transactionId nor correlationId");
        }
        return GatewayWebhookEvent.builder()
                .gatewayTransactionId(body.getTransactionId())
                .correlationId(body.getCorrelationId())
                .status(CelcoinStatusMapper.map(body.getStatus()))
                .amount(body.getAmount())
                .fee(body.getFee())
                .occurredAt(parseInstant(body.getTimestamp()))
                .build();
    }

    // ==================== Transport ====================

    /**
     * POST for a call that moves money. Only a 4xx or a connection that was
     * never opened proves the gateway did nothing; everything else that is not
     * a readable answer leaves the outcome unknown.
     */
    private <T> ResponseEntity<T> exchangeMovingMoney(String operation, URI target, Object body,
                                                      Class<T> responseType) {
        try {
            return exchange(operation, HttpMethod.POST, target, body, responseType);
        } catch (GatewayUnavailableException e) {
            if (e.getHttpStatus() == null && e.getCause() instanceof ResourceAccessException) {
                throw e;
            }
            throw new GatewayOutcomeUnknownException(
                    "Outcome of " + operation + " unknown: " + e.getMessage(), e.getHttpStatus(), e);
        }
    }

    private <T> ResponseEntity<T> exchange(String operation, HttpMethod method, URI target,
                                           Object body, Class<T> responseType) {
        try {
            return send(method, target, body, responseType);
        } catch (HttpClientErrorException.Unauthorized first) {
            log.warn("Gateway rejected bearer token on {}, re-authenticating once", operation);
            tokenCache.invalidate();
            try {
                return send(method, target, body, responseType);
            } catch (HttpClientErrorException.Unauthorized second) {
                throw new GatewayAuthenticationException(
                        "Gateway rejected a freshly issued token on " + operation, HttpStatus.UNAUTHORIZED.value(), second);
            } catch (RestClientException e) {
                throw translate(operation, e);
            }
        } catch (RestClientException e) {
            throw translate(operation, e);
        }
    }

    private <T> ResponseEntity<T> send(HttpMethod method, URI target, Object body, Class<T> responseType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(tokenCache.getOrRefresh(this::requestToken));
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(CorrelationContext.CORRELATION_ID_HEADER, CorrelationContext.getCorrelationId());
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        return restTemplate.exchange(target, method, new HttpEntity<>(body, headers), responseType);
    }

    private GatewayToken requestToken() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", properties.getClientId());
        form.add("client_secret", properties.getClientSecret());
        form.add("grant_type", "client_credentials");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        CelcoinApi.TokenResponse token;
        try {
            token = restTemplate.exchange(uri("/token"), HttpMethod.POST, new HttpEntity<>(form, headers),
                    CelcoinApi.TokenResponse.class).getBody();
        } catch (HttpClientErrorException e) {
            throw new GatewayAuthenticationException(
                    "Gateway refused client credentials: " + e.getStatusCode(), e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw translate("authenticate", e);
        }

        if (token == null || token.getAccessToken() == null) {
            throw new GatewayAuthenticationException("Gateway token response carried no access_token", null, null);
        }

        long ttl = token.getExpiresIn() != null ? token.getExpiresIn() : DEFAULT_TOKEN_TTL_SECONDS;
        metrics.recordTokenRefresh();
        log.info("Gateway token acquired, expiresIn={}s", ttl);
        return new GatewayToken(token.getAccessToken(), tokenCache.now().plusSeconds(ttl));
    }

    /**
     * Maps transport failures onto the ledger's gateway exceptions.
     * A request that may have reached the gateway surfaces as a timeout, because its outcome is unknown.
     */
    private GatewayException translate(String operation, RestClientException e) {
        if (e instanceof HttpClientErrorException clientError) {
            int status = clientError.getStatusCode().value();
            if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
                return new GatewayAuthenticationException(
                        "Gateway refused " + operation + ": " + status, status, clientError);
            }
            return new GatewayRejectedException(
                    "Gateway rejected " + operation + ": " + status, status, clientError.getResponseBodyAsString());
        }
        if (e instanceof HttpServerErrorException serverError) {
            int status = serverError.getStatusCode().value();
            if (status == HttpStatus.GATEWAY_TIMEOUT.value()) {
                return new GatewayTimeoutException("Gateway timed out upstream on " + operation, serverError);
            }
            return new GatewayUnavailableException(
                    "Gateway error on " + operation + ": " + status, status, serverError);
        }
        if (e instanceof HttpStatusCodeException statusError) {
            return new GatewayUnavailableException(
                    "Unexpected gateway status on " + operation + ": " + statusError.getStatusCode(),
                    statusError.getStatusCode().value(), statusError);
        }
        if (e instanceof ResourceAccessException) {
            Throwable cause = e.getMostSpecificCause();
            if (cause instanceof ConnectException || cause instanceof UnknownHostException) {
                return new GatewayUnavailableException("Gateway unreachable on " + operation, null, e);
            }
            return new GatewayTimeoutException("No response from gateway on " + operation, e);
        }
        return new GatewayUnavailableException("Gateway call failed on " + operation + ": " + e.getMessage(), null, e);
    }

    // ==================== Mapping helpers ====================

    private URI uri(String path) {
        return UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl()).path(path).build().toUri();
    }

    private static <T> T requireMoneyBody(ResponseEntity<T> response, String operation) {
        T body = response.getBody();
        if (body == null) {
            throw new GatewayOutcomeUnknownException(
                    "Gateway returned an empty body on " + operation, response.getStatusCode().value(), null);
        }
        return body;
    }

    private static <T> T requireBody(ResponseEntity<T> response, String operation) {
        T body = response.getBody();
        if (body == null) {
            throw new GatewayUnavailableException(
                    "Gateway returned an empty body on " + operation, response.getStatusCode().value(), null);
        }
        return body;
    }

    private GatewayStatementItem toStatementItem(CelcoinApi.StatementTransaction transaction) {
        BigDecimal amount = Objects.requireNonNullElse(transaction.getAmount(), BigDecimal.ZERO).abs();
        boolean debit = transaction.getType() != null
                && transaction.getType().trim().toUpperCase(Locale.ROOT).startsWith("DEBIT");
        return GatewayStatementItem.builder()
                .externalId(transaction.getId())
                .correlationId(transaction.getCorrelationId())
                .amount(debit ? amount.negate() : amount)
                .status(CelcoinStatusMapper.map(transaction.getStatus()))
                .createdAt(parseInstant(transaction.getCreatedAt()))
                .build();
    }

    private static CelcoinApi.Payer toPayer(PayerDetails payer) {
        if (payer == null) {
            return null;
        }
        return CelcoinApi.Payer.builder()
                .name(payer.getName())
                .document(payer.getDocument())
                .email(payer.getEmail())
                .build();
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException notOffset) {
            try {
                return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException notDate) {
                log.debug("Unparseable gateway timestamp: {}", value);
                return null;
            }
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize gateway response", e);
        }
    }
}
