package com.flagship.tenant_ledger.gateway.celcoin;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Wire shapes of the Celcoin REST API. Nothing outside this package sees them.
 */
final class CelcoinApi {

    private CelcoinApi() {
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TokenResponse {
        @JsonProperty("access_token")
        private String accessToken;
        @JsonProperty("expires_in")
        private Long expiresIn;
        @JsonProperty("token_type")
        private String tokenType;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class Payer {
        private String name;
        private String document;
        private String email;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class PixPaymentRequest {
        @JsonProperty("correlationID")
        private String correlationId;
        private String accountId;
        private BigDecimal amount;
        private String description;
        private Integer expiration;
        private Payer payer;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PixPaymentResponse {
        private String transactionId;
        private String status;
        private String emvqrcps;
        private String pixCopiaECola;
        private String expirationDate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class BoletoPaymentRequest {
        @JsonProperty("correlationID")
        private String correlationId;
        private String accountId;
        private BigDecimal amount;
        private String dueDate;
        private String description;
        private Payer payer;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BoletoPaymentResponse {
        private String transactionId;
        private String status;
        private String digitableLine;
        private String barCode;
        private String pdf;
        private String dueDate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class CreditParty {
        private String bank;
        private String branch;
        private String account;
        private String accountType;
        private String name;
        private String taxId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class WithdrawalRequest {
        private String clientRequestId;
        private String accountId;
        private BigDecimal amount;
        private String description;
        private CreditParty creditParty;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WithdrawalResponse {
        @JsonAlias("id")
        private String transactionId;
        private String status;
        private BigDecimal fee;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TransactionStatusResponse {
        private String transactionId;
        private String status;
        private BigDecimal amount;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BalanceResponse {
        private BigDecimal available;
        private BigDecimal blocked;
        private BigDecimal total;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class StatementResponse {
        private List<StatementTransaction> transactions;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class StatementTransaction {
        private String id;
        @JsonAlias("correlationID")
        private String correlationId;
        private BigDecimal amount;
        private String type;        // CREDIT or DEBIT
        private String status;
        private String createdAt;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebhookBody {
        private String transactionId;
        @JsonAlias({"correlationID", "clientRequestId"})
        private String correlationId;
        private String status;
        private BigDecimal amount;
        private BigDecimal fee;
        private String timestamp;
    }
}
