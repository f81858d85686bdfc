package com.flagship.tenant_ledger.operation;

import com.flagship.tenant_ledger.gateway.GatewayPaymentRequest;
import com.flagship.tenant_ledger.ledger.LedgerEntry;
import com.flagship.tenant_ledger.transactionlog.TransactionLog;
import lombok.Value;

/**
 * Decision taken under the tenant lock before a cash-in reaches the gateway.
 */
@Value
class CashInStart {

    enum Kind {
        /** Fresh attempt: the log row is written, the gateway must be called. */
        NEW,
        /** An active entry already exists for the reference. */
        DUPLICATE,
        /** A previous attempt got a gateway id but never wrote its entry. */
        REPLAY,
        /** A previous attempt is still waiting for its outcome. */
        IN_FLIGHT
    }

    Kind kind;
    TransactionLog log;
    LedgerEntry existingEntry;
    GatewayPaymentRequest gatewayRequest;

    static CashInStart fresh(TransactionLog log, GatewayPaymentRequest gatewayRequest) {
        return new CashInStart(Kind.NEW, log, null, gatewayRequest);
    }

    static CashInStart duplicate(LedgerEntry entry, TransactionLog log) {
        return new CashInStart(Kind.DUPLICATE, log, entry, null);
    }

    static CashInStart replay(TransactionLog log) {
        return new CashInStart(Kind.REPLAY, log, null, null);
    }

    static CashInStart inFlight(TransactionLog log) {
        return new CashInStart(Kind.IN_FLIGHT, log, null, null);
    }
}
