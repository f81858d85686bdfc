package com.flagship.tenant_ledger.operation;

import com.flagship.tenant_ledger.gateway.GatewayWithdrawalRequest;
import com.flagship.tenant_ledger.ledger.LedgerEntry;
import com.flagship.tenant_ledger.transactionlog.TransactionLog;
import lombok.Value;

/**
 * Reserved debit plus the log row written before the withdrawal call.
 */
@Value
class CashOutStart {
    LedgerEntry entry;
    TransactionLog log;
    GatewayWithdrawalRequest gatewayRequest;
}
