package com.flagship.tenant_ledger.gateway;

import lombok.Builder;
import lombok.Value;

/**
 * Destination of a withdrawal.
 */
@Value
@Builder
public class BankAccountDetails {
    String bankCode;
    String branch;
    String accountNumber;
    String accountType;
    String holderName;
    String holderDocument;
}
