package com.flagship.tenant_ledger.gateway;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PayerDetails {
    String name;
    String document;
    String email;
}
