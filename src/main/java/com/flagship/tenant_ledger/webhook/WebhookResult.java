package com.flagship.tenant_ledger.webhook;

/**
 * What the ledger did with one webhook delivery.
 */
public enum WebhookResult {
    /** Matched a known transaction and moved (or re-confirmed) its ledger state. */
    APPLIED,
    /** Correctly signed, but no transaction matches it. */
    ORPHANED,
    /** Matched, but carried nothing to act on, or contradicted a settled entry. */
    IGNORED,
    /** Failed signature verification; nothing was touched. */
    REJECTED
}
