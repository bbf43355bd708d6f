package com.flagship.finance_tracker.common;

/**
 * A referenced card, invoice, payment or ledger entry does not exist.
 */
public class ResourceNotFoundException extends IllegalArgumentException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }
}
