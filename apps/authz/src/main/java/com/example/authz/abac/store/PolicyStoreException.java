package com.example.authz.abac.store;

/**
 * Raised when ABAC policies cannot be loaded from the backing store.
 */
public class PolicyStoreException extends RuntimeException {

    public PolicyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
