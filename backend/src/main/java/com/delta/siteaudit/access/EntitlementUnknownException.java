package com.delta.siteaudit.access;

/**
 * Entitlement state could not be determined. Reads fall back to the anonymous view.
 */
public class EntitlementUnknownException extends RuntimeException {
    public EntitlementUnknownException(String message, Throwable cause) {
        super(message, cause);
    }
}
