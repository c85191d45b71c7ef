package com.delta.siteaudit.access;

/**
 * Opaque, already-validated caller token. Its value is never interpreted here and never logged.
 */
public final class CallerIdentity {
    private static final CallerIdentity ANONYMOUS = new CallerIdentity(null);

    private final String token;

    private CallerIdentity(String token) {
        this.token = token;
    }

    public static CallerIdentity anonymous() {
        return ANONYMOUS;
    }

    public static CallerIdentity fromHeader(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return ANONYMOUS;
        }
        return new CallerIdentity(headerValue.trim());
    }

    public boolean isAnonymous() {
        return token == null;
    }

    public String token() {
        return token;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CallerIdentity that)) {
            return false;
        }
        return token == null ? that.token == null : token.equals(that.token);
    }

    @Override
    public int hashCode() {
        return token == null ? 0 : token.hashCode();
    }

    @Override
    public String toString() {
        return isAnonymous() ? "CallerIdentity[anonymous]" : "CallerIdentity[identified]";
    }
}
