package com.sentidash.backend.modules.auth.application;

public class TokenValidationException extends RuntimeException {

    public enum Reason {
        EXPIRED,
        MALFORMED,
        BAD_SIGNATURE,
        WRONG_AUDIENCE,
        WRONG_ISSUER
    }

    private final Reason reason;

    public TokenValidationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public TokenValidationException(Reason reason, String message) {
        this(reason, message, null);
    }

    public Reason getReason() {
        return reason;
    }
}
