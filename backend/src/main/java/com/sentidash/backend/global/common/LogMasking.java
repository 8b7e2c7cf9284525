package com.sentidash.backend.global.common;

public final class LogMasking {

    private LogMasking() {
    }

    /** a***@example.com */
    public static String maskEmail(String email) {
        if (email == null) {
            return null;
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
