package com.storefront.backend.util;

public final class LogRedaction {

    private LogRedaction() {
    }

    /**
     * {@code jane.doe@example.com} becomes {@code j***@example.com}.
     */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "<empty>";
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
