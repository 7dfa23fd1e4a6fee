package com.fintech.webhook.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Resolves the caller address used both as rate-limit key and for the network check.
 * <p>
 * Precedence: first element of {@code X-Forwarded-For}, {@code X-Real-IP},
 * the {@code for=} parameter of the first RFC 7239 {@code Forwarded} element,
 * then the transport peer address.
 */
@Component
public class ClientIdentityResolver {

    static final String X_FORWARDED_FOR = "X-Forwarded-For";
    static final String X_REAL_IP = "X-Real-IP";
    static final String FORWARDED = "Forwarded";

    public String resolve(HttpServletRequest request) {
        String forwardedFor = firstElement(request.getHeader(X_FORWARDED_FOR));
        if (forwardedFor != null) {
            return forwardedFor;
        }

        String realIp = trimToNull(request.getHeader(X_REAL_IP));
        if (realIp != null) {
            return realIp;
        }

        String forwarded = parseForwarded(request.getHeader(FORWARDED));
        if (forwarded != null) {
            return forwarded;
        }

        return request.getRemoteAddr();
    }

    static String parseForwarded(String header) {
        String element = firstElement(header);
        if (element == null) {
            return null;
        }
        for (String pair : element.split(";")) {
            String trimmed = pair.trim();
            if (!trimmed.toLowerCase(Locale.ROOT).startsWith("for=")) {
                continue;
            }
            String value = trimmed.substring(4).trim();
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1);
            }
            return trimToNull(stripPort(value));
        }
        return null;
    }

    // "[2001:db8::1]:4711" -> "2001:db8::1", "192.0.2.1:80" -> "192.0.2.1"
    private static String stripPort(String value) {
        if (value.startsWith("[")) {
            int end = value.indexOf(']');
            return end > 0 ? value.substring(1, end) : value.substring(1);
        }
        int colon = value.indexOf(':');
        if (colon > 0 && colon == value.lastIndexOf(':')) {
            return value.substring(0, colon);
        }
        return value;
    }

    private static String firstElement(String header) {
        if (header == null) {
            return null;
        }
        int comma = header.indexOf(',');
        return trimToNull(comma >= 0 ? header.substring(0, comma) : header);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
