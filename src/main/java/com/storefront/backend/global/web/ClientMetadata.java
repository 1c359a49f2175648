package com.storefront.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * Requester IP and user agent as recorded on pre-registrations, sessions and audit events.
 * Behind a proxy the first {@code X-Forwarded-For} hop wins, then {@code X-Real-IP}.
 */
public record ClientMetadata(String ip, String userAgent) {

    public static final String UNKNOWN_IP = "0.0.0.0";
    public static final String UNKNOWN_USER_AGENT = "unknown";

    private static final int IP_MAX_LENGTH = 100;
    private static final int USER_AGENT_MAX_LENGTH = 512;

    public static ClientMetadata from(HttpServletRequest request) {
        return new ClientMetadata(truncate(resolveIp(request), IP_MAX_LENGTH), resolveUserAgent(request));
    }

    private static String resolveIp(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(forwardedFor)) {
            String firstHop = forwardedFor.split(",")[0].trim();
            if (!firstHop.isEmpty()) {
                return firstHop;
            }
        }
        String realIp = request.getHeader("X-Real-IP");
        if (StringUtils.hasText(realIp)) {
            return realIp.trim();
        }
        String remoteAddr = request.getRemoteAddr();
        return StringUtils.hasText(remoteAddr) ? remoteAddr : UNKNOWN_IP;
    }

    private static String resolveUserAgent(HttpServletRequest request) {
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        if (!StringUtils.hasText(userAgent)) {
            return UNKNOWN_USER_AGENT;
        }
        return truncate(userAgent, USER_AGENT_MAX_LENGTH);
    }

    // column widths on pre_registration, refresh_token and audit_log
    private static String truncate(String value, int maxLength) {
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
}
