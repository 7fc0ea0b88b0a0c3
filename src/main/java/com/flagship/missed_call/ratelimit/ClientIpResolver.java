package com.flagship.missed_call.ratelimit;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Best guess at the client address behind the load balancer: first
 * X-Forwarded-For entry, then X-Real-IP, then the socket address.
 */
public final class ClientIpResolver {

    public static final String UNKNOWN = "unknown";

    private ClientIpResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        String remote = request.getRemoteAddr();
        return remote != null && !remote.isBlank() ? remote : UNKNOWN;
    }
}
