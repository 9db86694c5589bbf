package com.shieldcore.utils;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

import java.util.Set;

public class IpUtils {

    public static final String TRUST_ALL = "*";

    private static final String FORWARDED_FOR = "X-Forwarded-For";
    private static final String[] SINGLE_VALUE_HEADERS = {
            "X-Real-IP",
            "CF-Connecting-IP",
            "True-Client-IP"
    };

    private IpUtils() {
    }

    /**
     * Forwarding headers are read only when the direct peer is one of {@code trustedProxies}
     * ({@value #TRUST_ALL} trusts every peer). The {@code X-Forwarded-For} chain is walked from
     * the right, skipping trusted hops.
     */
    public static String resolveIp(HttpServletRequest request, Set<String> trustedProxies) {
        String remote = request.getRemoteAddr();
        if (!isTrusted(remote, trustedProxies)) {
            return remote;
        }
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (StringUtils.hasText(forwarded)) {
            String[] hops = forwarded.split(",");
            for (int i = hops.length - 1; i >= 0; i--) {
                String hop = hops[i].trim();
                if (StringUtils.hasText(hop) && (i == 0 || !isTrusted(hop, trustedProxies))) {
                    return hop;
                }
            }
        }
        for (String header : SINGLE_VALUE_HEADERS) {
            String value = request.getHeader(header);
            if (StringUtils.hasText(value)) {
                return value.trim();
            }
        }
        return remote;
    }

    private static boolean isTrusted(String address, Set<String> trustedProxies) {
        if (trustedProxies == null || trustedProxies.isEmpty() || address == null) {
            return false;
        }
        return trustedProxies.contains(TRUST_ALL) || trustedProxies.contains(address.trim());
    }
}
