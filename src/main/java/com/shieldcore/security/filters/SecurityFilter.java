package com.shieldcore.security.filters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shieldcore.security.RateLimitCheck;
import com.shieldcore.security.SecurityManager;
import com.shieldcore.security.SecurityProperties;
import com.shieldcore.security.validation.FieldKind;
import com.shieldcore.security.validation.ValidationResult;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

@Slf4j
public class SecurityFilter extends OncePerRequestFilter {

    private static final int MAX_DECODE_PASSES = 3;

    private final SecurityProperties.Filter properties;
    private final SecurityManager securityManager;
    private final IdentifierResolver identifierResolver;
    private final ObjectMapper objectMapper;

    public SecurityFilter(
            SecurityProperties.Filter properties,
            SecurityManager securityManager,
            IdentifierResolver identifierResolver,
            ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.securityManager = securityManager;
        this.identifierResolver = identifierResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        if (!properties.isEnabled()) {
            filterChain.doFilter(request, response);
            return;
        }

        String identifier = identifierResolver.resolve(request);
        RateLimitCheck check = securityManager.checkRateLimit(identifier);
        if (check.status() == RateLimitCheck.Status.ACCESS_DENIED) {
            reject(response, HttpServletResponse.SC_FORBIDDEN, check.reason(), check.retryAfterSeconds());
            return;
        }
        if (check.status() == RateLimitCheck.Status.RATE_LIMITED) {
            reject(response, 429, check.reason(), check.retryAfterSeconds());
            return;
        }

        String query = request.getQueryString();
        if (query != null && !query.isEmpty()) {
            String decoded;
            try {
                decoded = decodeQuery(query);
            } catch (IllegalArgumentException ex) {
                reject(response, HttpServletResponse.SC_BAD_REQUEST, "Malformed query string", 0);
                return;
            }
            ValidationResult result = securityManager.validateInput(decoded, FieldKind.GENERAL,
                    properties.getMaxLength(), identifier);
            if (!result.ok()) {
                reject(response, HttpServletResponse.SC_BAD_REQUEST, result.reason(), 0);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    /**
     * Form-decodes each {@code name=value} pair and puts every pair on its own line, so parameter
     * separators are never read as shell operators. A component is decoded again while that still
     * changes it, which exposes double-encoded payloads; only the first pass may reject the input.
     */
    static String decodeQuery(String query) {
        StringJoiner lines = new StringJoiner("\n");
        for (String pair : query.split("&")) {
            if (!pair.isEmpty()) {
                lines.add(decodeComponent(pair));
            }
        }
        return lines.toString();
    }

    private static String decodeComponent(String raw) {
        String current = UriUtils.decode(raw.replace('+', ' '), StandardCharsets.UTF_8);
        for (int pass = 1; pass < MAX_DECODE_PASSES && current.indexOf('%') >= 0; pass++) {
            String next;
            try {
                next = UriUtils.decode(current, StandardCharsets.UTF_8);
            } catch (IllegalArgumentException ex) {
                break;
            }
            if (next.equals(current)) {
                break;
            }
            current = next;
        }
        return current;
    }

    private void reject(HttpServletResponse response, int status, String reason, long retryAfterSeconds)
            throws IOException {
        log.debug("request rejected: status={}, reason={}", status, reason);
        response.setStatus(status);
        if (retryAfterSeconds > 0) {
            response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        }
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("error", reason);
        if (retryAfterSeconds > 0) {
            body.put("retry_after_seconds", retryAfterSeconds);
        }
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
