package com.shieldcore.security.filters;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Maps a request to the key its rate limits and blocks are tracked under.
 */
@FunctionalInterface
public interface IdentifierResolver {
    String resolve(HttpServletRequest request);
}
