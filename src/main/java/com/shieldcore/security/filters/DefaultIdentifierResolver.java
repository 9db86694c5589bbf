package com.shieldcore.security.filters;

import com.shieldcore.utils.IpUtils;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

public class DefaultIdentifierResolver implements IdentifierResolver {

    static final String USER_PREFIX = "user:";
    static final String IP_PREFIX = "ip:";

    private final Set<String> trustedProxies;

    public DefaultIdentifierResolver() {
        this(Set.of());
    }

    public DefaultIdentifierResolver(Collection<String> trustedProxies) {
        this.trustedProxies = trustedProxies == null ? Set.of() : trustedProxies.stream()
                .filter(address -> address != null && !address.isBlank())
                .map(String::trim)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String resolve(HttpServletRequest request) {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated()) {
            String name = auth.getName();
            if (name != null && !name.isBlank() && !"anonymousUser".equals(name)) {
                return USER_PREFIX + name;
            }
        }
        String ip = IpUtils.resolveIp(request, trustedProxies);
        return IP_PREFIX + (ip == null || ip.isBlank() ? "unknown" : ip);
    }
}
