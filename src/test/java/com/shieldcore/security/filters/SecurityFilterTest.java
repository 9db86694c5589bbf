package com.shieldcore.security.filters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shieldcore.security.MutableClock;
import com.shieldcore.security.SecurityManager;
import com.shieldcore.security.SecurityProperties;
import com.shieldcore.security.SecuritySettings;
import com.shieldcore.utils.JsonSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class SecurityFilterTest {

    private final MutableClock clock = MutableClock.startingAt("2024-10-01T00:00:00Z");
    private final ObjectMapper objectMapper = JsonSupport.objectMapper();
    private SecurityManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
    }

    @Test
    void allowedRequestReachesTheChain() throws Exception {
        SecurityFilter filter = filter(properties(5));
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request("203.0.113.9"), response, chain);

        assertEquals(200, response.getStatus());
        assertNotNull(chain.getRequest());
    }

    @Test
    void overLimitReturns429WithRetryAfter() throws Exception {
        SecurityFilter filter = filter(properties(1));
        filter.doFilter(request("203.0.113.9"), new MockHttpServletResponse(), new MockFilterChain());

        MockFilterChain chain = new MockFilterChain();
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request("203.0.113.9"), response, chain);

        assertEquals(429, response.getStatus());
        assertEquals("300", response.getHeader("Retry-After"));
        assertNull(chain.getRequest());
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals(429, body.get("status").asInt());
        assertEquals(300, body.get("retry_after_seconds").asLong());
    }

    @Test
    void manuallyBlockedCallerGets403() throws Exception {
        SecurityFilter filter = filter(properties(5));
        manager.blockIdentifier("ip:198.51.100.4", "abuse", Duration.ofMinutes(10));

        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request("198.51.100.4"), response, new MockFilterChain());

        assertEquals(403, response.getStatus());
        assertEquals("600", response.getHeader("Retry-After"));
        assertEquals("Access denied", objectMapper.readTree(response.getContentAsString()).get("error").asText());
    }

    @Test
    void maliciousQueryStringIsRejected() throws Exception {
        SecurityFilter filter = filter(properties(5));
        MockHttpServletRequest request = request("203.0.113.9");
        request.setQueryString("q=%27%20OR%201=1&x=<script>alert(1)</script>");

        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, response, chain);

        assertEquals(400, response.getStatus());
        assertNull(chain.getRequest());
        assertNull(response.getHeader("Retry-After"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "q=%3Cscript%3Ealert(1)%3C%2Fscript%3E",
            "id=1%27%20OR%20%271%27%3D%271",
            "id=1'+OR+'1'='1",
            "q=%253Cscript%253Ealert(1)%253C%252Fscript%253E"
    })
    void encodedPayloadsAreDecodedBeforeValidation(String query) throws Exception {
        SecurityFilter filter = filter(properties(5));
        MockHttpServletRequest request = request("203.0.113.9");
        request.setQueryString(query);

        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, response, chain);

        assertEquals(400, response.getStatus());
        assertNull(chain.getRequest());
        assertEquals(1, manager.auditLog().size());
    }

    @Test
    void malformedEncodingIsRejected() throws Exception {
        SecurityFilter filter = filter(properties(5));
        MockHttpServletRequest request = request("203.0.113.9");
        request.setQueryString("q=%zz");

        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, response, chain);

        assertEquals(400, response.getStatus());
        assertEquals("Malformed query string",
                objectMapper.readTree(response.getContentAsString()).get("error").asText());
        assertNull(chain.getRequest());
    }

    @Test
    void encodedBenignQueryPasses() throws Exception {
        SecurityFilter filter = filter(properties(5));
        MockHttpServletRequest request = request("203.0.113.9");
        request.setQueryString("room=living+room&id=42&discount=50%25");

        MockFilterChain chain = new MockFilterChain();
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, chain);

        assertEquals(200, response.getStatus());
        assertNotNull(chain.getRequest());
        assertEquals("room=living room\nid=42\ndiscount=50%",
                SecurityFilter.decodeQuery("room=living+room&id=42&discount=50%25"));
    }

    @Test
    void disabledFilterPassesEverythingThrough() throws Exception {
        SecurityProperties properties = properties(1);
        properties.getFilter().setEnabled(false);
        SecurityFilter filter = filter(properties);

        for (int i = 0; i < 3; i++) {
            MockFilterChain chain = new MockFilterChain();
            filter.doFilter(request("203.0.113.9"), new MockHttpServletResponse(), chain);
            assertNotNull(chain.getRequest());
        }
    }

    private SecurityFilter filter(SecurityProperties properties) {
        manager = new SecurityManager(SecuritySettings.resolve(properties), clock, objectMapper);
        return new SecurityFilter(properties.getFilter(), manager, new DefaultIdentifierResolver(), objectMapper);
    }

    private static SecurityProperties properties(int perMinute) {
        SecurityProperties properties = new SecurityProperties();
        properties.getRateLimit().setRequestsPerMinute(perMinute);
        return properties;
    }

    private static MockHttpServletRequest request(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/lights");
        request.setRemoteAddr(remoteAddr);
        return request;
    }
}
