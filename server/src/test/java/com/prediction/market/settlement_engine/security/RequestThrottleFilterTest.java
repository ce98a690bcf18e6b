package com.prediction.market.settlement_engine.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;

class RequestThrottleFilterTest {

    private final RateLimiterRegistry registry = RateLimiterRegistry.of(
            RateLimiterConfig.custom()
                    .limitForPeriod(2)
                    .limitRefreshPeriod(Duration.ofMinutes(1))
                    .timeoutDuration(Duration.ZERO)
                    .build());
    private final RequestThrottleFilter filter = new RequestThrottleFilter(registry);

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void throttlesEachUserSeparately() throws Exception {
        assertThat(send("alice")).isEqualTo(200);
        assertThat(send("alice")).isEqualTo(200);

        MockHttpServletResponse throttled = sendFull("alice");
        assertThat(throttled.getStatus()).isEqualTo(429);
        assertThat(throttled.getHeader("Retry-After")).isEqualTo("60");
        assertThat(throttled.getContentAsString()).contains("RATE_LIMITED");

        assertThat(send("bob")).isEqualTo(200);
    }

    @Test
    void anonymousCallersAreKeyedByRemoteAddress() throws Exception {
        assertThat(sendAnonymous("10.0.0.1", null).getStatus()).isEqualTo(200);
        assertThat(sendAnonymous("10.0.0.1", null).getStatus()).isEqualTo(200);
        assertThat(sendAnonymous("10.0.0.1", null).getStatus()).isEqualTo(429);
        assertThat(sendAnonymous("10.0.0.2", null).getStatus()).isEqualTo(200);
    }

    @Test
    void forwardedHeaderCannotDodgeTheLimit() throws Exception {
        for (int i = 0; i < 2; i++) {
            assertThat(sendAnonymous("10.0.0.1", "198.51.100." + i).getStatus()).isEqualTo(200);
        }
        assertThat(sendAnonymous("10.0.0.1", "203.0.113.99").getStatus()).isEqualTo(429);
        assertThat(registry.getAllRateLimiters()).hasSize(1);
    }

    private int send(String userId) throws Exception {
        return sendFull(userId).getStatus();
    }

    private MockHttpServletResponse sendFull(String userId) throws Exception {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(userId, null,
                List.of(new SimpleGrantedAuthority("ROLE_USER"))));
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(new MockHttpServletRequest("POST", "/bets"), response, new MockFilterChain());
        return response;
    }

    private MockHttpServletResponse sendAnonymous(String remoteAddr, String forwardedFor) throws Exception {
        SecurityContextHolder.clearContext();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/markets/m-1");
        request.setRemoteAddr(remoteAddr);
        if (forwardedFor != null) {
            request.addHeader("X-Forwarded-For", forwardedFor);
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }
}
