package com.prediction.market.settlement_engine.security;

import java.io.IOException;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-identity request throttle.
 *
 * Rate limiting strategy:
 * 1. Authenticated users: rate limit by userId (from the bearer token)
 * 2. Unauthenticated callers: rate limit by remote address. Forwarded headers
 *    are honoured only through server.forward-headers-strategy, which trusts
 *    them from internal proxies alone.
 *
 * When the limit is exceeded the filter answers 429 with Retry-After.
 */
@Slf4j
public class RequestThrottleFilter extends OncePerRequestFilter {

    private final RateLimiterRegistry registry;

    public RequestThrottleFilter(RateLimiterRegistry registry) {
        this.registry = registry;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String identifier = getIdentifier(request);
        RateLimiter rateLimiter = registry.rateLimiter(identifier);

        if (!rateLimiter.acquirePermission()) {
            long retryAfter = Math.max(1, rateLimiter.getRateLimiterConfig().getLimitRefreshPeriod().toSeconds());
            log.warn("Request throttled identifier={} path={}", identifier, request.getRequestURI());
            sendRateLimitExceededResponse(response, identifier, retryAfter);
            return;
        }

        filterChain.doFilter(request, response);
    }

    /**
     * Prefers userId from authentication, falls back to IP address.
     */
    private String getIdentifier(HttpServletRequest request) {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && auth.getPrincipal() instanceof String userId
                && !userId.equals("anonymousUser")) {
            return "user:" + userId;
        }
        return "ip:" + request.getRemoteAddr();
    }

    private void sendRateLimitExceededResponse(
            HttpServletResponse response,
            String identifier,
            long retryAfter) throws IOException {

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", String.valueOf(retryAfter));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);

        String jsonResponse = String.format(
                "{\"code\":\"RATE_LIMITED\",\"kind\":\"RESOURCE\",\"message\":\"Rate limit exceeded for %s\",\"retryToken\":null}",
                identifier);
        response.getWriter().write(jsonResponse);
        response.getWriter().flush();
    }
}
