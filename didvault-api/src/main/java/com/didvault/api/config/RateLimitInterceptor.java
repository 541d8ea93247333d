package com.didvault.api.config;

import com.didvault.api.identity.IdentityController;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rate limiting interceptor for API requests.
 *
 * Clients are identified by caller principal, then forwarded address, then
 * remote address. Returns 429 Too Many Requests when the bucket is empty.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final RateLimitConfig rateLimitConfig;

    public RateLimitInterceptor(RateLimitConfig rateLimitConfig) {
        this.rateLimitConfig = rateLimitConfig;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                            Object handler) throws Exception {

        String clientId = resolveClientId(request);
        Bucket bucket = selectBucket(request, clientId);

        ConsumptionProbe consumption = bucket.tryConsumeAndReturnRemaining(1);

        if (consumption.isConsumed()) {
            response.addHeader("X-Rate-Limit-Remaining",
                String.valueOf(consumption.getRemainingTokens()));
            return true;
        }

        long waitForRefill = consumption.getNanosToWaitForRefill() / 1_000_000_000;
        log.debug("Rate limit exceeded for {} on {} {}", clientId, request.getMethod(), request.getRequestURI());
        response.addHeader("X-Rate-Limit-Retry-After-Seconds", String.valueOf(waitForRefill));
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"code\":\"RATE_001\",\"message\":\"Rate limit exceeded. Retry after "
            + waitForRefill + " seconds.\"}");
        return false;
    }

    private String resolveClientId(HttpServletRequest request) {
        String caller = request.getHeader(IdentityController.CALLER_HEADER);
        if (caller != null && !caller.isBlank()) {
            return caller;
        }

        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null) {
            return forwarded.split(",")[0].trim();
        }

        return request.getRemoteAddr();
    }

    private Bucket selectBucket(HttpServletRequest request, String clientId) {
        String path = request.getRequestURI();
        String method = request.getMethod();

        // Revocation, cancellation and acceptance
        if ("DELETE".equals(method) || path.endsWith("/accept")) {
            return rateLimitConfig.resolveStrictBucket(clientId);
        }

        if ("GET".equals(method) && path.startsWith("/api/v1/audit")) {
            return rateLimitConfig.resolveHighVolumeBucket(clientId);
        }

        return rateLimitConfig.resolveBucket(clientId);
    }
}
