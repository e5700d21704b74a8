package com.eyelevel.ocrprocessor.filter;

import com.eyelevel.ocrprocessor.config.OcrProcessingConfig;
import com.eyelevel.ocrprocessor.dto.common.ApiResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adds security response headers and enforces a per-client request limit over a sliding window of
 * {@code app.processing.rate-limit.window-seconds}. Requests over the limit get a 429 {@link ApiResponse}
 * with a {@code Retry-After} header. Preflight requests are never counted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecurityHeadersFilter extends OncePerRequestFilter {

    private static final int MAX_TRACKED_CLIENTS = 10_000;

    private final OcrProcessingConfig config;
    private final ObjectMapper objectMapper;
    private final Map<String, RequestWindow> windows = new ConcurrentHashMap<>();

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        final OcrProcessingConfig.RateLimit rateLimit = config.getRateLimit();
        if (rateLimit.isEnabled() && !HttpMethod.OPTIONS.matches(request.getMethod())) {
            final String client = request.getRemoteAddr();
            final long nowSeconds = System.currentTimeMillis() / 1000;
            if (windows.size() > MAX_TRACKED_CLIENTS) {
                windows.values().removeIf(tracked -> tracked.isIdle(nowSeconds, rateLimit.getWindowSeconds()));
            }
            final RequestWindow window = windows.computeIfAbsent(client, key -> new RequestWindow());
            if (!window.tryAcquire(nowSeconds, rateLimit.getWindowSeconds(), rateLimit.getMaxRequests())) {
                log.warn("Rate limit exceeded for client {} on {} {}", client, request.getMethod(), request.getRequestURI());
                rejectTooManyRequests(response, rateLimit.getWindowSeconds());
                return;
            }
        }

        response.setHeader("X-Content-Type-Options", "nosniff");
        response.setHeader("X-Frame-Options", "DENY");
        response.setHeader("Strict-Transport-Security", "max-age=31536000; includeSubDomains");
        if (request.getRequestURI().startsWith("/api")) {
            response.setHeader("Content-Security-Policy", "default-src 'self'");
        }
        filterChain.doFilter(request, response);
    }

    private void rejectTooManyRequests(HttpServletResponse response, int windowSeconds) throws IOException {
        final ApiResponse<Object> body = ApiResponse.builder()
                .displayMessage("Too many requests. Please try again later.")
                .showMessage(true)
                .statusCode(HttpStatus.TOO_MANY_REQUESTS.value())
                .build();
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", String.valueOf(windowSeconds));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }

    /**
     * Request counts of one client, bucketed per second.
     */
    static final class RequestWindow {
        private final NavigableMap<Long, Integer> countsBySecond = new TreeMap<>();

        synchronized boolean tryAcquire(long nowSeconds, int windowSeconds, int maxRequests) {
            countsBySecond.headMap(nowSeconds - windowSeconds, true).clear();
            final int total = countsBySecond.values().stream().mapToInt(Integer::intValue).sum();
            if (total >= maxRequests) {
                return false;
            }
            countsBySecond.merge(nowSeconds, 1, Integer::sum);
            return true;
        }

        synchronized boolean isIdle(long nowSeconds, int windowSeconds) {
            return countsBySecond.isEmpty() || countsBySecond.lastKey() <= nowSeconds - windowSeconds;
        }
    }
}
