package com.propertyBot.ratingsBot.gateway.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window rate limiter per chat.
 *
 * Rate limit: 15 commands per minute per chat. Idle windows are evicted by Caffeine.
 * Rejections are logged by GatewayService.
 */
@Service
public class RateLimiter {

    static final int MAX_REQUESTS_PER_MINUTE = 15;
    private static final Duration WINDOW = Duration.ofSeconds(60);

    private final Clock clock;

    private final Cache<String, RequestWindow> chatWindows = Caffeine.newBuilder()
            .expireAfterAccess(WINDOW.multipliedBy(2))
            .maximumSize(10_000)
            .build();

    public RateLimiter() {
        this(Clock.systemUTC());
    }

    RateLimiter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Checks and records one request.
     *
     * @param chatId The chat to check rate limit for
     * @return true if request is allowed, false if rate limit exceeded
     */
    public boolean isAllowed(String chatId) {
        RequestWindow window = chatWindows.get(chatId, key -> new RequestWindow());
        return window.tryAcquire(clock.instant());
    }

    private static class RequestWindow {
        private final Deque<Instant> requests = new ArrayDeque<>();

        synchronized boolean tryAcquire(Instant now) {
            Instant cutoff = now.minus(WINDOW);
            while (!requests.isEmpty() && requests.peekFirst().isBefore(cutoff)) {
                requests.pollFirst();
            }
            if (requests.size() >= MAX_REQUESTS_PER_MINUTE) {
                return false;
            }
            requests.addLast(now);
            return true;
        }
    }
}
