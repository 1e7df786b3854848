package me.subaru.bot.ratelimit;

import me.subaru.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UserRateLimiterTest {

    private BotProperties properties;
    private UserRateLimiter limiter;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getRateLimit().setUserMessagesPerMinute(3);
        limiter = new UserRateLimiter(properties);
    }

    @Test
    void shouldDenyAfterPerMinuteLimit() {
        for (int i = 0; i < 3; i++) {
            assertTrue(limiter.tryConsume("@alice:example.org").isAllowed());
        }

        assertFalse(limiter.tryConsume("@alice:example.org").isAllowed());
    }

    @Test
    void shouldKeepSeparateBucketsPerUser() {
        for (int i = 0; i < 3; i++) {
            limiter.tryConsume("@alice:example.org");
        }

        assertFalse(limiter.tryConsume("@alice:example.org").isAllowed());
        assertTrue(limiter.tryConsume("@bob:example.org").isAllowed());
    }

    @Test
    void shouldAllowEverythingWhenDisabled() {
        properties.getRateLimit().setEnabled(false);

        for (int i = 0; i < 50; i++) {
            assertTrue(limiter.tryConsume("@alice:example.org").isAllowed());
        }
    }

    @Test
    void shouldPickUpChangedCapacity() {
        for (int i = 0; i < 3; i++) {
            limiter.tryConsume("@alice:example.org");
        }
        properties.getRateLimit().setUserMessagesPerMinute(10);

        assertTrue(limiter.tryConsume("@alice:example.org").isAllowed());
    }
}
