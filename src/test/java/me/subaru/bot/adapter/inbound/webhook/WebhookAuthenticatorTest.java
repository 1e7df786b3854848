package me.subaru.bot.adapter.inbound.webhook;

import me.subaru.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.junit.jupiter.api.Assertions.*;

class WebhookAuthenticatorTest {

    private BotProperties properties;
    private WebhookAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        authenticator = new WebhookAuthenticator(properties);
    }

    @Test
    void openWhenNoTokenConfigured() {
        assertTrue(authenticator.authenticateBearer(new HttpHeaders()));
        assertTrue(authenticator.authenticateDiscordToken("anything"));
    }

    @Test
    void shouldAcceptBearerToken() {
        properties.getWebhook().setToken("s3cret");
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer s3cret");

        assertTrue(authenticator.authenticateBearer(headers));
    }

    @Test
    void shouldAcceptCustomHeader() {
        properties.getWebhook().setToken("s3cret");
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Subaru-Token", "s3cret");

        assertTrue(authenticator.authenticateBearer(headers));
    }

    @Test
    void shouldRejectWrongOrMissingToken() {
        properties.getWebhook().setToken("s3cret");
        HttpHeaders wrong = new HttpHeaders();
        wrong.set(HttpHeaders.AUTHORIZATION, "Bearer nope");

        assertFalse(authenticator.authenticateBearer(wrong));
        assertFalse(authenticator.authenticateBearer(new HttpHeaders()));
    }

    @Test
    void shouldCheckDiscordPathToken() {
        properties.getWebhook().setDiscordToken("path-secret");

        assertTrue(authenticator.authenticateDiscordToken("path-secret"));
        assertFalse(authenticator.authenticateDiscordToken("path-secre"));
        assertFalse(authenticator.authenticateDiscordToken(null));
    }
}
