package io.tokenkeeper.sdk;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() {
        Config config = Config.builder()
            .tokenProviderUrl("https://auth.example.org/oauth2/token")
            .build();

        assertEquals(Config.DEFAULT_TOKEN_INFO_QUERY_PARAMETER, config.getTokenInfoQueryParameter());
        assertEquals(Config.DEFAULT_CLIENT_CREDENTIALS_FILE_NAME, config.getClientCredentialsFileName());
        assertEquals(0.6, config.getRefreshFactor());
        assertEquals(0.8, config.getWarningFactor());
        assertEquals(Duration.ofSeconds(60), config.getDefaultTokenLifetime());
        assertEquals(Duration.ofSeconds(1), config.getRetryInitialDelay());
        assertEquals(Duration.ofSeconds(60), config.getRetryMaxDelay());
        assertEquals(10_000L, config.getIntrospectionCacheSize());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
        assertNotNull(config.getHttpClient());
        assertNull(config.getUserCredentialsFileName());
        assertNull(config.getTokenInfoUrl());
        assertTrue(config.getTokenInfoUrls().isEmpty());
    }

    @Test
    void stripsTrailingSlashAndOrdersFallbacks() {
        Config config = Config.builder()
            .tokenInfoUrl("https://info.example.org/oauth2/tokeninfo/")
            .fallbackTokenInfoUrl("https://info-backup.example.org/oauth2/tokeninfo")
            .tokenProviderUrl("https://auth.example.org/oauth2/token")
            .fallbackTokenProviderUrls(List.of("https://auth-b.example.org/token/", " "))
            .build();

        assertEquals(List.of("https://info.example.org/oauth2/tokeninfo",
            "https://info-backup.example.org/oauth2/tokeninfo"), config.getTokenInfoUrls());
        assertEquals(List.of("https://auth.example.org/oauth2/token", "https://auth-b.example.org/token"),
            config.getTokenProviderUrls());
    }

    @Test
    void rejectsInvalidUrls() {
        Config.Builder builder = Config.builder().tokenProviderUrl("invalid");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsFallbackWithoutPrimary() {
        Config.Builder builder = Config.builder().fallbackTokenInfoUrl("https://info.example.org");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsFactorsOutOfOrder() {
        assertThrows(IllegalArgumentException.class,
            () -> Config.builder().refreshFactor(0.9).warningFactor(0.8).build());
        assertThrows(IllegalArgumentException.class,
            () -> Config.builder().refreshFactor(0.0).build());
        assertThrows(IllegalArgumentException.class,
            () -> Config.builder().refreshFactor(0.5).warningFactor(1.0).build());
    }

    @Test
    void honoursCustomValues() {
        Config config = Config.builder()
            .refreshFactor(0.5)
            .warningFactor(0.7)
            .defaultTokenLifetime(Duration.ofMinutes(5))
            .retryInitialDelay(Duration.ofMillis(500))
            .retryMaxDelay(Duration.ofSeconds(10))
            .introspectionCacheSize(42)
            .httpTimeout(Duration.ofSeconds(3))
            .tokenInfoQueryParameter("token")
            .build();

        assertEquals(0.5, config.getRefreshFactor());
        assertEquals(0.7, config.getWarningFactor());
        assertEquals(Duration.ofMinutes(5), config.getDefaultTokenLifetime());
        assertEquals(Duration.ofMillis(500), config.getRetryInitialDelay());
        assertEquals(Duration.ofSeconds(10), config.getRetryMaxDelay());
        assertEquals(42L, config.getIntrospectionCacheSize());
        assertEquals(Duration.ofSeconds(3), config.getHttpTimeout());
        assertEquals("token", config.getTokenInfoQueryParameter());
    }
}
