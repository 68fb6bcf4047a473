package io.tokenkeeper.sdk;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentConfigTest {

    @Test
    void readsDirectVariables() {
        Config config = EnvironmentConfig.fromEnvironment(Map.of(
            "TOKENKEEPER_TOKEN_INFO_URL", "https://info.example.org/tokeninfo",
            "TOKENKEEPER_FALLBACK_TOKEN_INFO_URL", "https://b.example.org/tokeninfo, https://c.example.org/tokeninfo",
            "TOKENKEEPER_TOKEN_INFO_URL_QUERY_PARAMETER", "token",
            "TOKENKEEPER_TOKEN_PROVIDER_URL", "https://auth.example.org/token",
            "TOKENKEEPER_TOKEN_PROVIDER_REALM", "/services",
            "TOKENKEEPER_CREDENTIALS_DIR", "/etc/credentials",
            "TOKENKEEPER_USER_CREDENTIALS_FILE_NAME", "user.json",
            "TOKENKEEPER_REFRESH_FACTOR", "0.5",
            "TOKENKEEPER_WARNING_FACTOR", "0.75"
        ));

        assertEquals(List.of("https://info.example.org/tokeninfo", "https://b.example.org/tokeninfo",
            "https://c.example.org/tokeninfo"), config.getTokenInfoUrls());
        assertEquals("token", config.getTokenInfoQueryParameter());
        assertEquals(List.of("https://auth.example.org/token"), config.getTokenProviderUrls());
        assertEquals("/services", config.getTokenProviderRealm());
        assertEquals(Path.of("/etc/credentials"), config.getCredentialsDir());
        assertEquals("client.json", config.getClientCredentialsFileName());
        assertEquals("user.json", config.getUserCredentialsFileName());
        assertEquals(0.5, config.getRefreshFactor());
        assertEquals(0.75, config.getWarningFactor());
    }

    @Test
    void followsEnvVarIndirection() {
        Config config = EnvironmentConfig.fromEnvironment(Map.of(
            "TOKENKEEPER_TOKEN_PROVIDER_URL_ENV_VAR", "MY_TOKEN_URL",
            "MY_TOKEN_URL", "https://auth.example.org/token",
            "TOKENKEEPER_TOKEN_PROVIDER_URL", "https://ignored.example.org/token",
            "TOKENKEEPER_CREDENTIALS_DIR_ENV_VAR", "MY_CREDS",
            "MY_CREDS", "/run/secrets"
        ));

        assertEquals("https://auth.example.org/token", config.getTokenProviderUrl());
        assertEquals(Path.of("/run/secrets"), config.getCredentialsDir());
    }

    @Test
    void missingIndirectTargetFails() {
        assertThrows(IllegalArgumentException.class, () -> EnvironmentConfig.fromEnvironment(Map.of(
            "TOKENKEEPER_TOKEN_INFO_URL_ENV_VAR", "NOT_SET")));
    }

    @Test
    void fallsBackToPlainCredentialsDir() {
        Config config = EnvironmentConfig.fromEnvironment(Map.of("CREDENTIALS_DIR", "/meta/credentials"));

        assertEquals(Path.of("/meta/credentials"), config.getCredentialsDir());
    }

    @Test
    void rejectsUnparsableFactor() {
        assertThrows(IllegalArgumentException.class,
            () -> EnvironmentConfig.fromEnvironment(Map.of("TOKENKEEPER_REFRESH_FACTOR", "soon")));
    }

    @Test
    void emptyEnvironmentGivesDefaults() {
        Config config = EnvironmentConfig.fromEnvironment(Map.of());

        assertNull(config.getTokenProviderUrl());
        assertNull(config.getCredentialsDir());
        assertEquals(Config.DEFAULT_REFRESH_FACTOR, config.getRefreshFactor());
    }
}
