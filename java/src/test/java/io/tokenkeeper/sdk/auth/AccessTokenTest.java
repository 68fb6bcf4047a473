package io.tokenkeeper.sdk.auth;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AccessTokenTest {

    private static final Instant ISSUED = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void computesThresholdInstants() {
        AccessToken token = new AccessToken("secret-value", ISSUED, ISSUED.plusSeconds(100), Set.of("uid"));

        assertEquals(ISSUED.plusSeconds(60), token.instantAt(0.6));
        assertEquals(ISSUED.plusSeconds(80), token.instantAt(0.8));
        assertFalse(token.isExpired(ISSUED.plusSeconds(99)));
        assertTrue(token.isExpired(ISSUED.plusSeconds(100)));
    }

    @Test
    void neverPrintsTokenValue() {
        AccessToken token = new AccessToken("secret-value", ISSUED, ISSUED.plusSeconds(100), Set.of());

        assertFalse(token.toString().contains("secret-value"));
    }

    @Test
    void rejectsNonPositiveLifetime() {
        assertThrows(IllegalArgumentException.class, () -> new AccessToken("v", ISSUED, ISSUED, Set.of()));
    }
}
