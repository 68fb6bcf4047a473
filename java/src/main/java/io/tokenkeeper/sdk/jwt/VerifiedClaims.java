package io.tokenkeeper.sdk.jwt;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Claims of a JWT whose signature, expiry and issuer were checked.
 *
 * @param keyId     {@code kid} header, null when the default key was used
 * @param algorithm {@code alg} header
 * @param subject   {@code sub}
 * @param issuer    {@code iss}
 * @param realm     {@code realm}, null when absent
 * @param scopes    {@code scope}, given as array or space-delimited string
 * @param issuedAt  {@code iat}
 * @param expiresAt {@code exp}
 * @param rawClaims all payload claims
 */
public record VerifiedClaims(
    String keyId,
    String algorithm,
    String subject,
    String issuer,
    String realm,
    Set<String> scopes,
    Instant issuedAt,
    Instant expiresAt,
    Map<String, Object> rawClaims
) {

    public VerifiedClaims {
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        rawClaims = rawClaims == null ? Map.of() : rawClaims;
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }
}
