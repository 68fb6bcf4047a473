package io.tokenkeeper.sdk.jwt;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Validates signed JWTs locally, without asking a token-info service.
 *
 * <p>
 * Checks run in this order: decoding, key lookup and signature, required claims ({@code sub}, {@code iss},
 * {@code exp}, {@code iat}, {@code scope}), expiry, issuer.
 * </p>
 */
public final class JwtValidator {

    private static final Logger LOGGER = Logger.getLogger(JwtValidator.class.getName());
    private static final List<String> REQUIRED_CLAIMS = List.of("sub", "iss", "exp", "iat", "scope");

    private final JwtKeySet keys;
    private final Set<String> issuers;
    private final Duration leeway;
    private final Clock clock;

    public JwtValidator(JwtKeySet keys, Set<String> issuers, Duration leeway, Clock clock) {
        this.keys = Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(issuers, "issuers");
        if (issuers.isEmpty()) {
            throw new IllegalArgumentException("at least one expected issuer is required");
        }
        this.issuers = Set.copyOf(issuers);
        this.leeway = leeway == null ? Duration.ZERO : leeway;
        if (this.leeway.isNegative()) {
            throw new IllegalArgumentException("leeway cannot be negative");
        }
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public JwtValidator(JwtKeySet keys, Set<String> issuers) {
        this(keys, issuers, Duration.ZERO, Clock.systemUTC());
    }

    public VerifiedClaims verify(String token) throws JwtValidationException {
        if (token == null || token.isBlank()) {
            throw new JwtValidationException(JwtValidationException.Kind.MALFORMED, "token is empty");
        }

        DecodedJWT jwt;
        try {
            jwt = JWT.decode(token.trim());
        } catch (JWTDecodeException ex) {
            throw new JwtValidationException(JwtValidationException.Kind.MALFORMED,
                "unable to decode JWT: " + ex.getMessage(), ex);
        }

        Algorithm algorithm = keys.resolve(jwt.getKeyId()).orElseThrow(() -> new JwtValidationException(
            JwtValidationException.Kind.SIGNATURE_INVALID, "no verification key for kid " + jwt.getKeyId()));
        if (!algorithm.getName().equals(jwt.getAlgorithm())) {
            throw new JwtValidationException(JwtValidationException.Kind.SIGNATURE_INVALID,
                "JWT algorithm " + jwt.getAlgorithm() + " does not match key algorithm " + algorithm.getName());
        }
        try {
            algorithm.verify(jwt);
        } catch (SignatureVerificationException ex) {
            throw new JwtValidationException(JwtValidationException.Kind.SIGNATURE_INVALID,
                "JWT signature verification failed", ex);
        }

        for (String name : REQUIRED_CLAIMS) {
            Claim claim = jwt.getClaim(name);
            if (claim.isMissing() || claim.isNull()) {
                throw new JwtValidationException(JwtValidationException.Kind.CLAIMS_MISSING,
                    "JWT is missing claim " + name);
            }
        }
        Instant expiresAt = jwt.getExpiresAtAsInstant();
        Instant issuedAt = jwt.getIssuedAtAsInstant();
        Set<String> scopes;
        try {
            scopes = scopes(jwt.getClaim("scope"));
        } catch (JWTDecodeException ex) {
            throw new JwtValidationException(JwtValidationException.Kind.MALFORMED,
                "JWT scope claim is not a list of strings", ex);
        }
        if (expiresAt == null || issuedAt == null || scopes == null) {
            throw new JwtValidationException(JwtValidationException.Kind.MALFORMED,
                "JWT claims exp, iat and scope have unexpected types");
        }

        Instant now = clock.instant();
        if (!now.minus(leeway).isBefore(expiresAt)) {
            throw new JwtValidationException(JwtValidationException.Kind.EXPIRED, "JWT expired at " + expiresAt);
        }

        if (!issuers.contains(jwt.getIssuer())) {
            throw new JwtValidationException(JwtValidationException.Kind.CLAIM_MISMATCH,
                "issuer not allowed: " + jwt.getIssuer());
        }

        Map<String, Object> raw = new LinkedHashMap<>();
        jwt.getClaims().forEach((name, claim) -> raw.put(name, claim.as(Object.class)));
        LOGGER.fine(() -> "[tokenkeeper] verified JWT for subject " + jwt.getSubject() + " from " + jwt.getIssuer());
        return new VerifiedClaims(
            jwt.getKeyId(),
            jwt.getAlgorithm(),
            jwt.getSubject(),
            jwt.getIssuer(),
            jwt.getClaim("realm").asString(),
            scopes,
            issuedAt,
            expiresAt,
            Collections.unmodifiableMap(raw)
        );
    }

    private static Set<String> scopes(Claim claim) {
        List<String> list = claim.asList(String.class);
        if (list != null) {
            return new LinkedHashSet<>(list);
        }
        String text = claim.asString();
        if (text == null) {
            return null;
        }
        Set<String> scopes = new LinkedHashSet<>();
        Arrays.stream(text.trim().split("\\s+")).filter(s -> !s.isEmpty()).forEach(scopes::add);
        return scopes;
    }
}
