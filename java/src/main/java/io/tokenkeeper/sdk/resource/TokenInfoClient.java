package io.tokenkeeper.sdk.resource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import io.tokenkeeper.sdk.Config;
import io.tokenkeeper.sdk.internal.EndpointChain;
import io.tokenkeeper.sdk.internal.EndpointChain.EndpointFailure;
import io.tokenkeeper.sdk.internal.HttpUtil;
import io.tokenkeeper.sdk.internal.Json;
import io.tokenkeeper.sdk.internal.OAuthErrorDecoder;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Introspects bearer tokens against a token-info service, caching positive answers until the token expires.
 *
 * <p>
 * Endpoints are tried in order. Client errors (400, 401, 403, 404) mean the token is invalid and are final; network
 * errors, server errors and unusable bodies move on to the next endpoint. When no endpoint could answer the result is
 * {@link IntrospectionException.Kind#UNAVAILABLE}, which callers must not confuse with an invalid token.
 * </p>
 */
public final class TokenInfoClient implements TokenIntrospector {

    private static final Logger LOGGER = Logger.getLogger(TokenInfoClient.class.getName());
    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {
    };
    private static final Set<Integer> INVALID_TOKEN_STATUSES = Set.of(400, 401, 403, 404);

    private final HttpClient httpClient;
    private final EndpointChain endpoints;
    private final String queryParameter;
    private final Duration requestTimeout;
    private final Clock clock;
    private final Cache<String, IntrospectionResult> cache;

    public TokenInfoClient(
        HttpClient httpClient,
        List<String> urls,
        String queryParameter,
        long cacheSize,
        Duration requestTimeout,
        Clock clock
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.endpoints = new EndpointChain("token info", urls);
        this.queryParameter = queryParameter == null || queryParameter.isBlank()
            ? Config.DEFAULT_TOKEN_INFO_QUERY_PARAMETER : queryParameter.trim();
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Config.DEFAULT_HTTP_TIMEOUT : requestTimeout;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cache = Caffeine.newBuilder()
            .maximumSize(cacheSize > 0 ? cacheSize : Config.DEFAULT_INTROSPECTION_CACHE_SIZE)
            .expireAfter(new UntilTokenExpiry(clock))
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .build();
    }

    public TokenInfoClient(Config config, Clock clock) {
        this(
            config.getHttpClient(),
            config.getTokenInfoUrls(),
            config.getTokenInfoQueryParameter(),
            config.getIntrospectionCacheSize(),
            config.getHttpTimeout(),
            clock
        );
    }

    public static TokenInfoClient create(Config config) {
        return new TokenInfoClient(config, Clock.systemUTC());
    }

    public List<String> endpointUrls() {
        return endpoints.urls();
    }

    @Override
    public IntrospectionResult introspect(String bearerToken) throws IntrospectionException {
        if (bearerToken == null || bearerToken.isBlank()) {
            throw new IntrospectionException(IntrospectionException.Kind.INVALID, "bearer token is empty", null);
        }
        String token = bearerToken.trim();

        IntrospectionResult cached = cache.getIfPresent(token);
        if (cached != null) {
            if (!cached.isExpired(clock.instant())) {
                return cached;
            }
            cache.invalidate(token);
        }

        IntrospectionResult result = endpoints.call(
            url -> fetch(url, token),
            exhausted -> new IntrospectionException(
                exhausted.allMalformed()
                    ? IntrospectionException.Kind.RESPONSE_MALFORMED : IntrospectionException.Kind.UNAVAILABLE,
                "token info failed on all endpoints: " + exhausted.describe(),
                exhausted.last()
            )
        );

        if (result.getExpiresAt() == null) {
            LOGGER.fine(() -> "[tokenkeeper] token info for subject " + result.getSubject()
                + " carries no expiry, not caching it");
        } else if (!result.isExpired(clock.instant())) {
            cache.put(token, result);
        }
        return result;
    }

    /**
     * @return the number of cached introspection results, for diagnostics.
     */
    public long cachedEntries() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private IntrospectionResult fetch(String url, String token) throws EndpointFailure, IntrospectionException {
        HttpResponse<byte[]> response;
        try {
            response = HttpUtil.get(httpClient, HttpUtil.withQueryParameter(url, queryParameter, token), requestTimeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IntrospectionException(IntrospectionException.Kind.UNAVAILABLE, "token info interrupted", ex);
        } catch (IOException ex) {
            throw EndpointFailure.unreachable("token info: " + ex, ex);
        }

        int status = response.statusCode();
        if (INVALID_TOKEN_STATUSES.contains(status)) {
            OAuthErrorDecoder.OAuthError error = OAuthErrorDecoder.decode(status, response.body());
            throw new IntrospectionException(IntrospectionException.Kind.INVALID, status,
                "token rejected by token info: " + error.describe(), null);
        }
        if (!HttpUtil.isSuccess(status)) {
            OAuthErrorDecoder.OAuthError error = OAuthErrorDecoder.decode(status, response.body());
            throw EndpointFailure.unreachable("token info answered " + error.describe(), null);
        }
        return parse(response.body());
    }

    private IntrospectionResult parse(byte[] body) throws EndpointFailure, IntrospectionException {
        Instant fetchedAt = clock.instant();
        JsonNode node;
        try {
            node = Json.mapper().readTree(body);
        } catch (IOException ex) {
            throw EndpointFailure.malformed("decode token info response: " + ex.getMessage(), ex);
        }
        if (node == null || !node.isObject()) {
            throw EndpointFailure.malformed("token info response is not a JSON object", null);
        }

        JsonNode active = node.path("active");
        if (active.isBoolean() && !active.booleanValue()) {
            throw new IntrospectionException(IntrospectionException.Kind.INVALID, 200, "token is not active", null);
        }

        String subject = Json.text(node, "uid");
        if (subject == null) {
            subject = Json.text(node, "sub");
        }
        if (subject == null) {
            throw EndpointFailure.malformed("token info response has neither uid nor sub", null);
        }

        Set<String> scopes = Json.scopes(node, "scope");
        Instant expiresAt = expiry(node, fetchedAt);
        if (expiresAt != null && !expiresAt.isAfter(fetchedAt)) {
            throw new IntrospectionException(IntrospectionException.Kind.INVALID, 200,
                "token expired at " + expiresAt, null);
        }
        Map<String, Object> claims = Json.mapper().convertValue(node, CLAIMS_TYPE);
        return new IntrospectionResult(true, subject, scopes, expiresAt, Json.text(node, "realm"), claims, fetchedAt);
    }

    private static Instant expiry(JsonNode node, Instant fetchedAt) throws EndpointFailure {
        JsonNode expiresIn = node.path("expires_in");
        JsonNode exp = node.path("exp");
        try {
            if (expiresIn.canConvertToLong() && expiresIn.asLong() > 0) {
                return requireEpochMillis(fetchedAt.plusSeconds(expiresIn.asLong()));
            }
            if (exp.canConvertToLong() && exp.asLong() > 0) {
                return requireEpochMillis(Instant.ofEpochSecond(exp.asLong()));
            }
        } catch (DateTimeException | ArithmeticException ex) {
            throw EndpointFailure.malformed("token info expiry out of range (expires_in=" + expiresIn
                + ", exp=" + exp + ")", ex);
        }
        if (!expiresIn.isMissingNode() || !exp.isMissingNode()) {
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[tokenkeeper] token info expiry is not usable (expires_in=%s, exp=%s)", expiresIn, exp));
        }
        return null;
    }

    // the cache computes expiry in epoch millis
    private static Instant requireEpochMillis(Instant instant) {
        instant.toEpochMilli();
        return instant;
    }

    /**
     * Expires each entry at its own token expiry.
     */
    private static final class UntilTokenExpiry implements Expiry<String, IntrospectionResult> {

        private final Clock clock;

        UntilTokenExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, IntrospectionResult value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, IntrospectionResult value, long currentTime,
                                      long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(String key, IntrospectionResult value, long currentTime,
                                    long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(IntrospectionResult value) {
            if (value.getExpiresAt() == null) {
                return 0L;
            }
            long millis = value.getExpiresAt().toEpochMilli() - clock.millis();
            return millis <= 0 ? 0L : TimeUnit.MILLISECONDS.toNanos(millis);
        }
    }
}
