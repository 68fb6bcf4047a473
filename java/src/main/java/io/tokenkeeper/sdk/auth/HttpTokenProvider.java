package io.tokenkeeper.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.tokenkeeper.sdk.Config;
import io.tokenkeeper.sdk.credentials.CredentialsSnapshot;
import io.tokenkeeper.sdk.credentials.UserCredentials;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * TokenProvider implementation performing OAuth token requests against a list of provider endpoints.
 *
 * <p>
 * The {@code password} grant is used when the credentials carry user credentials, the {@code client_credentials}
 * grant otherwise. The client always authenticates with HTTP Basic. Network errors, server errors and unusable
 * bodies move on to the next endpoint; any other client error is final.
 * </p>
 */
public final class HttpTokenProvider implements TokenProvider {

    private static final Logger LOGGER = Logger.getLogger(HttpTokenProvider.class.getName());

    private final HttpClient httpClient;
    private final EndpointChain endpoints;
    private final Duration defaultLifetime;
    private final Duration requestTimeout;
    private final Clock clock;

    public HttpTokenProvider(
        HttpClient httpClient,
        List<String> urls,
        String realm,
        Duration defaultLifetime,
        Duration requestTimeout,
        Clock clock
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        Objects.requireNonNull(urls, "urls");
        List<String> resolved = realm == null || realm.isBlank()
            ? urls
            : urls.stream().map(url -> HttpUtil.withQueryParameter(url, "realm", realm.trim())).toList();
        this.endpoints = new EndpointChain("token provider", resolved);
        this.defaultLifetime = defaultLifetime == null || defaultLifetime.isZero() || defaultLifetime.isNegative()
            ? Config.DEFAULT_TOKEN_LIFETIME : defaultLifetime;
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Config.DEFAULT_HTTP_TIMEOUT : requestTimeout;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public HttpTokenProvider(Config config, Clock clock) {
        this(
            config.getHttpClient(),
            config.getTokenProviderUrls(),
            config.getTokenProviderRealm(),
            config.getDefaultTokenLifetime(),
            config.getHttpTimeout(),
            clock
        );
    }

    public List<String> endpointUrls() {
        return endpoints.urls();
    }

    @Override
    public AccessToken acquire(CredentialsSnapshot credentials, Set<String> scopes) throws ProviderException {
        Objects.requireNonNull(credentials, "credentials");
        Set<String> requested = scopes == null ? Set.of() : scopes;
        Map<String, String> form = form(credentials, requested);

        return endpoints.call(
            url -> requestToken(url, form, credentials, requested),
            exhausted -> new ProviderException(
                exhausted.allMalformed() ? ProviderException.Kind.RESPONSE_MALFORMED : ProviderException.Kind.UNAVAILABLE,
                "request token failed on all endpoints: " + exhausted.describe(),
                exhausted.last()
            )
        );
    }

    private static Map<String, String> form(CredentialsSnapshot credentials, Set<String> scopes) {
        Map<String, String> form = new LinkedHashMap<>();
        UserCredentials user = credentials.user();
        if (user != null) {
            form.put("grant_type", GrantType.PASSWORD.value());
            form.put("username", user.username());
            form.put("password", user.password());
        } else {
            form.put("grant_type", GrantType.CLIENT_CREDENTIALS.value());
        }
        if (!scopes.isEmpty()) {
            form.put("scope", String.join(" ", scopes));
        }
        return form;
    }

    private AccessToken requestToken(String url, Map<String, String> form, CredentialsSnapshot credentials,
                                     Set<String> requested) throws EndpointFailure, ProviderException {
        HttpResponse<byte[]> response;
        try {
            response = HttpUtil.postForm(httpClient, url, form,
                credentials.client().id(), credentials.client().secret(), requestTimeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Kind.UNAVAILABLE, "request token interrupted", ex);
        } catch (IOException ex) {
            throw EndpointFailure.unreachable("request token: " + ex, ex);
        }

        int status = response.statusCode();
        if (!HttpUtil.isSuccess(status)) {
            OAuthErrorDecoder.OAuthError error = OAuthErrorDecoder.decode(status, response.body());
            if (HttpUtil.isTransient(status) || status < 400) {
                throw EndpointFailure.unreachable("token endpoint answered " + error.describe(), null);
            }
            throw new ProviderException(ProviderException.Kind.REJECTED, status, error.code(),
                "token request rejected with " + error.describe(), null);
        }

        return parse(response.body(), requested);
    }

    private AccessToken parse(byte[] body, Set<String> requested) throws EndpointFailure {
        Instant receivedAt = clock.instant();
        JsonNode node;
        try {
            node = Json.mapper().readTree(body);
        } catch (IOException ex) {
            throw EndpointFailure.malformed("decode token response: " + ex.getMessage(), ex);
        }
        if (node == null || !node.isObject()) {
            throw EndpointFailure.malformed("token response is not a JSON object", null);
        }

        String accessToken = Json.text(node, "access_token");
        if (accessToken == null) {
            throw EndpointFailure.malformed("token response missing access_token", null);
        }

        Duration lifetime = defaultLifetime;
        JsonNode expiresIn = node.path("expires_in");
        if (expiresIn.canConvertToLong() && expiresIn.asLong() > 0) {
            lifetime = Duration.ofSeconds(expiresIn.asLong());
        } else if (expiresIn.isTextual() && isPositiveNumber(expiresIn.asText())) {
            lifetime = Duration.ofSeconds(Long.parseLong(expiresIn.asText().trim()));
        } else {
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[tokenkeeper] token response has no usable expires_in, assuming a lifetime of %ss",
                defaultLifetime.toSeconds()));
        }

        Instant expiresAt;
        try {
            // schedules are computed in millis
            lifetime.toMillis();
            expiresAt = receivedAt.plus(lifetime);
            expiresAt.toEpochMilli();
        } catch (DateTimeException | ArithmeticException ex) {
            throw EndpointFailure.malformed("token response expires_in out of range: " + lifetime.toSeconds() + "s", ex);
        }

        Set<String> granted = Json.scopes(node, "scope");
        return new AccessToken(accessToken, receivedAt, expiresAt, granted == null ? requested : granted);
    }

    private static boolean isPositiveNumber(String value) {
        try {
            return Long.parseLong(value.trim()) > 0;
        } catch (NumberFormatException ex) {
            return false;
        }
    }
}
