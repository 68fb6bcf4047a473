package io.tokenkeeper.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration shared by the client role (token lifecycle management) and the resource-server role
 * (token introspection). Only the options of the role in use need to be set; each component checks for the ones it
 * requires when it is constructed.
 */
public final class Config {

    public static final String DEFAULT_TOKEN_INFO_QUERY_PARAMETER = "access_token";
    public static final String DEFAULT_CLIENT_CREDENTIALS_FILE_NAME = "client.json";
    public static final double DEFAULT_REFRESH_FACTOR = 0.6;
    public static final double DEFAULT_WARNING_FACTOR = 0.8;
    public static final Duration DEFAULT_TOKEN_LIFETIME = Duration.ofSeconds(60);
    public static final Duration DEFAULT_RETRY_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_RETRY_MAX_DELAY = Duration.ofSeconds(60);
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final long DEFAULT_INTROSPECTION_CACHE_SIZE = 10_000L;

    private final String tokenProviderUrl;
    private final List<String> fallbackTokenProviderUrls;
    private final String tokenProviderRealm;
    private final String tokenInfoUrl;
    private final List<String> fallbackTokenInfoUrls;
    private final String tokenInfoQueryParameter;
    private final Path credentialsDir;
    private final String clientCredentialsFileName;
    private final String userCredentialsFileName;
    private final Double refreshFactor;
    private final Double warningFactor;
    private final Duration defaultTokenLifetime;
    private final Duration retryInitialDelay;
    private final Duration retryMaxDelay;
    private final Long introspectionCacheSize;
    private final HttpClient httpClient;
    private final Duration httpTimeout;

    private Config(Builder builder) {
        this.tokenProviderUrl = builder.tokenProviderUrl;
        this.fallbackTokenProviderUrls = builder.fallbackTokenProviderUrls == null
            ? null : new ArrayList<>(builder.fallbackTokenProviderUrls);
        this.tokenProviderRealm = builder.tokenProviderRealm;
        this.tokenInfoUrl = builder.tokenInfoUrl;
        this.fallbackTokenInfoUrls = builder.fallbackTokenInfoUrls == null
            ? null : new ArrayList<>(builder.fallbackTokenInfoUrls);
        this.tokenInfoQueryParameter = builder.tokenInfoQueryParameter;
        this.credentialsDir = builder.credentialsDir;
        this.clientCredentialsFileName = builder.clientCredentialsFileName;
        this.userCredentialsFileName = builder.userCredentialsFileName;
        this.refreshFactor = builder.refreshFactor;
        this.warningFactor = builder.warningFactor;
        this.defaultTokenLifetime = builder.defaultTokenLifetime;
        this.retryInitialDelay = builder.retryInitialDelay;
        this.retryMaxDelay = builder.retryMaxDelay;
        this.introspectionCacheSize = builder.introspectionCacheSize;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedProviderUrl = tokenProviderUrl == null ? null : sanitizeUrl(tokenProviderUrl);
        String resolvedTokenInfoUrl = tokenInfoUrl == null ? null : sanitizeUrl(tokenInfoUrl);
        List<String> resolvedProviderFallbacks = sanitizeUrls(fallbackTokenProviderUrls);
        List<String> resolvedTokenInfoFallbacks = sanitizeUrls(fallbackTokenInfoUrls);

        if (resolvedProviderUrl == null && !resolvedProviderFallbacks.isEmpty()) {
            throw new IllegalArgumentException("FallbackTokenProviderUrls require a TokenProviderUrl");
        }
        if (resolvedTokenInfoUrl == null && !resolvedTokenInfoFallbacks.isEmpty()) {
            throw new IllegalArgumentException("FallbackTokenInfoUrls require a TokenInfoUrl");
        }

        String queryParameter = trimToNull(tokenInfoQueryParameter);
        if (queryParameter == null) {
            queryParameter = DEFAULT_TOKEN_INFO_QUERY_PARAMETER;
        }

        String clientFile = Optional.ofNullable(trimToNull(clientCredentialsFileName))
            .orElse(DEFAULT_CLIENT_CREDENTIALS_FILE_NAME);

        double resolvedRefresh = Optional.ofNullable(refreshFactor).orElse(DEFAULT_REFRESH_FACTOR);
        double resolvedWarning = Optional.ofNullable(warningFactor).orElse(DEFAULT_WARNING_FACTOR);
        if (!(resolvedRefresh > 0.0 && resolvedRefresh < resolvedWarning && resolvedWarning < 1.0)) {
            throw new IllegalArgumentException("factors must satisfy 0 < RefreshFactor < WarningFactor < 1, got "
                + resolvedRefresh + " and " + resolvedWarning);
        }

        Duration resolvedLifetime = positiveOrDefault(defaultTokenLifetime, DEFAULT_TOKEN_LIFETIME);
        Duration resolvedInitialDelay = positiveOrDefault(retryInitialDelay, DEFAULT_RETRY_INITIAL_DELAY);
        Duration resolvedMaxDelay = positiveOrDefault(retryMaxDelay, DEFAULT_RETRY_MAX_DELAY);
        if (resolvedMaxDelay.compareTo(resolvedInitialDelay) < 0) {
            throw new IllegalArgumentException("RetryMaxDelay cannot be shorter than RetryInitialDelay");
        }

        long resolvedCacheSize = Optional.ofNullable(introspectionCacheSize).orElse(DEFAULT_INTROSPECTION_CACHE_SIZE);
        if (resolvedCacheSize <= 0) {
            throw new IllegalArgumentException("IntrospectionCacheSize must be positive");
        }

        Duration resolvedTimeout = positiveOrDefault(httpTimeout, DEFAULT_HTTP_TIMEOUT);

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .tokenProviderUrl(resolvedProviderUrl)
            .fallbackTokenProviderUrls(resolvedProviderFallbacks)
            .tokenProviderRealm(trimToNull(tokenProviderRealm))
            .tokenInfoUrl(resolvedTokenInfoUrl)
            .fallbackTokenInfoUrls(resolvedTokenInfoFallbacks)
            .tokenInfoQueryParameter(queryParameter)
            .credentialsDir(credentialsDir)
            .clientCredentialsFileName(clientFile)
            .userCredentialsFileName(trimToNull(userCredentialsFileName))
            .refreshFactor(resolvedRefresh)
            .warningFactor(resolvedWarning)
            .defaultTokenLifetime(resolvedLifetime)
            .retryInitialDelay(resolvedInitialDelay)
            .retryMaxDelay(resolvedMaxDelay)
            .introspectionCacheSize(resolvedCacheSize)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .buildInternal();
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback) {
        if (value == null || value.isZero() || value.isNegative()) {
            return fallback;
        }
        return value;
    }

    private static List<String> sanitizeUrls(List<String> urls) {
        if (urls == null) {
            return Collections.emptyList();
        }
        return urls.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(Config::sanitizeUrl)
            .distinct()
            .toList();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getTokenProviderUrl() {
        return tokenProviderUrl;
    }

    public List<String> getFallbackTokenProviderUrls() {
        return fallbackTokenProviderUrls == null
            ? Collections.emptyList() : Collections.unmodifiableList(fallbackTokenProviderUrls);
    }

    /**
     * @return the provider URL followed by its fallbacks, in the order they are tried.
     */
    public List<String> getTokenProviderUrls() {
        List<String> urls = new ArrayList<>();
        if (tokenProviderUrl != null) {
            urls.add(tokenProviderUrl);
        }
        urls.addAll(getFallbackTokenProviderUrls());
        return Collections.unmodifiableList(urls);
    }

    public String getTokenProviderRealm() {
        return tokenProviderRealm;
    }

    public String getTokenInfoUrl() {
        return tokenInfoUrl;
    }

    public List<String> getFallbackTokenInfoUrls() {
        return fallbackTokenInfoUrls == null
            ? Collections.emptyList() : Collections.unmodifiableList(fallbackTokenInfoUrls);
    }

    /**
     * @return the token-info URL followed by its fallbacks, in the order they are tried.
     */
    public List<String> getTokenInfoUrls() {
        List<String> urls = new ArrayList<>();
        if (tokenInfoUrl != null) {
            urls.add(tokenInfoUrl);
        }
        urls.addAll(getFallbackTokenInfoUrls());
        return Collections.unmodifiableList(urls);
    }

    public String getTokenInfoQueryParameter() {
        return tokenInfoQueryParameter;
    }

    public Path getCredentialsDir() {
        return credentialsDir;
    }

    public String getClientCredentialsFileName() {
        return clientCredentialsFileName;
    }

    public String getUserCredentialsFileName() {
        return userCredentialsFileName;
    }

    public double getRefreshFactor() {
        return refreshFactor;
    }

    public double getWarningFactor() {
        return warningFactor;
    }

    public Duration getDefaultTokenLifetime() {
        return defaultTokenLifetime;
    }

    public Duration getRetryInitialDelay() {
        return retryInitialDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    public long getIntrospectionCacheSize() {
        return introspectionCacheSize;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public static final class Builder {
        private String tokenProviderUrl;
        private List<String> fallbackTokenProviderUrls;
        private String tokenProviderRealm;
        private String tokenInfoUrl;
        private List<String> fallbackTokenInfoUrls;
        private String tokenInfoQueryParameter;
        private Path credentialsDir;
        private String clientCredentialsFileName;
        private String userCredentialsFileName;
        private Double refreshFactor;
        private Double warningFactor;
        private Duration defaultTokenLifetime;
        private Duration retryInitialDelay;
        private Duration retryMaxDelay;
        private Long introspectionCacheSize;
        private HttpClient httpClient;
        private Duration httpTimeout;

        public Builder tokenProviderUrl(String tokenProviderUrl) {
            this.tokenProviderUrl = tokenProviderUrl;
            return this;
        }

        public Builder fallbackTokenProviderUrls(List<String> fallbackTokenProviderUrls) {
            this.fallbackTokenProviderUrls = fallbackTokenProviderUrls == null
                ? null : new ArrayList<>(fallbackTokenProviderUrls);
            return this;
        }

        public Builder fallbackTokenProviderUrl(String fallbackTokenProviderUrl) {
            return fallbackTokenProviderUrls(fallbackTokenProviderUrl == null ? null : List.of(fallbackTokenProviderUrl));
        }

        public Builder tokenProviderRealm(String tokenProviderRealm) {
            this.tokenProviderRealm = tokenProviderRealm;
            return this;
        }

        public Builder tokenInfoUrl(String tokenInfoUrl) {
            this.tokenInfoUrl = tokenInfoUrl;
            return this;
        }

        public Builder fallbackTokenInfoUrls(List<String> fallbackTokenInfoUrls) {
            this.fallbackTokenInfoUrls = fallbackTokenInfoUrls == null ? null : new ArrayList<>(fallbackTokenInfoUrls);
            return this;
        }

        public Builder fallbackTokenInfoUrl(String fallbackTokenInfoUrl) {
            return fallbackTokenInfoUrls(fallbackTokenInfoUrl == null ? null : List.of(fallbackTokenInfoUrl));
        }

        public Builder tokenInfoQueryParameter(String tokenInfoQueryParameter) {
            this.tokenInfoQueryParameter = tokenInfoQueryParameter;
            return this;
        }

        public Builder credentialsDir(Path credentialsDir) {
            this.credentialsDir = credentialsDir;
            return this;
        }

        public Builder clientCredentialsFileName(String clientCredentialsFileName) {
            this.clientCredentialsFileName = clientCredentialsFileName;
            return this;
        }

        public Builder userCredentialsFileName(String userCredentialsFileName) {
            this.userCredentialsFileName = userCredentialsFileName;
            return this;
        }

        public Builder refreshFactor(double refreshFactor) {
            this.refreshFactor = refreshFactor;
            return this;
        }

        public Builder warningFactor(double warningFactor) {
            this.warningFactor = warningFactor;
            return this;
        }

        public Builder defaultTokenLifetime(Duration defaultTokenLifetime) {
            this.defaultTokenLifetime = defaultTokenLifetime;
            return this;
        }

        public Builder retryInitialDelay(Duration retryInitialDelay) {
            this.retryInitialDelay = retryInitialDelay;
            return this;
        }

        public Builder retryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = retryMaxDelay;
            return this;
        }

        public Builder introspectionCacheSize(long introspectionCacheSize) {
            this.introspectionCacheSize = introspectionCacheSize;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
