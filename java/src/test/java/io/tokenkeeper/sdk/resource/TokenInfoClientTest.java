package io.tokenkeeper.sdk.resource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.tokenkeeper.sdk.Config;
import io.tokenkeeper.sdk.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TokenInfoClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private URI baseUri;
    private final MutableClock clock = MutableClock.atEpoch();
    private final AtomicInteger primaryRequests = new AtomicInteger();
    private final AtomicInteger secondaryRequests = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void introspectsAndCachesUntilTokenExpiry() throws Exception {
        AtomicReference<String> query = new AtomicReference<>();
        server.createContext("/info", exchange -> {
            primaryRequests.incrementAndGet();
            query.set(exchange.getRequestURI().getQuery());
            respond(exchange, 200, tokenInfo("robot", 30));
        });
        TokenInfoClient client = client(url("/info"));

        IntrospectionResult result = client.introspect("my-token");

        assertEquals("access_token=my-token", query.get());
        assertEquals("robot", result.getSubject());
        assertEquals(Set.of("uid", "cn"), result.getScopes());
        assertEquals("/services", result.getRealm());
        assertEquals(clock.instant().plusSeconds(30), result.getExpiresAt());
        assertEquals("robot", result.getRawClaims().get("uid"));
        assertEquals(1, primaryRequests.get());

        clock.advance(Duration.ofSeconds(29));
        client.introspect("my-token");
        assertEquals(1, primaryRequests.get());

        clock.advance(Duration.ofSeconds(1));
        client.introspect("my-token");
        assertEquals(2, primaryRequests.get());
    }

    @Test
    void fallbackResultIsCachedUnderRequestedToken() throws Exception {
        server.createContext("/primary", exchange -> {
            primaryRequests.incrementAndGet();
            respond(exchange, 503, Map.of("error", "unavailable"));
        });
        server.createContext("/secondary", exchange -> {
            secondaryRequests.incrementAndGet();
            respond(exchange, 200, tokenInfo("robot", 60));
        });
        TokenInfoClient client = client(url("/primary"), url("/secondary"));

        assertEquals("robot", client.introspect("my-token").getSubject());
        assertEquals("robot", client.introspect("my-token").getSubject());

        assertEquals(1, primaryRequests.get());
        assertEquals(1, secondaryRequests.get());
        assertEquals(1, client.cachedEntries());
    }

    @Test
    void rejectedTokenIsInvalidAndNotRetriedElsewhere() {
        server.createContext("/primary", exchange -> {
            primaryRequests.incrementAndGet();
            respond(exchange, 401, Map.of("error", "invalid_token"));
        });
        server.createContext("/secondary", exchange -> {
            secondaryRequests.incrementAndGet();
            respond(exchange, 200, tokenInfo("robot", 60));
        });

        IntrospectionException ex = assertThrows(IntrospectionException.class,
            () -> client(url("/primary"), url("/secondary")).introspect("bad-token"));

        assertEquals(IntrospectionException.Kind.INVALID, ex.getKind());
        assertEquals(401, ex.getStatusCode());
        assertEquals(0, secondaryRequests.get());
    }

    @Test
    void unreachableServiceIsUnavailableNotInvalid() throws Exception {
        server.createContext("/primary", exchange -> {
            primaryRequests.incrementAndGet();
            respond(exchange, 500, Map.of("error", "server_error"));
        });
        server.createContext("/secondary", exchange -> {
            secondaryRequests.incrementAndGet();
            respond(exchange, 429, Map.of("error", "slow_down"));
        });
        TokenInfoClient client = client(url("/primary"), url("/secondary"));

        IntrospectionException ex = assertThrows(IntrospectionException.class, () -> client.introspect("tok"));
        assertEquals(IntrospectionException.Kind.UNAVAILABLE, ex.getKind());

        assertThrows(IntrospectionException.class, () -> client.introspect("tok"));
        assertEquals(2, primaryRequests.get());
        assertEquals(2, secondaryRequests.get());
    }

    @Test
    void malformedBodiesEverywhereAreReportedAsSuch() {
        server.createContext("/primary", exchange -> respondRaw(exchange, 200, "<html>oops</html>"));
        server.createContext("/secondary", exchange -> respond(exchange, 200, Map.of("scope", "uid")));

        IntrospectionException ex = assertThrows(IntrospectionException.class,
            () -> client(url("/primary"), url("/secondary")).introspect("tok"));

        assertEquals(IntrospectionException.Kind.RESPONSE_MALFORMED, ex.getKind());
    }

    @Test
    void inactiveTokenIsInvalid() {
        server.createContext("/info", exchange -> respond(exchange, 200, Map.of("active", false)));

        IntrospectionException ex = assertThrows(IntrospectionException.class,
            () -> client(url("/info")).introspect("tok"));

        assertEquals(IntrospectionException.Kind.INVALID, ex.getKind());
    }

    @Test
    void blankTokenIsInvalidWithoutRequest() {
        server.createContext("/info", exchange -> {
            primaryRequests.incrementAndGet();
            respond(exchange, 200, tokenInfo("robot", 60));
        });

        IntrospectionException ex = assertThrows(IntrospectionException.class,
            () -> client(url("/info")).introspect("  "));

        assertEquals(IntrospectionException.Kind.INVALID, ex.getKind());
        assertEquals(0, primaryRequests.get());
    }

    @Test
    void readsAbsoluteExpiryAndStandardSubject() throws Exception {
        long exp = clock.instant().plusSeconds(120).getEpochSecond();
        server.createContext("/info", exchange -> respond(exchange, 200,
            Map.of("active", true, "sub", "user-1", "scope", "read write", "exp", exp)));

        IntrospectionResult result = client(url("/info")).introspect("tok");

        assertEquals("user-1", result.getSubject());
        assertEquals(Set.of("read", "write"), result.getScopes());
        assertEquals(clock.instant().plusSeconds(120), result.getExpiresAt());
        assertNull(result.getRealm());
    }

    @Test
    void pastAbsoluteExpiryIsInvalid() {
        long exp = clock.instant().minusSeconds(5).getEpochSecond();
        server.createContext("/primary", exchange -> {
            primaryRequests.incrementAndGet();
            respond(exchange, 200, Map.of("sub", "user-1", "exp", exp));
        });
        server.createContext("/secondary", exchange -> {
            secondaryRequests.incrementAndGet();
            respond(exchange, 200, tokenInfo("robot", 60));
        });
        TokenInfoClient client = client(url("/primary"), url("/secondary"));

        IntrospectionException ex = assertThrows(IntrospectionException.class, () -> client.introspect("tok"));

        assertEquals(IntrospectionException.Kind.INVALID, ex.getKind());
        assertEquals(0, secondaryRequests.get());
        assertEquals(0, client.cachedEntries());
    }

    @Test
    void outOfRangeExpiryIsMalformed() {
        server.createContext("/primary", exchange -> respond(exchange, 200,
            Map.of("uid", "robot", "expires_in", 99999999999999999L)));
        server.createContext("/secondary", exchange -> respond(exchange, 200,
            Map.of("uid", "robot", "exp", Long.MAX_VALUE)));

        IntrospectionException ex = assertThrows(IntrospectionException.class,
            () -> client(url("/primary"), url("/secondary")).introspect("tok"));

        assertEquals(IntrospectionException.Kind.RESPONSE_MALFORMED, ex.getKind());
    }

    @Test
    void resultWithoutExpiryIsNotCached() throws Exception {
        server.createContext("/info", exchange -> {
            primaryRequests.incrementAndGet();
            respond(exchange, 200, Map.of("uid", "robot", "scope", List.of("uid")));
        });
        TokenInfoClient client = client(url("/info"));

        IntrospectionResult result = client.introspect("tok");
        client.introspect("tok");

        assertNull(result.getExpiresAt());
        assertEquals(2, primaryRequests.get());
        assertEquals(0, client.cachedEntries());
    }

    @Test
    void tokensAreUrlEncodedInQuery() throws Exception {
        AtomicReference<String> rawQuery = new AtomicReference<>();
        server.createContext("/info", exchange -> {
            rawQuery.set(exchange.getRequestURI().getRawQuery());
            respond(exchange, 200, tokenInfo("robot", 60));
        });
        TokenInfoClient client = new TokenInfoClient(HttpClient.newHttpClient(), List.of(url("/info")), "token",
            100, Duration.ofSeconds(5), clock);

        client.introspect("a+b/c=");

        assertEquals("token=a%2Bb%2Fc%3D", rawQuery.get());
        assertFalse(client.endpointUrls().get(0).contains("a%2Bb"));
    }

    @Test
    void createsFromConfig() throws Exception {
        server.createContext("/oauth2/tokeninfo", exchange -> {
            primaryRequests.incrementAndGet();
            respond(exchange, 200, tokenInfo("robot", 60));
        });
        Config config = Config.builder()
            .tokenInfoUrl(url("/oauth2/tokeninfo") + "/")
            .httpTimeout(Duration.ofSeconds(5))
            .build();

        TokenInfoClient client = TokenInfoClient.create(config);

        assertEquals(List.of(url("/oauth2/tokeninfo")), client.endpointUrls());
        assertEquals("robot", client.introspect("tok").getSubject());
        assertEquals(1, primaryRequests.get());
    }

    private TokenInfoClient client(String... urls) {
        return new TokenInfoClient(HttpClient.newHttpClient(), Arrays.asList(urls), null, 100,
            Duration.ofSeconds(5), clock);
    }

    private String url(String path) {
        return baseUri.resolve(path).toString();
    }

    private static Map<String, Object> tokenInfo(String uid, int expiresIn) {
        Map<String, Object> body = new HashMap<>();
        body.put("uid", uid);
        body.put("scope", List.of("uid", "cn"));
        body.put("realm", "/services");
        body.put("expires_in", expiresIn);
        body.put("token_type", "Bearer");
        return body;
    }

    private static void respond(HttpExchange exchange, int status, Map<String, ?> body) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
    }

    private static void respondRaw(HttpExchange exchange, int status, String body) throws IOException {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
    }
}
