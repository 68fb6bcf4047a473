package io.tokenkeeper.sdk.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.tokenkeeper.sdk.Config;
import io.tokenkeeper.sdk.credentials.StaticCredentialStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TokenLifecycleManagerHttpTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private String tokenUrl;
    private final AtomicInteger requests = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/oauth2/token", exchange -> {
            int n = requests.incrementAndGet();
            byte[] payload = MAPPER.writeValueAsBytes(Map.of("access_token", "token-" + n, "expires_in", 3600));
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
        });
        server.start();
        tokenUrl = "http://localhost:" + server.getAddress().getPort() + "/oauth2/token";
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void warmsUpSlotsOnItsOwnScheduler() throws Exception {
        Config config = Config.builder()
            .tokenProviderUrl(tokenUrl)
            .httpTimeout(Duration.ofSeconds(5))
            .build();

        try (TokenLifecycleManager manager = TokenLifecycleManager.create(config,
            new StaticCredentialStore("client", "secret"))) {
            manager.registerSlot("service", Set.of("uid"));

            await().atMost(Duration.ofSeconds(5)).until(() -> manager.state("service") == SlotState.VALID);
            assertEquals("token-1", manager.getToken("service").getValue());
            assertEquals(1, requests.get());

            manager.shutdown();
            assertThrows(IllegalStateException.class, () -> manager.registerSlot("other", Set.of()));
            assertEquals("token-1", manager.getToken("service").getValue());
        }
    }
}
