package io.ration.client;

import com.sun.net.httpserver.HttpServer;
import io.ration.core.ClientTier;
import io.ration.error.ClientRegistryUnavailableException;
import io.ration.executor.Outbound;
import io.ration.store.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class HttpClientRegistryTest {
    HttpServer server;
    HttpClientRegistry registry;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/client", exchange -> {
            String id = exchange.getRequestURI().getPath().substring("/client/".length());
            String body;
            int status = 200;
            switch (id) {
                case "acme":
                    body = "{\"id\":\"acme\",\"subscription_tier\":\"enterprise\",\"monthly_budget\":2500}";
                    break;
                case "bare":
                    body = "{}";
                    break;
                default:
                    status = 404;
                    body = "{\"error\":\"not found\"}";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        URI base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
        registry = new HttpClientRegistry(Outbound.client(), base, Duration.ofSeconds(2), Json.mapper());
    }

    @AfterEach
    void stopServer() { server.stop(0); }

    @Test
    void reads_tier_and_budget_from_registry_fields() throws Exception {
        ClientInfo info = registry.getClientInfo("acme");

        assertEquals("acme", info.clientId());
        assertEquals(ClientTier.ENTERPRISE, info.tier());
        assertEquals(2500.0, info.monthlyBudgetUsd(), 1e-9);
    }

    @Test
    void missing_fields_take_defaults() throws Exception {
        ClientInfo info = registry.getClientInfo("bare");

        assertEquals("bare", info.clientId());
        assertEquals(ClientTier.STANDARD, info.tier());
        assertEquals(ClientInfo.DEFAULT_MONTHLY_BUDGET, info.monthlyBudgetUsd(), 1e-9);
    }

    @Test
    void non_200_is_unavailable() {
        assertThrows(ClientRegistryUnavailableException.class, () -> registry.getClientInfo("ghost"));
    }

    @Test
    void unreachable_registry_is_unavailable() {
        HttpClientRegistry nowhere = new HttpClientRegistry(Outbound.client(), URI.create("http://127.0.0.1:1"),
                Duration.ofSeconds(1), Json.mapper());

        assertThrows(ClientRegistryUnavailableException.class, () -> nowhere.getClientInfo("acme"));
    }
}
