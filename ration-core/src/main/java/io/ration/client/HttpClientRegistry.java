package io.ration.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ration.error.ClientRegistryUnavailableException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/** Looks clients up with {@code GET {base}/client/{id}}. */
public class HttpClientRegistry implements ClientRegistry {
    private final HttpClient client;
    private final URI base;
    private final Duration timeout;
    private final ObjectMapper json;

    public HttpClientRegistry(HttpClient client, URI base, Duration timeout, ObjectMapper json) {
        this.client = client;
        this.base = base;
        this.timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
        this.json = json;
    }

    @Override
    public ClientInfo getClientInfo(String clientId) throws ClientRegistryUnavailableException {
        URI uri = base.resolve("/client/" + URLEncoder.encode(clientId, StandardCharsets.UTF_8));
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("X-Worker-ID", "resource-manager")
                .GET()
                .build();
        try {
            HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                throw new ClientRegistryUnavailableException("Registry returned " + resp.statusCode() + " for " + clientId);
            }
            ClientInfo info = json.readValue(resp.body(), ClientInfo.class);
            return info.clientId() == null ? new ClientInfo(clientId, info.tier(), info.monthlyBudgetUsd()) : info;
        } catch (IOException e) {
            throw new ClientRegistryUnavailableException("Registry unreachable for " + clientId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientRegistryUnavailableException("Interrupted looking up " + clientId, e);
        }
    }
}
