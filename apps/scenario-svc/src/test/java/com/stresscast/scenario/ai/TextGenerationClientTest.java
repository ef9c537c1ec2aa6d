package com.stresscast.scenario.ai;

import static org.assertj.core.api.Assertions.assertThat;

import com.stresscast.scenario.config.StresscastProperties;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/**
 * Exercises the Responses API mapping against an embedded HttpServer.
 */
class TextGenerationClientTest {

    static HttpServer server;
    static int port;
    static final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    static final AtomicReference<String> lastBody = new AtomicReference<>();

    @BeforeAll
    static void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        port = server.getAddress().getPort();
        server.createContext("/v1/responses", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String json = """
                    {"id": "resp_1", "output": [{"type": "message", "content": [{"type": "output_text", "text": "Stress is manageable."}]}]}
                    """;
            byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
        });
        server.createContext("/v1/broken", exchange -> {
            byte[] bytes = "{\"error\":\"overloaded\"}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(503, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
        });
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();
    }

    @AfterAll
    static void stop() {
        server.stop(0);
    }

    private TextGenerationClient newClient(String path, String apiKey) {
        StresscastProperties props = new StresscastProperties("memory", null,
                new StresscastProperties.Ai("http://localhost:" + port + path, "test-model", apiKey, 2_000));
        return new TextGenerationClient(props);
    }

    @Test
    void extractsOutputText() {
        TextGenerationClient client = newClient("/v1/responses", "sk-test");

        var text = client.generateText(List.of(new TextGenerationClient.Message("user", "hello")), 200);

        assertThat(text).contains("Stress is manageable.");
        assertThat(lastAuthorization.get()).isEqualTo("Bearer sk-test");
        assertThat(lastBody.get()).contains("\"model\":\"test-model\"").contains("\"max_output_tokens\":200");
    }

    @Test
    void upstreamErrorYieldsEmpty() {
        TextGenerationClient client = newClient("/v1/broken", "sk-test");

        assertThat(client.generateText(List.of(new TextGenerationClient.Message("user", "hello")), null)).isEmpty();
    }

    @Test
    void missingKeySkipsCall() {
        TextGenerationClient client = newClient("/v1/responses", null);

        assertThat(client.hasCredentials()).isFalse();
        assertThat(client.generateText(List.of(new TextGenerationClient.Message("user", "hello")), null)).isEmpty();
    }
}
