package com.spotifydump.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JdkHttpTransportTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastContentType = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", ex -> {
            hits.incrementAndGet();
            lastAuth.set(ex.getRequestHeaders().getFirst("Authorization"));
            ex.getResponseHeaders().set("X-Test", "yes");
            respond(ex, 200, "{\"ok\":true}");
        });
        server.createContext("/unavailable", ex -> {
            hits.incrementAndGet();
            ex.getResponseHeaders().set("Retry-After", "3");
            respond(ex, 503, "{\"error\":\"down\"}");
        });
        server.createContext("/form", ex -> {
            lastContentType.set(ex.getRequestHeaders().getFirst("Content-Type"));
            lastBody.set(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(ex, 200, "{}");
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void getReturnsStatusHeadersAndBody() throws Exception {
        JdkHttpTransport transport = new JdkHttpTransport();

        ApiResponse resp = transport.execute(ApiRequest.get(baseUrl + "/ok", Map.of("Authorization", "Bearer abc")));

        assertEquals(200, resp.statusCode());
        assertEquals("{\"ok\":true}", resp.body());
        assertEquals("yes", resp.header("x-test").orElse(null));
        assertEquals("Bearer abc", lastAuth.get());
    }

    @Test
    void errorStatusIsReturnedUninterpretedWithSingleCall() throws Exception {
        ApiResponse resp = new JdkHttpTransport().execute(ApiRequest.get(baseUrl + "/unavailable", Map.of()));

        assertEquals(503, resp.statusCode());
        assertFalse(resp.isSuccessful());
        assertEquals("3", resp.header("Retry-After").orElse(null));
        assertEquals(1, hits.get());
    }

    @Test
    void postEncodesFormBody() throws Exception {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("redirect_uri", "http://127.0.0.1:8888/callback");

        ApiResponse resp = new JdkHttpTransport().execute(ApiRequest.postForm(baseUrl + "/form", Map.of(), form));

        assertEquals(200, resp.statusCode());
        assertEquals("application/x-www-form-urlencoded", lastContentType.get());
        assertEquals("grant_type=authorization_code&redirect_uri=http%3A%2F%2F127.0.0.1%3A8888%2Fcallback", lastBody.get());
    }

    @Test
    void connectionFailureSurfacesAsIOException() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        JdkHttpTransport transport = new JdkHttpTransport();

        assertThrows(IOException.class,
                () -> transport.execute(ApiRequest.get("http://127.0.0.1:" + closedPort + "/ok", Map.of())));
    }

    @Test
    void requestDefaultsToGet() {
        ApiRequest req = new ApiRequest(null, java.net.URI.create(baseUrl), null, null);
        assertEquals("GET", req.method());
        assertTrue(req.headers().isEmpty());
    }

    private static void respond(HttpExchange ex, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        ex.sendResponseHeaders(code, bytes.length);
        try (var os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }
}
