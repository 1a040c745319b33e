package com.clusterops.atlas;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

// canned Atlas answers keyed by "METHOD path", records what it was sent
class StubAtlasServer implements AutoCloseable {
    static final String BASE = "/api/atlas/v1.0";

    static class Recorded {
        final String method;
        final String path;
        final String body;
        final String authorization;

        Recorded(String method, String path, String body, String authorization) {
            this.method = method;
            this.path = path;
            this.body = body;
            this.authorization = authorization;
        }
    }

    private final HttpServer server;
    private boolean stopped;
    private final Map<String, String[]> responses = new ConcurrentHashMap<>();
    final List<Recorded> requests = new CopyOnWriteArrayList<>();

    StubAtlasServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + BASE;
    }

    void respond(String method, String path, int status, String body) {
        responses.put(method + " " + BASE + path, new String[]{String.valueOf(status), body});
    }

    Recorded last() {
        return requests.get(requests.size() - 1);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body;
        try (InputStream in = exchange.getRequestBody()) {
            body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getRawPath();
        requests.add(new Recorded(method, path, body, exchange.getRequestHeaders().getFirst("Authorization")));
        String[] canned = responses.get(method + " " + path);
        int status = canned == null ? 500 : Integer.parseInt(canned[0]);
        byte[] out = (canned == null ? "no stub for " + method + " " + path : canned[1]).getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, out.length == 0 ? -1 : out.length);
        if (out.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
        }
        exchange.close();
    }

    @Override
    public synchronized void close() {
        if (stopped) {
            return;
        }
        stopped = true;
        server.stop(0);
    }
}
