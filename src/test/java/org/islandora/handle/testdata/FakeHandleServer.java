package org.islandora.handle.testdata;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * Minimal Handle administration service on a local port. Handles are kept in memory, keyed by
 * `prefix/pid`, and map to their target URL.
 */
public class FakeHandleServer {
    public static final String CONTEXT = "/handle-service";
    private final HttpServer server;
    public final Map<String, String> handles = new ConcurrentHashMap<>();
    public volatile String lastAuthorization;
    public volatile String lastRequestPath;
    // When set, every request is answered with this code and body
    public volatile int forcedCode = 0;
    public volatile String forcedBody = "";
    private boolean stopped = false;

    public FakeHandleServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext(CONTEXT, this::handle);
    }

    public void start() {
        server.start();
    }

    public void stop() {
        if (!stopped) {
            stopped = true;
            server.stop(0);
        }
    }

    public String getServiceUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + CONTEXT;
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastAuthorization = exchange.getRequestHeaders().getFirst("Authorization");
        String path = exchange.getRequestURI().getPath();
        lastRequestPath = path;
        String handle = path.substring(CONTEXT.length() + 1);
        String body;
        try (InputStream requestBody = exchange.getRequestBody()) {
            body = new String(requestBody.readAllBytes(), StandardCharsets.UTF_8);
        }

        if (forcedCode != 0) {
            respond(exchange, forcedCode, forcedBody);
            return;
        }
        switch (exchange.getRequestMethod()) {
            case "GET":
                if (handles.containsKey(handle)) {
                    respond(exchange, 200, handles.get(handle));
                } else {
                    respond(exchange, 404, "");
                }
                break;
            case "PUT":
                if (handles.containsKey(handle)) {
                    respond(exchange, 409, "Handle already exists");
                } else {
                    String target = URLDecoder.decode(
                        body.substring("target=".length()), StandardCharsets.UTF_8);
                    handles.put(handle, target);
                    respond(exchange, 201, "");
                }
                break;
            case "DELETE":
                if (handles.remove(handle) != null) {
                    respond(exchange, 204, null);
                } else {
                    respond(exchange, 500, "Handle not found");
                }
                break;
            default:
                respond(exchange, 405, "");
        }
    }

    private static void respond(HttpExchange exchange, int code, String body) throws IOException {
        if (body == null || body.isEmpty()) {
            exchange.sendResponseHeaders(code, -1);
            exchange.close();
            return;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(bytes);
        }
    }
}
