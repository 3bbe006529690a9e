package ai.scripture.translator.testing;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Loopback HTTP server that records every request and answers through a scripted handler.
 */
public final class StubHttpServer implements AutoCloseable {

    private final HttpServer server;
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private volatile Function<RecordedRequest, StubResponse> responder = request -> StubResponse.of(200, "");
    private boolean closed;

    private StubHttpServer(HttpServer server) {
        this.server = server;
    }

    public static StubHttpServer start() throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        StubHttpServer stub = new StubHttpServer(server);
        server.createContext("/", stub::handle);
        server.start();
        return stub;
    }

    public StubHttpServer respondWith(Function<RecordedRequest, StubResponse> responder) {
        this.responder = responder;
        return this;
    }

    public URI baseUri() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    public List<RecordedRequest> requests() {
        return requests;
    }

    public RecordedRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    @Override
    public synchronized void close() {
        if (!closed) {
            closed = true;
            server.stop(0);
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        RecordedRequest request = new RecordedRequest(exchange.getRequestMethod(),
                exchange.getRequestURI().getPath(),
                exchange.getRequestURI().getRawQuery(),
                exchange.getRequestHeaders().getFirst("apikey"),
                exchange.getRequestHeaders().getFirst("Authorization"),
                exchange.getRequestHeaders().getFirst("Prefer"),
                exchange.getRequestHeaders().getFirst("Content-Type"),
                body);
        requests.add(request);
        StubResponse response = responder.apply(request);
        response.headers().forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
        byte[] payload = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(response.status(), payload.length == 0 ? -1 : payload.length);
        if (payload.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(payload);
            }
        }
        exchange.close();
    }

    public record RecordedRequest(String method, String path, String rawQuery, String apiKey, String authorization,
                                  String prefer, String contentType, String body) {

        public String query() {
            return rawQuery == null ? "" : rawQuery;
        }
    }

    public record StubResponse(int status, String body, Map<String, String> headers) {

        public static StubResponse of(int status, String body) {
            return new StubResponse(status, body, Map.of());
        }

        public static StubResponse of(int status, String body, Map<String, String> headers) {
            return new StubResponse(status, body, headers);
        }
    }
}
