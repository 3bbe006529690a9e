package ai.scripture.translator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChunkStore} backed by a Supabase table through its PostgREST endpoint.
 */
public class SupabaseChunkStore implements ChunkStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(SupabaseChunkStore.class);
    private static final int PAGE_SIZE = 1000;
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI tableEndpoint;
    private final String apiKey;
    private final String translationColumn;

    public SupabaseChunkStore(URI baseUrl, String apiKey, String table, String translationColumn) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(20)).build(), new ObjectMapper(),
                baseUrl, apiKey, table, translationColumn);
    }

    public SupabaseChunkStore(HttpClient httpClient, ObjectMapper objectMapper, URI baseUrl, String apiKey,
                              String table, String translationColumn) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        String safeTable = ChunkTableSchema.requireIdentifier(table, "table");
        this.translationColumn = ChunkTableSchema.requireIdentifier(translationColumn, "translationColumn");
        String root = baseUrl.toString();
        while (root.endsWith("/")) {
            root = root.substring(0, root.length() - 1);
        }
        this.tableEndpoint = URI.create(root + "/rest/v1/" + safeTable);
    }

    @Override
    public void probe() {
        send(request("select=chunk_id&limit=1").GET().build(), "probe chunk table");
    }

    @Override
    public void insert(List<Chunk> batch) {
        if (batch == null || batch.isEmpty()) {
            return;
        }
        ArrayNode rows = objectMapper.createArrayNode();
        for (Chunk chunk : batch) {
            ObjectNode row = rows.addObject();
            row.put("chunk_id", chunk.chunkId());
            row.put("section", chunk.section());
            row.put("content", chunk.content());
            row.put("char_count", chunk.charCount());
            chunk.translation().ifPresent(value -> row.put(translationColumn, value));
        }
        HttpRequest request = request("")
                .header("Content-Type", "application/json")
                .header("Prefer", "return=minimal")
                .POST(HttpRequest.BodyPublishers.ofString(write(rows), StandardCharsets.UTF_8))
                .build();
        send(request, "insert " + batch.size() + " chunks");
    }

    @Override
    public List<Chunk> findUntranslated(ChunkRange range, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be zero or greater");
        }
        List<Chunk> chunks = new ArrayList<>();
        int offset = 0;
        while (true) {
            int pageSize = limit == 0 ? PAGE_SIZE : Math.min(PAGE_SIZE, limit - chunks.size());
            String query = "select=chunk_id,section,content,char_count," + translationColumn
                    + rangeFilter(range, TranslationState.UNTRANSLATED)
                    + "&order=chunk_id.asc&limit=" + pageSize + "&offset=" + offset;
            HttpResponse<String> response = send(request(query).GET().build(), "select untranslated chunks");
            List<Chunk> page = readRows(response.body());
            chunks.addAll(page);
            offset += page.size();
            if (page.size() < pageSize || (limit > 0 && chunks.size() >= limit)) {
                break;
            }
        }
        LOGGER.debug("Fetched {} untranslated chunks for range {}", chunks.size(), range);
        return chunks;
    }

    @Override
    public void updateTranslation(long chunkId, String translation) {
        Objects.requireNonNull(translation, "translation");
        ObjectNode body = objectMapper.createObjectNode().put(translationColumn, translation);
        HttpRequest request = request("chunk_id=eq." + chunkId)
                .header("Content-Type", "application/json")
                .header("Prefer", "return=minimal")
                .method("PATCH", HttpRequest.BodyPublishers.ofString(write(body), StandardCharsets.UTF_8))
                .build();
        send(request, "update chunk " + chunkId);
    }

    @Override
    public long count(ChunkRange range, TranslationState state) {
        String query = "select=chunk_id" + rangeFilter(range, state) + "&limit=1";
        HttpRequest request = request(query)
                .header("Prefer", "count=exact")
                .GET()
                .build();
        HttpResponse<String> response = send(request, "count chunks");
        Optional<String> contentRange = response.headers().firstValue("Content-Range");
        return contentRange.map(SupabaseChunkStore::parseTotal)
                .orElseThrow(() -> new ChunkStoreException("Count response carried no Content-Range header"));
    }

    static long parseTotal(String contentRange) {
        int slash = contentRange.lastIndexOf('/');
        String total = slash < 0 ? "" : contentRange.substring(slash + 1).trim();
        try {
            return Long.parseLong(total);
        } catch (NumberFormatException ex) {
            throw new ChunkStoreException("Unparseable Content-Range header: " + contentRange, ex);
        }
    }

    private String rangeFilter(ChunkRange range, TranslationState state) {
        StringBuilder filter = new StringBuilder();
        filter.append("&chunk_id=gte.").append(range.start());
        range.end().ifPresent(end -> filter.append("&chunk_id=lte.").append(end));
        switch (state) {
            case TRANSLATED -> filter.append('&').append(translationColumn).append("=not.is.null");
            case UNTRANSLATED -> filter.append('&').append(translationColumn).append("=is.null");
            case ANY -> { }
        }
        return filter.toString();
    }

    private HttpRequest.Builder request(String query) {
        URI uri = query.isEmpty() ? tableEndpoint : URI.create(tableEndpoint + "?" + query);
        return HttpRequest.newBuilder(uri)
                .timeout(REQUEST_TIMEOUT)
                .header("apikey", apiKey)
                .header("Authorization", "Bearer " + apiKey)
                .header("Accept", "application/json");
    }

    private HttpResponse<String> send(HttpRequest request, String operation) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return response;
            }
            throw new ChunkStoreException("Failed to " + operation + ": store returned status " + status + ": "
                    + abbreviate(response.body()), status, null);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ChunkStoreException("Interrupted while trying to " + operation, ex);
        } catch (IOException ex) {
            throw new ChunkStoreException("Failed to " + operation + ": " + ex.getMessage(), ex);
        }
    }

    private List<Chunk> readRows(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (!root.isArray()) {
                throw new ChunkStoreException("Expected a JSON array of rows but got: " + abbreviate(body));
            }
            List<Chunk> rows = new ArrayList<>(root.size());
            for (JsonNode node : root) {
                String content = node.path("content").asText("");
                JsonNode charCount = node.get("char_count");
                JsonNode translation = node.get(translationColumn);
                rows.add(new Chunk(node.path("chunk_id").asLong(),
                        node.path("section").asText(""),
                        content,
                        charCount == null || charCount.isNull() ? content.length() : charCount.asInt(),
                        translation == null || translation.isNull() ? Optional.empty() : Optional.of(translation.asText())));
            }
            return rows;
        } catch (JsonProcessingException ex) {
            throw new ChunkStoreException("Store returned malformed JSON", ex);
        } catch (IllegalArgumentException ex) {
            throw new ChunkStoreException("Store returned a malformed row: " + ex.getMessage(), ex);
        }
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new ChunkStoreException("Failed to serialize request body", ex);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
