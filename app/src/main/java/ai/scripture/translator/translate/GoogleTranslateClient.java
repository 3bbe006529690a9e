package ai.scripture.translator.translate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Translation client for the public Google Translate web endpoint.
 */
public class GoogleTranslateClient implements TranslationClient {

    static final URI DEFAULT_ENDPOINT = URI.create("https://translate.googleapis.com/translate_a/single");
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final String sourceLanguage;
    private final String targetLanguage;

    public GoogleTranslateClient(String sourceLanguage, String targetLanguage) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(20)).build(), new ObjectMapper(),
                DEFAULT_ENDPOINT, sourceLanguage, targetLanguage);
    }

    GoogleTranslateClient(HttpClient httpClient, ObjectMapper objectMapper, URI endpoint,
                          String sourceLanguage, String targetLanguage) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.sourceLanguage = Objects.requireNonNull(sourceLanguage, "sourceLanguage");
        this.targetLanguage = Objects.requireNonNull(targetLanguage, "targetLanguage");
    }

    @Override
    public String translate(String text) {
        if (text == null || text.isBlank()) {
            throw new TranslationException(FailureKind.OTHER, "Nothing to translate", null);
        }
        String form = "client=gtx&dt=t"
                + "&sl=" + encode(sourceLanguage)
                + "&tl=" + encode(targetLanguage)
                + "&q=" + encode(text);
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(form, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TranslationException(FailureKind.OTHER, "Interrupted while calling Google Translate", ex);
        } catch (IOException ex) {
            throw new TranslationException(FailureKind.TRANSIENT, "Connection to Google Translate failed: " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new TranslationException(FailureClassifier.forHttpStatus(status),
                    "Google Translate returned status " + status, null);
        }
        return parse(response.body());
    }

    /**
     * The response is a nested array whose first element lists {@code [translated, original, ...]} sentence pairs.
     */
    String parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new TranslationException(FailureKind.OTHER, "Unexpected Google Translate response", ex);
        }
        JsonNode sentences = root.path(0);
        if (!sentences.isArray()) {
            throw new TranslationException(FailureKind.OTHER, "Google Translate response carried no sentences", null);
        }
        StringBuilder translated = new StringBuilder();
        for (JsonNode sentence : sentences) {
            JsonNode part = sentence.path(0);
            if (part.isTextual()) {
                translated.append(part.asText());
            }
        }
        return translated.toString().strip();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
