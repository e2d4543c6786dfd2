package com.wordscout.discovery.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wordscout.config.DiscoveryProperties;
import com.wordscout.config.InvalidConfigException;
import com.wordscout.discovery.model.SuggestionItem;
import com.wordscout.discovery.model.SuggestionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Client for the Wordstat "top requests" endpoint. Makes exactly one HTTP attempt per call.
 */
@Service
public class WordstatClient implements SuggestionClient {
    private static final Logger log = LoggerFactory.getLogger(WordstatClient.class);
    private static final int MAX_ERROR_BODY_CHARS = 200;

    private final DiscoveryProperties.Api properties;
    private final HttpClient client;
    private final ObjectMapper objectMapper;

    public WordstatClient(
        DiscoveryProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper
    ) {
        this.properties = properties.getApi();
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public FetchOutcome fetch(SuggestionQuery query) {
        String apiKey = properties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new InvalidConfigException("discovery.api.api-key is not set");
        }
        URI uri = endpointUri();

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("Authorization", "Api-Key " + apiKey.trim())
                .header("User-Agent", properties.getUserAgent())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(query), StandardCharsets.UTF_8))
                .build();
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpConnectTimeoutException e) {
            return FetchOutcome.failure(FetchErrorKind.NETWORK_ERROR, 0, "connect timeout: " + e.getMessage());
        } catch (HttpTimeoutException e) {
            return FetchOutcome.failure(FetchErrorKind.TIMEOUT, 0, "request timed out after "
                + properties.getRequestTimeoutSeconds() + "s");
        } catch (ConnectException | UnknownHostException e) {
            return FetchOutcome.failure(FetchErrorKind.NETWORK_ERROR, 0, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (IOException e) {
            return FetchOutcome.failure(classifyIo(e), 0, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.failure(FetchErrorKind.UNKNOWN, 0, "interrupted");
        }

        int status = response.statusCode();
        if (status != 200) {
            String body = response.body() == null ? "" : response.body();
            if (body.length() > MAX_ERROR_BODY_CHARS) {
                body = body.substring(0, MAX_ERROR_BODY_CHARS);
            }
            FetchErrorKind kind = FetchErrorKind.fromHttpStatus(status);
            log.warn("Wordstat request for '{}' failed: HTTP {} ({})", query.phrase(), status, kind.code());
            return FetchOutcome.failure(kind, status, body);
        }

        try {
            SuggestionResponse parsed = parseResponse(response.body(), status);
            log.debug(
                "Wordstat '{}': results={} associations={}",
                query.phrase(),
                parsed.results().size(),
                parsed.associations().size()
            );
            return FetchOutcome.success(parsed);
        } catch (IOException e) {
            return FetchOutcome.failure(FetchErrorKind.UNKNOWN, status, "unparseable response: " + e.getMessage());
        }
    }

    String requestBody(SuggestionQuery query) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("phrase", query.phrase());
        body.put("numPhrases", String.valueOf(query.maxResults()));
        if (!query.regions().isEmpty()) {
            ArrayNode regions = body.putArray("regions");
            for (Integer region : query.regions()) {
                regions.add(String.valueOf(region));
            }
        }
        body.putArray("devices").add(query.device().apiValue());
        String folderId = properties.getFolderId();
        if (folderId != null && !folderId.isBlank()) {
            body.put("folderId", folderId.trim());
        }
        return body.toString();
    }

    SuggestionResponse parseResponse(String body, int status) throws IOException {
        JsonNode root = objectMapper.readTree(body == null ? "" : body);
        if (root == null || !root.isObject()) {
            throw new IOException("expected a JSON object");
        }
        return new SuggestionResponse(
            parseItems(root.path("results")),
            parseItems(root.path("associations")),
            status
        );
    }

    private List<SuggestionItem> parseItems(JsonNode array) {
        List<SuggestionItem> items = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return items;
        }
        for (JsonNode node : array) {
            String phrase = node.path("phrase").asText("");
            items.add(new SuggestionItem(phrase, parseCount(node.get("count"))));
        }
        return items;
    }

    private Long parseCount(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    private FetchErrorKind classifyIo(IOException e) {
        Throwable cause = e.getCause();
        if (cause instanceof ConnectException || cause instanceof UnknownHostException) {
            return FetchErrorKind.NETWORK_ERROR;
        }
        return FetchErrorKind.UNKNOWN;
    }

    private URI endpointUri() {
        try {
            return new URI(properties.getEndpoint());
        } catch (URISyntaxException | NullPointerException e) {
            throw new InvalidConfigException("discovery.api.endpoint is not a valid URI: " + properties.getEndpoint(), e);
        }
    }
}
