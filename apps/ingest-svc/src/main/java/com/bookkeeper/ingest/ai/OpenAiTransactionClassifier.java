package com.bookkeeper.ingest.ai;

import com.bookkeeper.ingest.config.BookkeepingProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Classifies transactions through the OpenAI chat-completions API. Disabled when no API key is
 * configured and {@code OPENAI_API_KEY} is unset.
 */
@Component
public class OpenAiTransactionClassifier implements TransactionClassifier {

    private static final Logger log = LoggerFactory.getLogger(OpenAiTransactionClassifier.class);
    private static final int MAX_TOKENS = 2000;
    private static final double TEMPERATURE = 0.1;

    private final BookkeepingProperties.Ai properties;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;
    private final String apiKey;

    @Autowired
    public OpenAiTransactionClassifier(BookkeepingProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, RestClient.builder().requestFactory(requestFactory()), System.getenv("OPENAI_API_KEY"));
    }

    OpenAiTransactionClassifier(BookkeepingProperties properties, ObjectMapper objectMapper,
                                RestClient.Builder restClientBuilder, String environmentKey) {
        this.properties = properties.ai();
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder.build();
        this.apiKey = resolveApiKey(this.properties.apiKey(), environmentKey).orElse(null);
        log.info("AI classifier configured: provider={} model={} enabled={}",
                this.properties.providerOrDefault(), this.properties.modelOrDefault(), isEnabled());
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && "openai".equals(properties.providerOrDefault());
    }

    @Override
    public Map<Integer, String> classify(List<ClassificationRequest> requests) {
        if (requests.isEmpty()) {
            return Map.of();
        }
        if (!isEnabled()) {
            throw new ClassifierException("AI classifier is disabled: no API key configured");
        }
        ObjectNode payload = buildPayload(requests);
        JsonNode response;
        try {
            response = restClient.post()
                    .uri(properties.endpointOrDefault())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(apiKey))
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            throw new ClassifierException("OpenAI call failed with status " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            throw new ClassifierException("OpenAI call failed: " + ex.getMessage(), ex);
        }
        if (response == null) {
            throw new ClassifierException("OpenAI returned an empty body");
        }
        String content = response.path("choices").path(0).path("message").path("content").asText("");
        return parseCategories(content);
    }

    ObjectNode buildPayload(List<ClassificationRequest> requests) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", properties.modelOrDefault());
        root.put("temperature", TEMPERATURE);
        root.put("max_tokens", MAX_TOKENS);
        root.putObject("response_format").put("type", "json_object");
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt());
        messages.addObject().put("role", "user").put("content", userPrompt(requests));
        return root;
    }

    private String systemPrompt() {
        return "You are a bookkeeping assistant.\n"
                + "Map each transaction to exactly one of: " + String.join(", ", properties.categories()) + ".\n"
                + "Return ONLY a JSON object {\"rows\": [{\"id\": <id>, \"category\": <category>}]}.\n"
                + "Do not include markdown, code fences or explanations.";
    }

    private static String userPrompt(List<ClassificationRequest> requests) {
        StringBuilder builder = new StringBuilder("Categorize these ")
                .append(requests.size())
                .append(" transactions (id | date | description | amount):\n");
        for (ClassificationRequest request : requests) {
            builder.append(request.id()).append(" | ")
                    .append(request.date()).append(" | ")
                    .append(request.description()).append(" | ")
                    .append(request.amount().setScale(2, RoundingMode.HALF_UP).toPlainString())
                    .append('\n');
        }
        return builder.toString();
    }

    Map<Integer, String> parseCategories(String content) {
        String json = stripCodeFence(content);
        if (json.isBlank()) {
            throw new ClassifierException("OpenAI response had no content");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new ClassifierException("OpenAI response is not valid JSON", ex);
        }
        JsonNode rows = root.isArray() ? root : root.path("rows");
        if (!rows.isArray()) {
            throw new ClassifierException("OpenAI response has no 'rows' array");
        }
        Map<Integer, String> categories = new LinkedHashMap<>();
        for (JsonNode row : rows) {
            JsonNode id = row.get("id");
            String category = row.path("category").asText(row.path("suggested_category").asText(""));
            if (id == null || !id.canConvertToInt() || category.isBlank()) {
                log.debug("Ignoring unusable classifier row: {}", row);
                continue;
            }
            categories.put(id.asInt(), category.trim());
        }
        return categories;
    }

    private static String stripCodeFence(String content) {
        if (content == null) {
            return "";
        }
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }

    static Optional<String> resolveApiKey(String configured, String environmentKey) {
        if (configured != null && !configured.isBlank()) {
            return Optional.of(configured.trim());
        }
        if (environmentKey != null && !environmentKey.isBlank()) {
            return Optional.of(environmentKey.trim());
        }
        return Optional.empty();
    }

    private static SimpleClientHttpRequestFactory requestFactory() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(12));
        requestFactory.setReadTimeout(Duration.ofSeconds(60));
        return requestFactory;
    }
}
