package com.cgi.fielddiscovery.classifier.service;

import com.cgi.fielddiscovery.classifier.config.AiClientProperties;
import com.cgi.fielddiscovery.classifier.model.FieldDescriptor;
import com.cgi.fielddiscovery.classifier.model.enums.DataCategory;
import com.cgi.fielddiscovery.common.exception.ClassificationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Client for the AI classification provider.
 * Sends one chat completion per field and validates the JSON answer before use:
 * category, subcategory, confidence and reasoning must all be present, the confidence must lie in [0, 1]
 * and the category must belong to the taxonomy.
 */
@Component
public class AiClassificationClient {
    private static final Logger log = LoggerFactory.getLogger(AiClassificationClient.class);

    private static final String SYSTEM_PROMPT_HEADER =
            "You are a data classification expert. Classify the following field into one of these categories:\n";
    private static final String SYSTEM_PROMPT_FOOTER =
            "\nReturn a JSON object with: { category, subcategory, confidence (0-1), reasoning }";

    private final AiClientProperties properties;
    private final ObjectMapper objectMapper;
    private final RestTemplate restTemplate;

    @Autowired
    public AiClassificationClient(AiClientProperties properties, ObjectMapper objectMapper,
                                  @Value("${fielddiscovery.discovery.table-timeout-seconds:60}") long tableTimeoutSeconds) {
        this(properties, objectMapper, createRestTemplate(properties, tableTimeoutSeconds));
        log.info("AI classification client initialized (enabled={}, configured={}, model={}, read timeout={} ms)",
                properties.isEnabled(), isConfigured(), properties.getModel(),
                readTimeoutMs(properties, tableTimeoutSeconds));
    }

    AiClassificationClient(AiClientProperties properties, ObjectMapper objectMapper, RestTemplate restTemplate) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.restTemplate = restTemplate;
    }

    /**
     * Checks if the provider is enabled and has the credentials it needs.
     *
     * @return true if classification requests can be sent
     */
    public boolean isConfigured() {
        return properties.isEnabled()
                && properties.getApiKey() != null && !properties.getApiKey().isBlank()
                && properties.getUrl() != null && !properties.getUrl().isBlank();
    }

    public String getModel() {
        return properties.getModel();
    }

    /**
     * Requests a classification for a field.
     *
     * @param field Field to classify
     * @return Validated answer
     * @throws ClassificationException If the provider is not configured, cannot be reached,
     *                                 or returns an incomplete or invalid answer
     */
    public AiAnswer classify(FieldDescriptor field) {
        if (!isConfigured()) {
            throw new ClassificationException("AI provider is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getApiKey());
        HttpEntity<String> entity = new HttpEntity<>(buildRequest(field).toString(), headers);

        try {
            long start = System.currentTimeMillis();
            ResponseEntity<String> response = restTemplate.exchange(
                    properties.getUrl(), HttpMethod.POST, entity, String.class);
            log.debug("AI provider answered for field {} in {} ms", field.getName(),
                    System.currentTimeMillis() - start);

            if (response.getBody() == null) {
                throw new ClassificationException("Empty response from AI provider");
            }
            return parseAnswer(response.getBody());
        } catch (RestClientException e) {
            throw new ClassificationException("AI provider call failed: " + e.getMessage(), e);
        }
    }

    private ObjectNode buildRequest(FieldDescriptor field) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", properties.getModel());
        request.put("temperature", properties.getTemperature());
        request.put("max_tokens", properties.getMaxTokens());
        request.putObject("response_format").put("type", "json_object");

        ArrayNode messages = request.putArray("messages");
        messages.addObject()
                .put("role", "system")
                .put("content", systemPrompt());
        messages.addObject()
                .put("role", "user")
                .put("content", String.format("Field: %s%nData Type: %s%nTable: %s%nSchema: %s",
                        field.getName(), field.getDataType(), field.getTableName(), field.getSchema()));
        return request;
    }

    private static String systemPrompt() {
        String taxonomy = Stream.of(DataCategory.values())
                .map(c -> "- " + c.getLabel() + " (subcategories: " + String.join(", ", c.getSubcategories()) + ")")
                .collect(Collectors.joining("\n"));
        return SYSTEM_PROMPT_HEADER + taxonomy + "\n" + SYSTEM_PROMPT_FOOTER;
    }

    AiAnswer parseAnswer(String body) {
        JsonNode content;
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode message = root.path("choices").path(0).path("message").path("content");
            if (!message.isTextual() || message.asText().isBlank()) {
                throw new ClassificationException("AI response has no message content");
            }
            content = objectMapper.readTree(message.asText());
        } catch (JsonProcessingException e) {
            throw new ClassificationException("AI response is not valid JSON", e);
        }

        String categoryLabel = requiredText(content, "category");
        String subcategory = requiredText(content, "subcategory");
        String reasoning = requiredText(content, "reasoning");
        double confidence = requiredConfidence(content);

        DataCategory category = DataCategory.fromLabel(categoryLabel)
                .orElseThrow(() -> new ClassificationException("AI returned unknown category: " + categoryLabel));

        return new AiAnswer(category, subcategory.trim(), confidence, reasoning);
    }

    private static String requiredText(JsonNode content, String name) {
        JsonNode value = content.get(name);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ClassificationException("AI response is missing '" + name + "'");
        }
        return value.asText();
    }

    private static double requiredConfidence(JsonNode content) {
        JsonNode value = content.get("confidence");
        double confidence;
        if (value != null && value.isNumber()) {
            confidence = value.asDouble();
        } else if (value != null && value.isTextual()) {
            try {
                confidence = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new ClassificationException("AI response has a non-numeric confidence", e);
            }
        } else {
            throw new ClassificationException("AI response is missing 'confidence'");
        }

        if (Double.isNaN(confidence) || confidence < 0 || confidence > 1) {
            throw new ClassificationException("AI confidence out of range: " + confidence);
        }
        return confidence;
    }

    /**
     * A provider call may not outlive the analysis of the table it belongs to.
     */
    static int readTimeoutMs(AiClientProperties properties, long tableTimeoutSeconds) {
        long tableTimeoutMs = TimeUnit.SECONDS.toMillis(Math.max(1, tableTimeoutSeconds));
        return (int) Math.min(properties.getTimeoutMs(), tableTimeoutMs);
    }

    private static RestTemplate createRestTemplate(AiClientProperties properties, long tableTimeoutSeconds) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeoutMs());
        requestFactory.setReadTimeout(readTimeoutMs(properties, tableTimeoutSeconds));
        return new RestTemplate(requestFactory);
    }

    /**
     * Validated answer of the AI provider.
     */
    @Getter
    @AllArgsConstructor
    public static class AiAnswer {
        private final DataCategory category;
        private final String subcategory;
        private final double confidence;
        private final String reasoning;
    }
}
