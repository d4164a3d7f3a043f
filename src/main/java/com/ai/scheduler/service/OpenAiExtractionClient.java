package com.ai.scheduler.service;

import com.ai.scheduler.dto.ExtractedFields;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts booking fields with OpenAI Chat Completions. Disabled when no API key is configured;
 * every failure is logged and reported as an empty result.
 */
@Service
public class OpenAiExtractionClient implements ExternalParser {

    private static final Logger log = LoggerFactory.getLogger(OpenAiExtractionClient.class);

    private static final String URL = "https://api.openai.com/v1/chat/completions";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String apiKey;
    private final String model;

    public OpenAiExtractionClient(RestTemplateBuilder builder,
                                  ObjectMapper mapper,
                                  @Value("${openai.api-key:}") String apiKey,
                                  @Value("${openai.model:gpt-4o-mini}") String model,
                                  @Value("${openai.timeout-seconds:5}") int timeoutSeconds) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        this.restTemplate = builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
        this.mapper = mapper;
        this.apiKey = apiKey;
        this.model = model;
    }

    public boolean isEnabled() {
        return StringUtils.isNotBlank(apiKey);
    }

    @Override
    public Optional<ExtractedFields> extract(String text, LocalDateTime referenceNow) {
        if (!isEnabled() || StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", 0);
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt(referenceNow)),
                Map.of("role", "user", "content", text)));

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(URL, new HttpEntity<>(body, headers), String.class);
            return parseCompletion(response.getBody());
        } catch (Exception e) {
            log.warn("External extraction failed, falling back to rules", e);
            return Optional.empty();
        }
    }

    /**
     * Reads the assistant message of a chat-completions response and maps its JSON object.
     */
    Optional<ExtractedFields> parseCompletion(String responseBody) {
        if (StringUtils.isBlank(responseBody)) {
            return Optional.empty();
        }
        try {
            JsonNode root = mapper.readTree(responseBody);
            String content = root.path("choices").path(0).path("message").path("content").asText("").trim();
            int startIdx = content.indexOf('{');
            int endIdx = content.lastIndexOf('}');
            if (startIdx < 0 || endIdx <= startIdx) {
                log.debug("No JSON object in extraction reply: {}", content);
                return Optional.empty();
            }
            JsonNode fields = mapper.readTree(content.substring(startIdx, endIdx + 1));
            ExtractedFields extracted = new ExtractedFields(
                    textOrNull(fields, "title"),
                    parseDate(textOrNull(fields, "date")),
                    parseTime(textOrNull(fields, "time")),
                    fields.path("duration_minutes").canConvertToInt() && fields.path("duration_minutes").isNumber()
                            ? fields.path("duration_minutes").asInt() : null);
            return Optional.of(extracted);
        } catch (Exception e) {
            log.warn("Unreadable extraction reply", e);
            return Optional.empty();
        }
    }

    private static String systemPrompt(LocalDateTime referenceNow) {
        String now = referenceNow.format(DateTimeFormatter.ofPattern("EEEE yyyy-MM-dd HH:mm", Locale.ENGLISH));
        return "You extract appointment requests. Now is " + now + ".\n"
                + "Reply with only a JSON object: {\"title\": string, \"date\": \"YYYY-MM-DD\", "
                + "\"time\": \"HH:mm\" or null, \"duration_minutes\": integer}.\n"
                + "Resolve relative dates against now. A bare weekday means its next occurrence, never today.\n"
                + "Use null for time when the user gave no explicit clock time. Default duration is 30.";
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return StringUtils.isBlank(text) ? null : text.trim();
    }

    private static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring malformed date '{}'", value);
            return null;
        }
    }

    private static LocalTime parseTime(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring malformed time '{}'", value);
            return null;
        }
    }
}
