package com.commerceforecast.analysis.unit;

import com.commerceforecast.analysis.backend.GenerationResponse;
import com.commerceforecast.common.exception.ParseException;
import com.commerceforecast.common.model.UnitName;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns backend text into a JSON-object payload. Markdown fences are stripped first;
 * anything that is not a JSON object afterwards is a {@link ParseException}.
 */
@Component
public class StructuredResponseParser {

    private static final Logger log = LoggerFactory.getLogger(StructuredResponseParser.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public StructuredResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> parse(GenerationResponse response, UnitName unit) {
        String content = response.content();
        if (content == null || content.isBlank()) {
            throw new ParseException(unit.displayName(), "Empty response from backend", response.usage());
        }

        String cleaned = stripFences(content);
        JsonNode json;
        try {
            json = objectMapper.readTree(cleaned);
        } catch (Exception e) {
            log.error("[{}] Failed to parse backend response: {}", unit.displayName(), abbreviate(content));
            throw new ParseException(unit.displayName(),
                "Invalid JSON response from backend: " + e.getMessage(), response.usage(), e);
        }
        if (json == null || !json.isObject()) {
            throw new ParseException(unit.displayName(),
                "Expected a JSON object but got " + (json == null ? "nothing" : json.getNodeType()),
                response.usage());
        }
        return objectMapper.convertValue(json, PAYLOAD_TYPE);
    }

    static String stripFences(String content) {
        String text;
        if (content.contains("```json")) {
            text = content.substring(content.indexOf("```json") + "```json".length());
        } else if (content.contains("```")) {
            text = content.substring(content.indexOf("```") + 3);
        } else {
            return content.trim();
        }
        int closing = text.indexOf("```");
        return (closing >= 0 ? text.substring(0, closing) : text).trim();
    }

    private static String abbreviate(String text) {
        return text.length() <= 300 ? text : text.substring(0, 300) + "...";
    }
}
