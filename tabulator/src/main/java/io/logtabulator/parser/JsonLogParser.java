package io.logtabulator.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.util.StringUtils;

import java.util.*;

/**
 * Claims lines holding a single JSON object. Nested objects are flattened into dotted field names,
 * arrays are kept as their JSON text. Objects without any usable field, or with a field name spanning
 * several lines, are left unclaimed.
 */
public class JsonLogParser implements LogParser {

    private final String shortName;
    private final ObjectMapper objectMapper;

    public JsonLogParser(String shortName, ObjectMapper objectMapper) {
        this.shortName = Objects.requireNonNull(shortName, "shortName");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public String shortName() {
        return shortName;
    }

    @Override
    public Optional<ParsedLogRecord> tryParse(String line) {
        if (!StringUtils.hasText(line)) return Optional.empty();
        String trimmed = line.strip();
        if (!trimmed.startsWith("{")) return Optional.empty();

        JsonNode root = tryParseJson(trimmed).orElse(null);
        if (!(root instanceof ObjectNode objectNode)) return Optional.empty();

        Map<String, Object> fields = new LinkedHashMap<>();
        flatten("", objectNode, fields);
        if (fields.isEmpty() || !fields.keySet().stream().allMatch(ParsedLogRecord::isValidFieldName)) {
            return Optional.empty();
        }
        return Optional.of(new ParsedLogRecord(fields));
    }

    private Optional<JsonNode> tryParseJson(String raw) {
        try {
            return Optional.ofNullable(objectMapper.readTree(raw));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private void flatten(String prefix, ObjectNode node, Map<String, Object> fields) {
        Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> entry = iterator.next();
            String name = prefix + entry.getKey();
            JsonNode value = entry.getValue();
            if (value instanceof ObjectNode nested && !nested.isEmpty()) {
                flatten(name + ".", nested, fields);
            } else if (!name.isEmpty()) {
                fields.putIfAbsent(name, simplify(value));
            }
        }
    }

    private Object simplify(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isValueNode()) {
            if (node.isNumber()) return node.numberValue();
            if (node.isBoolean()) return node.booleanValue();
            return node.asText();
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }
}
