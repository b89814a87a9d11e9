package io.logtabulator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logtabulator.parser.ParsedLogRecord;
import io.logtabulator.service.dto.ChunkKeys;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the intermediate files of the parse stage.
 * <p>
 * A records file is JSON Lines: a format header line followed by one object per record,
 * <pre>
 * {"fields":{"status":"ok","count":3,"amount":"1.10"},"types":{"amount":"decimal"}}
 * </pre>
 * Strings, booleans, ints, finite doubles and nulls are stored as plain JSON values. Any other number is
 * stored as its text with a type tag under {@code types}, so every value reads back with its exact type
 * and text. A keys file is a single JSON document holding the record count and the distinct field names.
 */
@Component
public class RecordCodec {

    public static final String RECORDS_FORMAT = "log-tabulator-records";
    public static final int VERSION = 1;

    private static final String FIELDS = "fields";
    private static final String TYPES = "types";

    private final ObjectMapper objectMapper;

    public RecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
    }

    public void writeRecords(Path file, List<ParsedLogRecord> records) {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            ObjectNode header = objectMapper.createObjectNode()
                    .put("format", RECORDS_FORMAT)
                    .put("version", VERSION);
            writer.write(objectMapper.writeValueAsString(header));
            writer.write('\n');
            for (ParsedLogRecord record : records) {
                writer.write(objectMapper.writeValueAsString(toLine(record)));
                writer.write('\n');
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write records to " + file, e);
        }
    }

    public List<ParsedLogRecord> readRecords(Path file) {
        List<ParsedLogRecord> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            checkHeader(file, reader.readLine());
            String line;
            long lineNo = 1;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isEmpty()) continue;
                records.add(toRecord(file, lineNo, line));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read records from " + file, e);
        }
        return records;
    }

    public void writeKeys(Path file, ChunkKeys keys) {
        ObjectNode document = objectMapper.createObjectNode()
                .put("version", VERSION)
                .put("records", keys.recordCount());
        ArrayNode names = document.putArray("keys");
        for (String key : new TreeSet<>(keys.keys())) {
            names.add(key);
        }
        try {
            objectMapper.writeValue(file.toFile(), document);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write keys to " + file, e);
        }
    }

    public ChunkKeys readKeys(Path file) {
        JsonNode document;
        try {
            document = objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new RecordFormatException(file, "malformed keys file", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read keys from " + file, e);
        }
        if (document == null || !document.isObject()) {
            throw new RecordFormatException(file, "keys file is not a JSON object");
        }
        checkVersion(file, document.path("version"));
        JsonNode records = document.path("records");
        JsonNode keys = document.path("keys");
        if (!records.canConvertToLong() || !keys.isArray()) {
            throw new RecordFormatException(file, "keys file lacks 'records' or 'keys'");
        }
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode key : keys) {
            if (!key.isTextual()) {
                throw new RecordFormatException(file, "key is not a string: " + key);
            }
            names.add(key.asText());
        }
        return new ChunkKeys(records.asLong(), names);
    }

    private ObjectNode toLine(ParsedLogRecord record) {
        ObjectNode line = objectMapper.createObjectNode();
        ObjectNode fields = line.putObject(FIELDS);
        ObjectNode types = null;
        for (Map.Entry<String, Object> field : record.fields().entrySet()) {
            String name = field.getKey();
            Object value = field.getValue();
            if (value == null) {
                fields.putNull(name);
            } else if (value instanceof String text) {
                fields.put(name, text);
            } else if (value instanceof Boolean flag) {
                fields.put(name, flag);
            } else if (value instanceof Integer number) {
                fields.put(name, number);
            } else if (value instanceof Double number && Double.isFinite(number)) {
                fields.put(name, number);
            } else {
                if (types == null) {
                    types = line.putObject(TYPES);
                }
                fields.put(name, value.toString());
                types.put(name, TypeTag.of(value).tag);
            }
        }
        return line;
    }

    private ParsedLogRecord toRecord(Path file, long lineNo, String line) {
        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new RecordFormatException(file, "malformed record at line " + lineNo, e);
        }
        JsonNode fields = root == null ? null : root.get(FIELDS);
        JsonNode types = root == null ? null : root.path(TYPES);
        if (fields == null || !fields.isObject() || !(types.isMissingNode() || types.isObject())) {
            throw new RecordFormatException(file, "not a record at line " + lineNo);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = fields.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> field = iterator.next();
            String name = field.getKey();
            JsonNode tag = types.path(name);
            values.put(name, tag.isMissingNode()
                    ? plainValue(file, lineNo, name, field.getValue())
                    : taggedValue(file, lineNo, name, tag.asText(), field.getValue()));
        }
        try {
            return new ParsedLogRecord(values);
        } catch (IllegalArgumentException e) {
            throw new RecordFormatException(file, "invalid record at line " + lineNo + ": " + e.getMessage(), e);
        }
    }

    private static Object plainValue(Path file, long lineNo, String name, JsonNode node) {
        if (node.isNull()) return null;
        if (node.isTextual()) return node.textValue();
        if (node.isBoolean()) return node.booleanValue();
        if (node.isInt()) return node.intValue();
        if (node.isLong()) return node.longValue();
        if (node.isBigInteger()) return node.bigIntegerValue();
        if (node.isDouble()) return node.doubleValue();
        if (node.isBigDecimal()) return node.decimalValue();
        throw new RecordFormatException(file, "field '" + name + "' at line " + lineNo + " is not a scalar: " + node);
    }

    private static Object taggedValue(Path file, long lineNo, String name, String tag, JsonNode node) {
        if (!node.isTextual()) {
            throw new RecordFormatException(file, "typed field '" + name + "' at line " + lineNo + " is not text");
        }
        TypeTag type = TypeTag.forTag(tag);
        if (type == null) {
            throw new RecordFormatException(file, "unknown type '" + tag + "' of field '" + name + "' at line " + lineNo);
        }
        try {
            return type.parser.apply(node.textValue());
        } catch (NumberFormatException e) {
            throw new RecordFormatException(file, "bad " + tag + " value of field '" + name + "' at line " + lineNo, e);
        }
    }

    private void checkHeader(Path file, String line) {
        if (line == null) {
            throw new RecordFormatException(file, "missing format header");
        }
        JsonNode header;
        try {
            header = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new RecordFormatException(file, "malformed format header", e);
        }
        if (header == null || !RECORDS_FORMAT.equals(header.path("format").asText(null))) {
            throw new RecordFormatException(file, "not a records file");
        }
        checkVersion(file, header.path("version"));
    }

    private void checkVersion(Path file, JsonNode version) {
        if (!version.isInt() || version.intValue() < 1 || version.intValue() > VERSION) {
            throw new RecordFormatException(file, "unsupported format version " + version);
        }
    }

    private enum TypeTag {
        LONG("long", Long.class, Long::valueOf),
        SHORT("short", Short.class, Short::valueOf),
        BYTE("byte", Byte.class, Byte::valueOf),
        FLOAT("float", Float.class, Float::valueOf),
        DOUBLE("double", Double.class, Double::valueOf),
        BIG_INTEGER("bigint", BigInteger.class, BigInteger::new),
        DECIMAL("decimal", BigDecimal.class, BigDecimal::new);

        private final String tag;
        private final Class<?> type;
        private final Function<String, Object> parser;

        TypeTag(String tag, Class<?> type, Function<String, Object> parser) {
            this.tag = tag;
            this.type = type;
            this.parser = parser;
        }

        static TypeTag of(Object value) {
            return Arrays.stream(values())
                    .filter(candidate -> candidate.type == value.getClass())
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No type tag for " + value.getClass().getName()));
        }

        static TypeTag forTag(String tag) {
            return Arrays.stream(values()).filter(candidate -> candidate.tag.equals(tag)).findFirst().orElse(null);
        }
    }
}
