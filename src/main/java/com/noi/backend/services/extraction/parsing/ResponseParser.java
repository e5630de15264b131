package com.noi.backend.services.extraction.parsing;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.noi.backend.enums.FieldProvenance;
import com.noi.backend.services.extraction.SchemaMismatchException;
import com.noi.backend.services.extraction.model.FinancialField;
import com.noi.backend.services.extraction.model.ParsedRecord;
import com.noi.backend.services.extraction.util.AmountParser;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads loosely structured model output into a {@link ParsedRecord}.
 *
 * Order: strict JSON, then the first balanced {...} block, then "field: value" pairs.
 * Nothing from the model is trusted before {@link #requireSchema(ParsedRecord)} passes.
 */
@Slf4j
@Component
public class ResponseParser {

    private static final Pattern KEY_VALUE = Pattern.compile(
            "[\"']?([A-Za-z][A-Za-z0-9_ &/\\-]{1,60}?)[\"']?\\s*[:=]\\s*(\"?)(null|[-+($\\d](?:[^,\\n}\"]|,(?=\\d{3}))*)\\2");

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);

    public ParsedRecord parse(String raw) {
        String text = collapseDoubledBraces(stripCodeFences(raw));
        if (text.isEmpty()) return ParsedRecord.empty();

        JsonNode node = readObject(text);
        if (node == null) {
            String block = firstBalancedObject(text);
            if (block != null) node = readObject(block);
        }
        if (node != null) {
            return fromJson(unwrap(node));
        }

        log.debug("[ResponseParser] No JSON object found; falling back to key/value scan");
        return fromKeyValuePairs(text);
    }

    /**
     * Throws when any primary metric key is missing from the output.
     */
    public void requireSchema(ParsedRecord parsed) {
        if (parsed.isSchemaValid()) return;
        Set<FinancialField> missing = EnumSet.noneOf(FinancialField.class);
        for (FinancialField f : FinancialField.PRIMARY_METRICS) {
            if (!parsed.getKeysSeen().contains(f)) missing.add(f);
        }
        StringBuilder keys = new StringBuilder();
        for (FinancialField f : missing) {
            if (keys.length() > 0) keys.append(", ");
            keys.append(f.getKey());
        }
        throw new SchemaMismatchException("Missing primary keys: " + keys);
    }

    private ParsedRecord fromJson(JsonNode node) {
        ParsedRecord parsed = ParsedRecord.empty();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            FinancialField field = FinancialField.fromAlias(e.getKey());
            if (field == null) continue;
            if (parsed.getRecord().has(field)) continue;

            BigDecimal value = toAmount(e.getValue());
            if (value == null) {
                parsed.markSeen(field);
            } else {
                parsed.put(field, value, FieldProvenance.MODEL_EXTRACTED);
            }
        }
        return parsed;
    }

    private ParsedRecord fromKeyValuePairs(String text) {
        ParsedRecord parsed = ParsedRecord.empty();
        Matcher m = KEY_VALUE.matcher(text);
        while (m.find()) {
            FinancialField field = FinancialField.fromAlias(m.group(1));
            if (field == null) {
                FieldLabelMatcher.LabelMatch label = FieldLabelMatcher.find(m.group(1));
                field = label == null ? null : label.field();
            }
            if (field == null || parsed.getRecord().has(field)) continue;
            String rawValue = m.group(3).trim();
            BigDecimal value = "null".equalsIgnoreCase(rawValue) ? null : AmountParser.parse(rawValue);
            if (value == null) {
                parsed.markSeen(field);
            } else {
                parsed.put(field, value, FieldProvenance.MODEL_EXTRACTED);
            }
        }
        return parsed;
    }

    private static BigDecimal toAmount(JsonNode value) {
        if (value == null || value.isNull()) return null;
        if (value.isNumber()) return value.decimalValue();
        if (value.isTextual()) return AmountParser.parse(value.asText());
        if (value.isObject() && value.has("value")) return toAmount(value.get("value"));
        return null;
    }

    /**
     * {"financial_data": {...}} and similar single wrappers are unwrapped until schema keys show up.
     */
    private static JsonNode unwrap(JsonNode node) {
        JsonNode current = node;
        for (int depth = 0; depth < 3; depth++) {
            if (hasKnownKey(current)) return current;
            JsonNode onlyObject = null;
            Iterator<JsonNode> values = current.elements();
            int objects = 0;
            while (values.hasNext()) {
                JsonNode v = values.next();
                if (v.isObject()) {
                    onlyObject = v;
                    objects++;
                }
            }
            if (objects != 1) return current;
            current = onlyObject;
        }
        return current;
    }

    private static boolean hasKnownKey(JsonNode node) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            if (FinancialField.fromAlias(names.next()) != null) return true;
        }
        return false;
    }

    private JsonNode readObject(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    static String stripCodeFences(String raw) {
        if (raw == null) return "";
        String s = raw.trim();
        if (s.startsWith("```")) {
            int firstNewline = s.indexOf('\n');
            s = firstNewline >= 0 ? s.substring(firstNewline + 1) : s.substring(3);
            int lastFence = s.lastIndexOf("```");
            if (lastFence >= 0) {
                s = s.substring(0, lastFence);
            }
        }
        return s.trim();
    }

    static String collapseDoubledBraces(String s) {
        String t = s.trim();
        if (t.startsWith("{{") && t.endsWith("}}")) {
            return t.replace("{{", "{").replace("}}", "}");
        }
        return t;
    }

    /**
     * First {...} block with balanced braces, ignoring braces inside strings.
     */
    static String firstBalancedObject(String s) {
        int start = s.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            for (int i = start; i < s.length(); i++) {
                char c = s.charAt(i);
                if (inString) {
                    if (c == '\\') i++;
                    else if (c == '"') inString = false;
                    continue;
                }
                if (c == '"') inString = true;
                else if (c == '{') depth++;
                else if (c == '}') {
                    depth--;
                    if (depth == 0) return s.substring(start, i + 1);
                }
            }
            start = s.indexOf('{', start + 1);
        }
        return null;
    }
}
