package org.nowstart.avwap.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.nowstart.avwap.signal.core.AnchorSet;
import org.springframework.stereotype.Component;

/**
 * Maps persisted cache entries to {@link AnchorSet} and back.
 *
 * <p>Accepted entry shapes: an ISO date string, an array of ISO date strings, an object with a {@code dates}
 * array, or an object with any of {@code current}, {@code previous}, {@code latest}, {@code prior}.
 */
@Component
public class EarningsAnchorCacheNormalizer {

    private static final List<String> LEGACY_KEYS = List.of("current", "previous", "latest", "prior");

    public AnchorSet normalize(JsonNode entry) {
        List<String> values = new ArrayList<>();
        if (entry == null || entry.isNull()) {
            return AnchorSet.EMPTY;
        }

        if (entry.isTextual()) {
            values.add(entry.asText());
        } else if (entry.isArray()) {
            entry.forEach(item -> values.add(item.asText()));
        } else if (entry.isObject()) {
            JsonNode dates = entry.get("dates");
            if (dates != null && dates.isArray()) {
                dates.forEach(item -> values.add(item.asText()));
            } else {
                for (String key : LEGACY_KEYS) {
                    if (entry.has(key)) {
                        values.add(entry.get(key).asText());
                    }
                }
            }
        }

        List<LocalDate> parsed = new ArrayList<>();
        for (String value : values) {
            LocalDate date = parseDate(value);
            if (date != null) {
                parsed.add(date);
            }
        }
        return AnchorSet.of(parsed);
    }

    public Map<String, AnchorSet> normalizeAll(JsonNode root) {
        Map<String, AnchorSet> entries = new TreeMap<>();
        if (root == null || !root.isObject()) {
            return entries;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            AnchorSet anchors = normalize(field.getValue());
            if (!anchors.isEmpty()) {
                entries.put(field.getKey(), anchors);
            }
        }
        return entries;
    }

    public ObjectNode serialize(AnchorSet anchors) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        List<LocalDate> dates = anchors.dates();
        if (!dates.isEmpty()) {
            node.put("current", dates.get(0).toString());
        }
        if (dates.size() > 1) {
            node.put("previous", dates.get(1).toString());
        }
        if (dates.size() > 2) {
            ArrayNode all = node.putArray("dates");
            dates.forEach(date -> all.add(date.toString()));
        }
        return node;
    }

    public ObjectNode serializeAll(Map<String, AnchorSet> entries) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        new TreeMap<>(entries).forEach((symbol, anchors) -> {
            if (!anchors.isEmpty()) {
                root.set(symbol, serialize(anchors));
            }
        });
        return root;
    }

    private LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }

        String trimmed = value.trim();
        try {
            if (trimmed.length() > 10) {
                return LocalDateTime.parse(trimmed.replace(' ', 'T')).toLocalDate();
            }
            return LocalDate.parse(trimmed);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
