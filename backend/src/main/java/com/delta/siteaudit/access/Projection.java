package com.delta.siteaudit.access;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tree form of a set of allow-list paths. Applying it copies only what is named; anything
 * not named is left out entirely.
 */
final class Projection {
    private boolean whole;
    private final Map<String, Projection> fields = new LinkedHashMap<>();
    private Projection items;

    static Projection compile(List<String> paths) {
        Projection root = new Projection();
        for (String path : paths) {
            root.add(AllowPath.segments(path));
        }
        return root;
    }

    private void add(List<String> segments) {
        Projection node = this;
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            boolean array = segment.endsWith("[]");
            String name = array ? segment.substring(0, segment.length() - 2) : segment;
            Projection child = node.fields.computeIfAbsent(name, ignored -> new Projection());
            if (i == segments.size() - 1) {
                child.whole = true;
            } else if (array) {
                if (child.items == null) {
                    child.items = new Projection();
                }
                node = child.items;
            } else {
                node = child;
            }
        }
    }

    boolean coversWhole(String field) {
        Projection child = fields.get(field);
        return child != null && child.whole;
    }

    /** Root application: always returns an object, possibly empty. */
    ObjectNode applyToRoot(JsonNode source) {
        JsonNode projected = source == null ? null : apply(source);
        return projected instanceof ObjectNode object ? object : JsonNodeFactory.instance.objectNode();
    }

    private JsonNode apply(JsonNode source) {
        if (whole) {
            return source.deepCopy();
        }
        if (source.isObject() && !fields.isEmpty()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> entries = source.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                Projection child = fields.get(entry.getKey());
                if (child == null) {
                    continue;
                }
                JsonNode value = child.apply(entry.getValue());
                if (value != null) {
                    out.set(entry.getKey(), value);
                }
            }
            return out.isEmpty() ? null : out;
        }
        if (source.isArray() && items != null) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            for (JsonNode item : source) {
                JsonNode value = items.apply(item);
                if (value != null) {
                    out.add(value);
                }
            }
            return out.isEmpty() ? null : out;
        }
        return null;
    }
}
