package com.sapa.speakers.notion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sapa.speakers.exception.RemoteServiceException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between the typed Notion values and the JSON envelopes of the Notion REST API.
 * Envelope problems (missing id, results not an array) surface as {@link RemoteServiceException};
 * property-level gaps are left for the speaker mapper to judge.
 */
public class NotionJsonCodec {
    private final ObjectMapper objectMapper;

    public NotionJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode newObject() {
        return objectMapper.createObjectNode();
    }

    // ---- writing ----

    public ObjectNode writeProperties(Map<String, PropertyValue> properties) {
        ObjectNode out = objectMapper.createObjectNode();
        for (Map.Entry<String, PropertyValue> e : properties.entrySet()) {
            out.set(e.getKey(), writeProperty(e.getValue()));
        }
        return out;
    }

    ObjectNode writeProperty(PropertyValue value) {
        ObjectNode node = objectMapper.createObjectNode();
        if (value instanceof PropertyValue.Title t) {
            ArrayNode arr = node.putArray("title");
            if (!t.text().isEmpty()) arr.add(textObject(t.text()));
        } else if (value instanceof PropertyValue.Select s) {
            if (s.name() == null) {
                node.putNull("select");
            } else {
                node.putObject("select").put("name", s.name());
            }
        } else if (value instanceof PropertyValue.MultiSelect m) {
            ArrayNode arr = node.putArray("multi_select");
            for (String name : m.names()) {
                arr.addObject().put("name", name);
            }
        } else if (value instanceof PropertyValue.RichText r) {
            ArrayNode arr = node.putArray("rich_text");
            for (String segment : r.segments()) {
                arr.add(textObject(segment));
            }
        } else if (value instanceof PropertyValue.Url u) {
            node.put("url", u.url());
        } else if (value instanceof PropertyValue.Email e) {
            node.put("email", e.email());
        } else {
            throw new IllegalArgumentException("Cannot write property of type " + value);
        }
        return node;
    }

    private ObjectNode textObject(String content) {
        ObjectNode item = objectMapper.createObjectNode();
        item.putObject("text").put("content", content);
        return item;
    }

    public ObjectNode writeFilter(FilterExpression filter) {
        if (filter instanceof FilterExpression.And and) {
            ObjectNode node = objectMapper.createObjectNode();
            ArrayNode arr = node.putArray("and");
            for (FilterExpression clause : and.clauses()) {
                arr.add(writeFilter(clause));
            }
            return node;
        }
        FilterExpression.Condition c = (FilterExpression.Condition) filter;
        ObjectNode node = objectMapper.createObjectNode();
        node.put("property", c.property());
        node.putObject(c.kind().wireName()).put(c.operator(), c.value());
        return node;
    }

    public ObjectNode writeQuery(NotionQuery query) {
        ObjectNode body = objectMapper.createObjectNode();
        if (query.filter() != null) body.set("filter", writeFilter(query.filter()));
        if (query.pageSize() > 0) body.put("page_size", query.pageSize());
        if (query.startCursor() != null) body.put("start_cursor", query.startCursor());
        return body;
    }

    // ---- reading ----

    public NotionPage readPage(JsonNode json) {
        if (json == null || !json.hasNonNull("id")) {
            throw new RemoteServiceException("Malformed Notion response: page without id", 0, null);
        }
        return new NotionPage(
                json.get("id").asText(),
                textOrNull(json.get("url")),
                json.path("archived").asBoolean(false) || json.path("in_trash").asBoolean(false),
                readProperties(json.get("properties")));
    }

    public NotionQueryResult readQueryResult(JsonNode json) {
        JsonNode results = json == null ? null : json.get("results");
        if (results == null || !results.isArray()) {
            throw new RemoteServiceException("Malformed Notion response: query without results array", 0, null);
        }
        List<NotionPage> pages = new ArrayList<>(results.size());
        for (JsonNode page : results) {
            pages.add(readPage(page));
        }
        return new NotionQueryResult(pages, json.path("has_more").asBoolean(false), textOrNull(json.get("next_cursor")));
    }

    public NotionDatabase readDatabase(JsonNode json) {
        if (json == null || !json.hasNonNull("id")) {
            throw new RemoteServiceException("Malformed Notion response: database without id", 0, null);
        }
        Map<String, String> types = new LinkedHashMap<>();
        JsonNode props = json.get("properties");
        if (props != null && props.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = props.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                types.put(e.getKey(), e.getValue().path("type").asText(""));
            }
        }
        String title = plainText(json.get("title"));
        return new NotionDatabase(json.get("id").asText(), title.isEmpty() ? "Untitled" : title, types);
    }

    public Map<String, PropertyValue> readProperties(JsonNode props) {
        Map<String, PropertyValue> out = new LinkedHashMap<>();
        if (props == null || !props.isObject()) return out;
        Iterator<Map.Entry<String, JsonNode>> it = props.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), readProperty(e.getValue()));
        }
        return out;
    }

    PropertyValue readProperty(JsonNode node) {
        String type = node.path("type").asText(null);
        if (type == null) {
            // Request-shaped objects carry no "type"; infer it from the single known key
            for (PropertyKind kind : PropertyKind.values()) {
                if (node.has(kind.wireName())) {
                    type = kind.wireName();
                    break;
                }
            }
        }
        PropertyKind kind = PropertyKind.fromWireName(type);
        if (kind == null) return new PropertyValue.Unsupported(type);
        JsonNode v = node.get(kind.wireName());
        switch (kind) {
            case TITLE:
                return new PropertyValue.Title(plainText(v));
            case RICH_TEXT:
                return new PropertyValue.RichText(segments(v));
            case SELECT:
                return new PropertyValue.Select(v == null || v.isNull() ? null : textOrNull(v.get("name")));
            case MULTI_SELECT: {
                List<String> names = new ArrayList<>();
                if (v != null && v.isArray()) {
                    for (JsonNode option : v) {
                        String name = textOrNull(option.get("name"));
                        if (name != null) names.add(name);
                    }
                }
                return new PropertyValue.MultiSelect(names);
            }
            case URL:
                return new PropertyValue.Url(textOrNull(v));
            case EMAIL:
                return new PropertyValue.Email(textOrNull(v));
            default:
                return new PropertyValue.Unsupported(type);
        }
    }

    private static List<String> segments(JsonNode richText) {
        List<String> parts = new ArrayList<>();
        if (richText == null || !richText.isArray()) return parts;
        for (JsonNode item : richText) {
            String text = textOrNull(item.get("plain_text"));
            if (text == null) text = textOrNull(item.path("text").get("content"));
            if (text != null) parts.add(text);
        }
        return parts;
    }

    private static String plainText(JsonNode richText) {
        return String.join("", segments(richText));
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
