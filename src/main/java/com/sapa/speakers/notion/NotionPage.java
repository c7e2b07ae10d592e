package com.sapa.speakers.notion;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A Notion page (one database row) with its properties decoded by name.
 */
public record NotionPage(String id, String url, boolean archived, Map<String, PropertyValue> properties) {

    public NotionPage {
        properties = properties == null ? Map.of() : new LinkedHashMap<>(properties);
    }

    public NotionPage(String id, Map<String, PropertyValue> properties) {
        this(id, null, false, properties);
    }
}
