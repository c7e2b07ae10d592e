package com.sapa.speakers.notion;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Database metadata: its title and the wire type of each declared property.
 */
public record NotionDatabase(String id, String title, Map<String, String> propertyTypes) {

    public NotionDatabase {
        propertyTypes = propertyTypes == null ? Map.of() : new LinkedHashMap<>(propertyTypes);
    }
}
