package com.sapa.speakers.notion;

/**
 * Notion property types the speaker schema relies on, keyed by their wire name.
 */
public enum PropertyKind {
    TITLE("title"),
    SELECT("select"),
    MULTI_SELECT("multi_select"),
    RICH_TEXT("rich_text"),
    URL("url"),
    EMAIL("email");

    private final String wireName;

    PropertyKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Returns null for Notion types outside the speaker schema (formula, date, people, ...). */
    public static PropertyKind fromWireName(String wireName) {
        for (PropertyKind kind : values()) {
            if (kind.wireName.equals(wireName)) return kind;
        }
        return null;
    }
}
