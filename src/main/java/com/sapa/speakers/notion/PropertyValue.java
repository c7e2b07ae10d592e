package com.sapa.speakers.notion;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of a single Notion page property value. One record per property kind the speaker
 * schema uses, plus {@link Unsupported} for anything else a drifted database may return.
 */
public sealed interface PropertyValue {

    /** Notion caps each rich text segment at 2000 characters. */
    int MAX_SEGMENT_LENGTH = 2000;

    /** Null for {@link Unsupported}. */
    PropertyKind kind();

    record Title(String text) implements PropertyValue {
        public Title {
            text = text == null ? "" : text;
        }

        @Override
        public PropertyKind kind() {
            return PropertyKind.TITLE;
        }
    }

    /** A null name is the cleared select. */
    record Select(String name) implements PropertyValue {
        @Override
        public PropertyKind kind() {
            return PropertyKind.SELECT;
        }
    }

    record MultiSelect(List<String> names) implements PropertyValue {
        public MultiSelect {
            names = names == null ? List.of() : List.copyOf(names);
        }

        @Override
        public PropertyKind kind() {
            return PropertyKind.MULTI_SELECT;
        }
    }

    /** Segments are written as consecutive text objects and concatenated on read. */
    record RichText(List<String> segments) implements PropertyValue {
        public RichText {
            segments = segments == null ? List.of() : List.copyOf(segments);
        }

        public static RichText of(String text) {
            if (text == null || text.isEmpty()) return empty();
            List<String> parts = new ArrayList<>();
            int start = 0;
            while (start < text.length()) {
                int end = Math.min(text.length(), start + MAX_SEGMENT_LENGTH);
                // keep surrogate pairs in one segment
                if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) end--;
                parts.add(text.substring(start, end));
                start = end;
            }
            return new RichText(parts);
        }

        public static RichText empty() {
            return new RichText(List.of());
        }

        public String text() {
            return String.join("", segments);
        }

        @Override
        public PropertyKind kind() {
            return PropertyKind.RICH_TEXT;
        }
    }

    record Url(String url) implements PropertyValue {
        @Override
        public PropertyKind kind() {
            return PropertyKind.URL;
        }
    }

    record Email(String email) implements PropertyValue {
        @Override
        public PropertyKind kind() {
            return PropertyKind.EMAIL;
        }
    }

    /** A property whose Notion type is outside the speaker schema; kept only so readers can report it. */
    record Unsupported(String type) implements PropertyValue {
        @Override
        public PropertyKind kind() {
            return null;
        }
    }
}
