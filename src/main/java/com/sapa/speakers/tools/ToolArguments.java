package com.sapa.speakers.tools;

import com.sapa.speakers.exception.SpeakerValidationException;
import com.sapa.speakers.model.Settable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loosely typed tool arguments as they arrive from JSON, with typed accessors.
 * A key that is present with a null or blank value means "clear" for update-style tools.
 */
public class ToolArguments {
    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public String string(String name) {
        Object v = values.get(name);
        if (v == null) return null;
        if (v instanceof String s) return s;
        if (v instanceof Number || v instanceof Boolean) return String.valueOf(v);
        throw new SpeakerValidationException(name, name + " must be a string");
    }

    /** Blank counts as not supplied. */
    public String text(String name) {
        String s = string(name);
        return s == null || s.isBlank() ? null : s.trim();
    }

    public String requiredText(String name) {
        String s = text(name);
        if (s == null) {
            throw new SpeakerValidationException(name, name + " is required");
        }
        return s;
    }

    public String textOrDefault(String name, String defaultValue) {
        String s = text(name);
        return s == null ? defaultValue : s;
    }

    public List<String> stringList(String name) {
        Object v = values.get(name);
        if (v == null) return null;
        if (v instanceof String s) {
            return s.isBlank() ? List.of() : List.of(s);
        }
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item == null) continue;
                out.add(String.valueOf(item));
            }
            return out;
        }
        throw new SpeakerValidationException(name, name + " must be a list of strings");
    }

    public Integer integer(String name) {
        Object v = values.get(name);
        if (v == null) return null;
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw new SpeakerValidationException(name, name + " must be an integer");
            }
            return n.intValue();
        }
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new SpeakerValidationException(name, name + " must be an integer");
            }
        }
        if (v instanceof String) return null;
        throw new SpeakerValidationException(name, name + " must be an integer");
    }

    public Settable<String> settableText(String name) {
        if (!has(name)) return Settable.absent();
        String s = text(name);
        return s == null ? Settable.cleared() : Settable.of(s);
    }

    public Settable<List<String>> settableList(String name) {
        if (!has(name)) return Settable.absent();
        List<String> list = stringList(name);
        return list == null || list.isEmpty() ? Settable.cleared() : Settable.of(list);
    }
}
