package com.sapa.speakers.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.sapa.speakers.exception.SpeakerValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;

/**
 * Client-side grouping keys for speaker listings.
 */
public enum SpeakerGrouping {
    FIELD_SPECIALTY("field_specialty", s -> labelOf(s.getFieldSpecialty())),
    CONTACT_STATUS("contact_status", s -> labelOf(s.getContactStatus())),
    PRIORITY("priority", s -> labelOf(s.getPriority())),
    AFFILIATION("affiliation", s -> textOf(s.getAffiliation()));

    public static final String NOT_SET = "Not set";

    private final String key;
    private final Function<Speaker, String> extractor;

    SpeakerGrouping(String key, Function<Speaker, String> extractor) {
        this.key = key;
        this.extractor = extractor;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String groupOf(Speaker speaker) {
        return extractor.apply(speaker);
    }

    public static SpeakerGrouping fromKey(String key) {
        String k = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        for (SpeakerGrouping g : values()) {
            if (g.key.equals(k)) return g;
        }
        throw new SpeakerValidationException("group_by", "Invalid group_by '" + key + "'. Valid options: "
                + Arrays.stream(values()).map(SpeakerGrouping::key).toList());
    }

    private static String labelOf(LabeledOption option) {
        return option == null ? NOT_SET : option.label();
    }

    private static String textOf(String value) {
        return value == null || value.isBlank() ? NOT_SET : value;
    }
}
