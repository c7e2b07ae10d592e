package com.sapa.speakers.model;

import com.sapa.speakers.exception.SpeakerValidationException;

import java.util.ArrayList;
import java.util.List;

final class LabeledOptions {

    private LabeledOptions() {
    }

    static <E extends Enum<E> & LabeledOption> E strict(Class<E> type, String label, String fieldName) {
        String wanted = label == null ? null : label.trim();
        for (E option : type.getEnumConstants()) {
            if (option.isRecognized() && option.label().equals(wanted)) {
                return option;
            }
        }
        throw new SpeakerValidationException(fieldName,
                "Invalid " + fieldName + " '" + label + "'. Valid options: " + validLabels(type));
    }

    static <E extends Enum<E> & LabeledOption> E lenient(Class<E> type, String label, E sentinel) {
        for (E option : type.getEnumConstants()) {
            if (option.isRecognized() && option.label().equals(label)) {
                return option;
            }
        }
        return sentinel;
    }

    static <E extends Enum<E> & LabeledOption> List<String> validLabels(Class<E> type) {
        List<String> labels = new ArrayList<>();
        for (E option : type.getEnumConstants()) {
            if (option.isRecognized()) labels.add(option.label());
        }
        return labels;
    }
}
