package com.sapa.speakers.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public enum Priority implements LabeledOption {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low"),
    UNRECOGNIZED("Unrecognized");

    private final String label;

    Priority(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public boolean isRecognized() {
        return this != UNRECOGNIZED;
    }

    public static Priority fromLabel(String label) {
        return LabeledOptions.strict(Priority.class, label, "priority");
    }

    public static Priority fromRemoteLabel(String label) {
        return LabeledOptions.lenient(Priority.class, label, UNRECOGNIZED);
    }

    public static List<String> labels() {
        return LabeledOptions.validLabels(Priority.class);
    }
}
