package com.sapa.speakers.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public enum ContactStatus implements LabeledOption {
    NOT_CONTACTED("Not Contacted"),
    CONTACTED("Contacted"),
    IN_DISCUSSION("In Discussion"),
    CONFIRMED("Confirmed"),
    DECLINED("Declined"),
    MAYBE_LATER("Maybe Later"),
    NO_RESPONSE("No Response"),
    UNRECOGNIZED("Unrecognized");

    private final String label;

    ContactStatus(String label) {
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

    public static ContactStatus fromLabel(String label) {
        return LabeledOptions.strict(ContactStatus.class, label, "contact_status");
    }

    public static ContactStatus fromRemoteLabel(String label) {
        return LabeledOptions.lenient(ContactStatus.class, label, UNRECOGNIZED);
    }

    public static List<String> labels() {
        return LabeledOptions.validLabels(ContactStatus.class);
    }
}
