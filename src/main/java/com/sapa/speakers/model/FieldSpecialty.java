package com.sapa.speakers.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public enum FieldSpecialty implements LabeledOption {
    DRUG_DISCOVERY_AI("Drug Discovery & AI"),
    CLINICAL_MEDICAL_AI("Clinical/Medical AI"),
    GENOMICS_BIOTECH("Genomics & Biotech"),
    HEALTHCARE_AI_ML("Healthcare AI/ML"),
    REGULATORY_SCIENCE("Regulatory Science"),
    REAL_WORLD_DATA("Real World Data/Evidence"),
    BIOINFORMATICS("Bioinformatics"),
    MEDICAL_IMAGING("Medical Imaging AI"),
    NLP_HEALTHCARE("NLP in Healthcare"),
    OTHER("Other"),
    UNRECOGNIZED("Unrecognized");

    private final String label;

    FieldSpecialty(String label) {
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

    public static FieldSpecialty fromLabel(String label) {
        return LabeledOptions.strict(FieldSpecialty.class, label, "field_specialty");
    }

    public static FieldSpecialty fromRemoteLabel(String label) {
        return LabeledOptions.lenient(FieldSpecialty.class, label, UNRECOGNIZED);
    }

    public static List<String> labels() {
        return LabeledOptions.validLabels(FieldSpecialty.class);
    }
}
