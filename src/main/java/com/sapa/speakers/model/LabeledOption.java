package com.sapa.speakers.model;

/**
 * A closed vocabulary whose constants carry the display label used as the Notion select option name.
 * Each vocabulary has exactly one unrecognized sentinel, produced only when reading drifted remote data.
 */
public interface LabeledOption {

    String label();

    boolean isRecognized();
}
