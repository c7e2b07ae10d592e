package com.sapa.speakers.exception;

/**
 * A speaker payload failed a local constraint. Always raised before any remote call.
 */
public class SpeakerValidationException extends SpeakerTrackerException {

    private final String field;

    public SpeakerValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
