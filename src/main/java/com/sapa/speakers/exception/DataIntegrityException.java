package com.sapa.speakers.exception;

/**
 * A record returned by Notion cannot be turned into a speaker (no usable title).
 * Points at remote-side corruption or schema drift, not at the caller.
 */
public class DataIntegrityException extends SpeakerTrackerException {

    private final String recordId;

    public DataIntegrityException(String recordId, String reason) {
        super("Record " + recordId + " is unusable: " + reason);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
