package com.sapa.speakers.exception;

public class SpeakerNotFoundException extends SpeakerTrackerException {

    private final String speakerId;

    public SpeakerNotFoundException(String speakerId) {
        super("Speaker not found: " + speakerId);
        this.speakerId = speakerId;
    }

    public SpeakerNotFoundException(String speakerId, Throwable cause) {
        super("Speaker not found: " + speakerId, cause);
        this.speakerId = speakerId;
    }

    public String getSpeakerId() {
        return speakerId;
    }
}
