package com.sapa.speakers.exception;

/**
 * Base class for every failure raised by the speaker tracker core.
 * Handlers at the edges (tools, REST) catch this type and decide how to render it.
 */
public class SpeakerTrackerException extends RuntimeException {

    public SpeakerTrackerException(String message) {
        super(message);
    }

    public SpeakerTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
