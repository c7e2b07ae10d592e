package com.sapa.speakers.exception;

/**
 * Transport, network or API-level failure talking to Notion. Never retried here; callers may
 * retry rate limits and timeouts, but not auth failures.
 */
public class RemoteServiceException extends SpeakerTrackerException {

    /** HTTP status reported by Notion, or 0 when the request never got a response. */
    private final int status;
    /** Notion error code such as {@code object_not_found} or {@code rate_limited}; may be null. */
    private final String code;

    public RemoteServiceException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.code = null;
    }

    public RemoteServiceException(String message, int status, String code) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public int getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public boolean isNotFound() {
        return status == 404 || "object_not_found".equals(code);
    }
}
