package com.sapa.speakers.exception;

/**
 * Required Notion settings are missing. Raised on first use of the transport, not at startup.
 */
public class NotionConfigurationException extends SpeakerTrackerException {

    private final String setting;

    public NotionConfigurationException(String setting, String envVar) {
        super(setting + " is required (set " + envVar + ")");
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
