package com.sapa.speakers.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public class AppProperties {
    /**
     * Row cap used by the list_speakers tool when the caller passes no limit.
     */
    private int listDefaultLimit = 50;

    public int getListDefaultLimit() {
        return listDefaultLimit;
    }

    public void setListDefaultLimit(int listDefaultLimit) {
        this.listDefaultLimit = listDefaultLimit;
    }
}
