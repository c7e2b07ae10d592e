package com.sapa.speakers.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full listing result. Groups keep the order in which each group label was first seen;
 * the map is empty when no grouping was requested.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SpeakerListing {
    private final List<Speaker> speakers;
    private final SpeakerGrouping groupedBy;
    private final Map<String, List<Speaker>> groups;

    public SpeakerListing(List<Speaker> speakers, SpeakerGrouping groupedBy, Map<String, List<Speaker>> groups) {
        this.speakers = List.copyOf(speakers);
        this.groupedBy = groupedBy;
        this.groups = groups == null ? Map.of() : new LinkedHashMap<>(groups);
    }

    public int getTotal() {
        return speakers.size();
    }

    public List<Speaker> getSpeakers() {
        return speakers;
    }

    public SpeakerGrouping getGroupedBy() {
        return groupedBy;
    }

    public Map<String, List<Speaker>> getGroups() {
        return groups;
    }

    public boolean isGrouped() {
        return groupedBy != null;
    }
}
