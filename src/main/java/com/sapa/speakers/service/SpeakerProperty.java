package com.sapa.speakers.service;

import com.sapa.speakers.notion.PropertyKind;

/**
 * The Notion property name and kind each speaker field is stored under.
 * The speakers database must declare exactly these names with these kinds.
 */
public enum SpeakerProperty {
    NAME("Name", PropertyKind.TITLE),
    FIELD_SPECIALTY("Field/Specialty", PropertyKind.SELECT),
    AFFILIATION("Affiliation", PropertyKind.RICH_TEXT),
    POSITION("Position", PropertyKind.RICH_TEXT),
    LINKEDIN_URL("LinkedIn URL", PropertyKind.URL),
    POTENTIAL_TOPICS("Potential Topics", PropertyKind.MULTI_SELECT),
    CONTACT_STATUS("Contact Status", PropertyKind.SELECT),
    RESEARCH_NOTES("Research Notes", PropertyKind.RICH_TEXT),
    EMAIL("Email", PropertyKind.EMAIL),
    PRIORITY("Priority", PropertyKind.SELECT);

    private final String propertyName;
    private final PropertyKind kind;

    SpeakerProperty(String propertyName, PropertyKind kind) {
        this.propertyName = propertyName;
        this.kind = kind;
    }

    public String propertyName() {
        return propertyName;
    }

    public PropertyKind kind() {
        return kind;
    }
}
