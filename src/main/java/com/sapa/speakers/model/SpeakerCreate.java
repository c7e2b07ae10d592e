package com.sapa.speakers.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Input for creating a speaker. Contact status defaults to {@link ContactStatus#NOT_CONTACTED}.
 */
public class SpeakerCreate {
    private String name;
    private FieldSpecialty fieldSpecialty;
    private String affiliation;
    private String position;
    private String linkedinUrl;
    private List<String> potentialTopics = new ArrayList<>();
    private ContactStatus contactStatus = ContactStatus.NOT_CONTACTED;
    private String researchNotes;
    private String email;
    private Priority priority;

    public SpeakerCreate() {
    }

    public SpeakerCreate(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public FieldSpecialty getFieldSpecialty() {
        return fieldSpecialty;
    }

    public void setFieldSpecialty(FieldSpecialty fieldSpecialty) {
        this.fieldSpecialty = fieldSpecialty;
    }

    public String getAffiliation() {
        return affiliation;
    }

    public void setAffiliation(String affiliation) {
        this.affiliation = affiliation;
    }

    public String getPosition() {
        return position;
    }

    public void setPosition(String position) {
        this.position = position;
    }

    public String getLinkedinUrl() {
        return linkedinUrl;
    }

    public void setLinkedinUrl(String linkedinUrl) {
        this.linkedinUrl = linkedinUrl;
    }

    public List<String> getPotentialTopics() {
        return potentialTopics;
    }

    public void setPotentialTopics(List<String> potentialTopics) {
        this.potentialTopics = potentialTopics == null ? new ArrayList<>() : new ArrayList<>(potentialTopics);
    }

    public ContactStatus getContactStatus() {
        return contactStatus;
    }

    public void setContactStatus(ContactStatus contactStatus) {
        this.contactStatus = contactStatus == null ? ContactStatus.NOT_CONTACTED : contactStatus;
    }

    public String getResearchNotes() {
        return researchNotes;
    }

    public void setResearchNotes(String researchNotes) {
        this.researchNotes = researchNotes;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public Priority getPriority() {
        return priority;
    }

    public void setPriority(Priority priority) {
        this.priority = priority;
    }
}
