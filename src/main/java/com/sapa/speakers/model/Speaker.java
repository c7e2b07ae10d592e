package com.sapa.speakers.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A speaker record as stored in the Notion speakers database.
 * The id and url are assigned by Notion and never change after creation.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Speaker {
    private final String id;
    private String url;
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

    public Speaker(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Speaker that)) return false;
        return Objects.equals(id, that.id)
                && Objects.equals(url, that.url)
                && Objects.equals(name, that.name)
                && fieldSpecialty == that.fieldSpecialty
                && Objects.equals(affiliation, that.affiliation)
                && Objects.equals(position, that.position)
                && Objects.equals(linkedinUrl, that.linkedinUrl)
                && Objects.equals(potentialTopics, that.potentialTopics)
                && contactStatus == that.contactStatus
                && Objects.equals(researchNotes, that.researchNotes)
                && Objects.equals(email, that.email)
                && priority == that.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, url, name, fieldSpecialty, affiliation, position, linkedinUrl,
                potentialTopics, contactStatus, researchNotes, email, priority);
    }

    @Override
    public String toString() {
        return "Speaker{id=" + id + ", name=" + name + ", status=" + contactStatus + "}";
    }
}
