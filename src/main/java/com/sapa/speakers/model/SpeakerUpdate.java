package com.sapa.speakers.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Sparse set of speaker changes. Every field starts absent; only fields that were set or
 * cleared reach Notion.
 */
public class SpeakerUpdate {
    private Settable<String> name = Settable.absent();
    private Settable<FieldSpecialty> fieldSpecialty = Settable.absent();
    private Settable<String> affiliation = Settable.absent();
    private Settable<String> position = Settable.absent();
    private Settable<String> linkedinUrl = Settable.absent();
    private Settable<List<String>> potentialTopics = Settable.absent();
    private Settable<ContactStatus> contactStatus = Settable.absent();
    private Settable<String> researchNotes = Settable.absent();
    private Settable<String> email = Settable.absent();
    private Settable<Priority> priority = Settable.absent();

    /** Every populated field of a creation payload; topics are always written, even when empty. */
    public static SpeakerUpdate from(SpeakerCreate create) {
        SpeakerUpdate u = new SpeakerUpdate();
        u.name = Settable.ofNullable(create.getName());
        u.fieldSpecialty = Settable.ofNullable(create.getFieldSpecialty());
        u.affiliation = Settable.ofNullable(create.getAffiliation());
        u.position = Settable.ofNullable(create.getPosition());
        u.linkedinUrl = Settable.ofNullable(create.getLinkedinUrl());
        u.potentialTopics = Settable.of(new ArrayList<>(create.getPotentialTopics()));
        u.contactStatus = Settable.ofNullable(create.getContactStatus());
        u.researchNotes = Settable.ofNullable(create.getResearchNotes());
        u.email = Settable.ofNullable(create.getEmail());
        u.priority = Settable.ofNullable(create.getPriority());
        return u;
    }

    public static SpeakerUpdate from(Speaker speaker) {
        SpeakerUpdate u = new SpeakerUpdate();
        u.name = Settable.ofNullable(speaker.getName());
        u.fieldSpecialty = Settable.ofNullable(speaker.getFieldSpecialty());
        u.affiliation = Settable.ofNullable(speaker.getAffiliation());
        u.position = Settable.ofNullable(speaker.getPosition());
        u.linkedinUrl = Settable.ofNullable(speaker.getLinkedinUrl());
        u.potentialTopics = Settable.of(new ArrayList<>(speaker.getPotentialTopics()));
        u.contactStatus = Settable.ofNullable(speaker.getContactStatus());
        u.researchNotes = Settable.ofNullable(speaker.getResearchNotes());
        u.email = Settable.ofNullable(speaker.getEmail());
        u.priority = Settable.ofNullable(speaker.getPriority());
        return u;
    }

    public boolean isEmpty() {
        return name.isAbsent() && fieldSpecialty.isAbsent() && affiliation.isAbsent() && position.isAbsent()
                && linkedinUrl.isAbsent() && potentialTopics.isAbsent() && contactStatus.isAbsent()
                && researchNotes.isAbsent() && email.isAbsent() && priority.isAbsent();
    }

    public Settable<String> getName() { return name; }
    public void setName(Settable<String> name) { this.name = orAbsent(name); }

    public Settable<FieldSpecialty> getFieldSpecialty() { return fieldSpecialty; }
    public void setFieldSpecialty(Settable<FieldSpecialty> fieldSpecialty) { this.fieldSpecialty = orAbsent(fieldSpecialty); }

    public Settable<String> getAffiliation() { return affiliation; }
    public void setAffiliation(Settable<String> affiliation) { this.affiliation = orAbsent(affiliation); }

    public Settable<String> getPosition() { return position; }
    public void setPosition(Settable<String> position) { this.position = orAbsent(position); }

    public Settable<String> getLinkedinUrl() { return linkedinUrl; }
    public void setLinkedinUrl(Settable<String> linkedinUrl) { this.linkedinUrl = orAbsent(linkedinUrl); }

    public Settable<List<String>> getPotentialTopics() { return potentialTopics; }
    public void setPotentialTopics(Settable<List<String>> potentialTopics) { this.potentialTopics = orAbsent(potentialTopics); }

    public Settable<ContactStatus> getContactStatus() { return contactStatus; }
    public void setContactStatus(Settable<ContactStatus> contactStatus) { this.contactStatus = orAbsent(contactStatus); }

    public Settable<String> getResearchNotes() { return researchNotes; }
    public void setResearchNotes(Settable<String> researchNotes) { this.researchNotes = orAbsent(researchNotes); }

    public Settable<String> getEmail() { return email; }
    public void setEmail(Settable<String> email) { this.email = orAbsent(email); }

    public Settable<Priority> getPriority() { return priority; }
    public void setPriority(Settable<Priority> priority) { this.priority = orAbsent(priority); }

    private static <T> Settable<T> orAbsent(Settable<T> value) {
        return value == null ? Settable.absent() : value;
    }
}
