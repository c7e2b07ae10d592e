package com.sapa.speakers.tools;

import com.sapa.speakers.model.ContactStatus;
import com.sapa.speakers.model.FieldSpecialty;
import com.sapa.speakers.model.Priority;
import com.sapa.speakers.model.SearchFilter;
import com.sapa.speakers.model.Settable;
import com.sapa.speakers.model.SpeakerCreate;
import com.sapa.speakers.model.SpeakerUpdate;

import java.util.List;
import java.util.function.Function;

/**
 * Turns snake_case tool arguments into speaker inputs. Option labels are checked here, so an
 * invalid label fails before anything is sent to Notion.
 */
public final class SpeakerArgumentParser {
    public static final String SPEAKER_ID = "speaker_id";
    public static final String NAME = "name";
    public static final String FIELD_SPECIALTY = "field_specialty";
    public static final String AFFILIATION = "affiliation";
    public static final String POSITION = "position";
    public static final String LINKEDIN_URL = "linkedin_url";
    public static final String POTENTIAL_TOPICS = "potential_topics";
    public static final String CONTACT_STATUS = "contact_status";
    public static final String RESEARCH_NOTES = "research_notes";
    public static final String EMAIL = "email";
    public static final String PRIORITY = "priority";

    private SpeakerArgumentParser() {
    }

    public static SpeakerCreate toCreate(ToolArguments args) {
        SpeakerCreate create = new SpeakerCreate(args.requiredText(NAME));
        String field = args.text(FIELD_SPECIALTY);
        if (field != null) create.setFieldSpecialty(FieldSpecialty.fromLabel(field));
        create.setAffiliation(args.text(AFFILIATION));
        create.setPosition(args.text(POSITION));
        create.setLinkedinUrl(args.text(LINKEDIN_URL));
        List<String> topics = args.stringList(POTENTIAL_TOPICS);
        if (topics != null) create.setPotentialTopics(topics);
        String status = args.text(CONTACT_STATUS);
        if (status != null) create.setContactStatus(ContactStatus.fromLabel(status));
        create.setResearchNotes(args.text(RESEARCH_NOTES));
        create.setEmail(args.text(EMAIL));
        String priority = args.text(PRIORITY);
        if (priority != null) create.setPriority(Priority.fromLabel(priority));
        return create;
    }

    /**
     * Keys that are not supplied stay untouched; a key supplied as null or blank clears the field.
     */
    public static SpeakerUpdate toUpdate(ToolArguments args) {
        SpeakerUpdate update = new SpeakerUpdate();
        update.setName(args.settableText(NAME));
        update.setFieldSpecialty(option(args.settableText(FIELD_SPECIALTY), FieldSpecialty::fromLabel));
        update.setAffiliation(args.settableText(AFFILIATION));
        update.setPosition(args.settableText(POSITION));
        update.setLinkedinUrl(args.settableText(LINKEDIN_URL));
        update.setPotentialTopics(args.settableList(POTENTIAL_TOPICS));
        update.setContactStatus(option(args.settableText(CONTACT_STATUS), ContactStatus::fromLabel));
        update.setResearchNotes(args.settableText(RESEARCH_NOTES));
        update.setEmail(args.settableText(EMAIL));
        update.setPriority(option(args.settableText(PRIORITY), Priority::fromLabel));
        return update;
    }

    public static SearchFilter toFilter(ToolArguments args) {
        SearchFilter filter = new SearchFilter();
        filter.setNameContains(args.text(NAME));
        filter.setAffiliationContains(args.text(AFFILIATION));
        String field = args.text(FIELD_SPECIALTY);
        if (field != null) filter.setFieldSpecialty(FieldSpecialty.fromLabel(field));
        String status = args.text(CONTACT_STATUS);
        if (status != null) filter.setContactStatus(ContactStatus.fromLabel(status));
        String priority = args.text(PRIORITY);
        if (priority != null) filter.setPriority(Priority.fromLabel(priority));
        return filter;
    }

    private static <T> Settable<T> option(Settable<String> raw, Function<String, T> parse) {
        if (raw.isSet()) return Settable.of(parse.apply(raw.get()));
        return raw.isCleared() ? Settable.cleared() : Settable.absent();
    }
}
