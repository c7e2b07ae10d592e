package com.sapa.speakers.service;

import com.sapa.speakers.exception.DataIntegrityException;
import com.sapa.speakers.exception.SpeakerValidationException;
import com.sapa.speakers.model.ContactStatus;
import com.sapa.speakers.model.FieldSpecialty;
import com.sapa.speakers.model.Priority;
import com.sapa.speakers.model.Settable;
import com.sapa.speakers.model.Speaker;
import com.sapa.speakers.model.SpeakerCreate;
import com.sapa.speakers.model.SpeakerUpdate;
import com.sapa.speakers.notion.NotionPage;
import com.sapa.speakers.notion.PropertyValue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class SpeakerPropertyMapperTest {

    private final SpeakerPropertyMapper mapper = new SpeakerPropertyMapper();

    private static <E> E pick(Random rnd, List<E> options) {
        return options.get(rnd.nextInt(options.size()));
    }

    private static String maybe(Random rnd, String value) {
        return rnd.nextBoolean() ? value : null;
    }

    private static Speaker randomSpeaker(Random rnd, int n) {
        Speaker s = new Speaker("page-" + n);
        s.setUrl("https://www.notion.so/page-" + n);
        s.setName("Speaker " + n + " " + Long.toHexString(rnd.nextLong()));
        List<FieldSpecialty> fields = new ArrayList<>(List.of(FieldSpecialty.values()));
        fields.remove(FieldSpecialty.UNRECOGNIZED);
        s.setFieldSpecialty(rnd.nextBoolean() ? pick(rnd, fields) : null);
        s.setAffiliation(maybe(rnd, "Institute " + rnd.nextInt(1000)));
        s.setPosition(maybe(rnd, "Professor of " + rnd.nextInt(50)));
        s.setLinkedinUrl(maybe(rnd, "https://www.linkedin.com/in/speaker-" + n));
        List<String> topics = new ArrayList<>();
        int topicCount = rnd.nextInt(4);
        for (int i = 0; i < topicCount; i++) {
            topics.add("Topic " + n + "." + i);
        }
        s.setPotentialTopics(topics);
        List<ContactStatus> statuses = new ArrayList<>(List.of(ContactStatus.values()));
        statuses.remove(ContactStatus.UNRECOGNIZED);
        s.setContactStatus(pick(rnd, statuses));
        s.setResearchNotes(rnd.nextBoolean() ? "x".repeat(1 + rnd.nextInt(4500)) : null);
        s.setEmail(maybe(rnd, "speaker" + n + "@example.org"));
        List<Priority> priorities = List.of(Priority.HIGH, Priority.MEDIUM, Priority.LOW);
        s.setPriority(rnd.nextBoolean() ? pick(rnd, priorities) : null);
        return s;
    }

    @Test
    public void randomSpeakersSurviveRoundTrip() {
        Random rnd = new Random(20240611L);
        for (int n = 0; n < 200; n++) {
            Speaker original = randomSpeaker(rnd, n);
            Map<String, PropertyValue> props = mapper.toRemoteProperties(original);
            Speaker back = mapper.fromRemoteRecord(new NotionPage(original.getId(), original.getUrl(), false, props));
            assertEquals(original, back, "round trip of speaker " + n);
        }
    }

    @Test
    public void sparseUpdateEmitsOnlySuppliedFields() {
        SpeakerUpdate update = new SpeakerUpdate();
        update.setPriority(Settable.of(Priority.HIGH));

        Map<String, PropertyValue> props = mapper.toRemoteProperties(update);

        assertEquals(1, props.size());
        assertEquals(new PropertyValue.Select("High"), props.get("Priority"));
    }

    @Test
    public void createUsesExpectedPropertyShapes() {
        SpeakerCreate create = new SpeakerCreate("  Dr. Jane Smith ");
        create.setFieldSpecialty(FieldSpecialty.NLP_HEALTHCARE);
        create.setAffiliation("Stanford");
        create.setLinkedinUrl("https://www.linkedin.com/in/jane");
        create.setEmail("jane@stanford.edu");
        create.setPotentialTopics(List.of("Clinical NLP", " Clinical NLP ", "Safety"));

        Map<String, PropertyValue> props = mapper.toRemoteProperties(create);

        assertEquals(new PropertyValue.Title("Dr. Jane Smith"), props.get("Name"));
        assertEquals(new PropertyValue.Select("NLP in Healthcare"), props.get("Field/Specialty"));
        assertEquals(PropertyValue.RichText.of("Stanford"), props.get("Affiliation"));
        assertEquals(new PropertyValue.Url("https://www.linkedin.com/in/jane"), props.get("LinkedIn URL"));
        assertEquals(new PropertyValue.Email("jane@stanford.edu"), props.get("Email"));
        assertEquals(new PropertyValue.MultiSelect(List.of("Clinical NLP", "Safety")), props.get("Potential Topics"));
        assertEquals(new PropertyValue.Select("Not Contacted"), props.get("Contact Status"));
        assertFalse(props.containsKey("Priority"));
        assertFalse(props.containsKey("Position"));
        assertFalse(props.containsKey("Research Notes"));
    }

    @Test
    public void clearedFieldsUseEmptyShapes() {
        SpeakerUpdate update = new SpeakerUpdate();
        update.setAffiliation(Settable.cleared());
        update.setPosition(Settable.of("   "));
        update.setLinkedinUrl(Settable.cleared());
        update.setEmail(Settable.cleared());
        update.setPriority(Settable.cleared());
        update.setPotentialTopics(Settable.cleared());

        Map<String, PropertyValue> props = mapper.toRemoteProperties(update);

        assertEquals(PropertyValue.RichText.empty(), props.get("Affiliation"));
        assertEquals(PropertyValue.RichText.empty(), props.get("Position"));
        assertEquals(new PropertyValue.Url(null), props.get("LinkedIn URL"));
        assertEquals(new PropertyValue.Email(null), props.get("Email"));
        assertEquals(new PropertyValue.Select(null), props.get("Priority"));
        assertEquals(new PropertyValue.MultiSelect(List.of()), props.get("Potential Topics"));
        assertEquals(6, props.size());
    }

    @Test
    public void nameCannotBeClearedOrBlank() {
        SpeakerUpdate cleared = new SpeakerUpdate();
        cleared.setName(Settable.cleared());
        assertThrows(SpeakerValidationException.class, () -> mapper.toRemoteProperties(cleared));

        SpeakerUpdate blank = new SpeakerUpdate();
        blank.setName(Settable.of("  "));
        assertThrows(SpeakerValidationException.class, () -> mapper.toRemoteProperties(blank));

        assertThrows(SpeakerValidationException.class, () -> mapper.toRemoteProperties(new SpeakerCreate()));
    }

    @Test
    public void unrecognizedOptionIsNotWritable() {
        SpeakerUpdate update = new SpeakerUpdate();
        update.setContactStatus(Settable.of(ContactStatus.UNRECOGNIZED));

        SpeakerValidationException e = assertThrows(SpeakerValidationException.class, () -> mapper.toRemoteProperties(update));
        assertEquals("contact_status", e.getField());
    }

    @Test
    public void topicsWithCommasOrBlanksAreRejected() {
        SpeakerUpdate comma = new SpeakerUpdate();
        comma.setPotentialTopics(Settable.of(List.of("AI, ML")));
        assertThrows(SpeakerValidationException.class, () -> mapper.toRemoteProperties(comma));

        SpeakerUpdate blank = new SpeakerUpdate();
        blank.setPotentialTopics(Settable.of(List.of("AI", " ")));
        assertThrows(SpeakerValidationException.class, () -> mapper.toRemoteProperties(blank));
    }

    @Test
    public void longNotesAreSplitIntoSegments() {
        SpeakerUpdate update = new SpeakerUpdate();
        update.setResearchNotes(Settable.of("a".repeat(4100)));

        PropertyValue.RichText notes = (PropertyValue.RichText) mapper.toRemoteProperties(update).get("Research Notes");

        assertEquals(List.of(2000, 2000, 100), notes.segments().stream().map(String::length).toList());
    }

    @Test
    public void segmentBoundaryNeverSplitsSurrogatePair() {
        String notes = "a".repeat(1999) + "\uD83D\uDE00 tail";
        SpeakerUpdate update = new SpeakerUpdate();
        update.setResearchNotes(Settable.of(notes));

        PropertyValue.RichText out = (PropertyValue.RichText) mapper.toRemoteProperties(update).get("Research Notes");

        assertEquals(List.of(1999, 7), out.segments().stream().map(String::length).toList());
        assertFalse(Character.isHighSurrogate(out.segments().get(0).charAt(1998)));
        assertEquals(notes, out.text());

        Speaker s = new Speaker("page-1");
        s.setName("Emoji");
        s.setResearchNotes(notes);
        Speaker back = mapper.fromRemoteRecord(new NotionPage("page-1", null, false, mapper.toRemoteProperties(s)));
        assertEquals(notes, back.getResearchNotes());
    }

    @Test
    public void textIsTrimmedOnWrite() {
        Speaker s = new Speaker("page-1");
        s.setName("  Jane Smith ");
        s.setAffiliation(" Stanford");

        Speaker back = mapper.fromRemoteRecord(new NotionPage("page-1", null, false, mapper.toRemoteProperties(s)));

        assertEquals("Jane Smith", back.getName());
        assertEquals("Stanford", back.getAffiliation());
    }

    @Test
    public void nullTopicIsValidationError() {
        SpeakerCreate create = new SpeakerCreate();
        create.setName("Jane Smith");
        List<String> topics = new ArrayList<>();
        topics.add("Genomics");
        topics.add(null);
        create.setPotentialTopics(topics);

        SpeakerValidationException e = assertThrows(SpeakerValidationException.class,
                () -> mapper.toRemoteProperties(create));
        assertEquals("potential_topics", e.getField());
    }

    @Test
    public void unknownRemoteLabelsBecomeSentinel() {
        Map<String, PropertyValue> props = new LinkedHashMap<>();
        props.put("Name", new PropertyValue.Title("Dr. Jane Smith"));
        props.put("Field/Specialty", new PropertyValue.Select("Quantum Biology"));
        props.put("Contact Status", new PropertyValue.Select("Ghosted"));
        props.put("Priority", new PropertyValue.Select("Urgent"));

        Speaker s = mapper.fromRemoteRecord(new NotionPage("page-1", props));

        assertEquals(FieldSpecialty.UNRECOGNIZED, s.getFieldSpecialty());
        assertEquals(ContactStatus.UNRECOGNIZED, s.getContactStatus());
        assertEquals(Priority.UNRECOGNIZED, s.getPriority());
    }

    @Test
    public void missingOptionalPropertiesReadAsEmpty() {
        Map<String, PropertyValue> props = new LinkedHashMap<>();
        props.put("Name", new PropertyValue.Title("Dr. Jane Smith"));
        props.put("Affiliation", PropertyValue.RichText.empty());
        props.put("Email", new PropertyValue.Url("not-an-email-kind"));
        props.put("Legacy", new PropertyValue.Unsupported("formula"));

        Speaker s = mapper.fromRemoteRecord(new NotionPage("page-1", props));

        assertEquals("Dr. Jane Smith", s.getName());
        assertNull(s.getAffiliation());
        assertNull(s.getEmail());
        assertNull(s.getFieldSpecialty());
        assertEquals(ContactStatus.NOT_CONTACTED, s.getContactStatus());
        assertTrue(s.getPotentialTopics().isEmpty());
    }

    @Test
    public void unusableTitleIsDataIntegrityError() {
        assertThrows(DataIntegrityException.class,
                () -> mapper.fromRemoteRecord(new NotionPage("page-1", Map.of())));
        assertThrows(DataIntegrityException.class,
                () -> mapper.fromRemoteRecord(new NotionPage("page-2", Map.of("Name", new PropertyValue.Title("  ")))));
        assertThrows(DataIntegrityException.class,
                () -> mapper.fromRemoteRecord(new NotionPage("page-3", Map.of("Name", PropertyValue.RichText.of("Jane")))));
    }
}
