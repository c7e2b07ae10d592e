package com.sapa.speakers.model;

import com.sapa.speakers.exception.SpeakerValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LabeledOptionTest {

    @Test
    public void strictLookupAcceptsExactLabels() {
        assertEquals(FieldSpecialty.DRUG_DISCOVERY_AI, FieldSpecialty.fromLabel("Drug Discovery & AI"));
        assertEquals(ContactStatus.MAYBE_LATER, ContactStatus.fromLabel(" Maybe Later "));
        assertEquals(Priority.LOW, Priority.fromLabel("Low"));
    }

    @Test
    public void strictLookupRejectsUnknownAndSentinelLabels() {
        SpeakerValidationException e = assertThrows(SpeakerValidationException.class,
                () -> FieldSpecialty.fromLabel("Astrology"));
        assertEquals("field_specialty", e.getField());
        assertTrue(e.getMessage().contains("Valid options"));
        assertThrows(SpeakerValidationException.class, () -> Priority.fromLabel("Unrecognized"));
        assertThrows(SpeakerValidationException.class, () -> ContactStatus.fromLabel("contacted"));
    }

    @Test
    public void lenientLookupFallsBackToSentinel() {
        assertEquals(Priority.UNRECOGNIZED, Priority.fromRemoteLabel("Urgent"));
        assertEquals(ContactStatus.CONFIRMED, ContactStatus.fromRemoteLabel("Confirmed"));
        assertFalse(Priority.UNRECOGNIZED.isRecognized());
    }

    @Test
    public void labelsExcludeSentinel() {
        assertEquals(List.of("High", "Medium", "Low"), Priority.labels());
        assertEquals(7, ContactStatus.labels().size());
        assertEquals(10, FieldSpecialty.labels().size());
    }

    @Test
    public void groupingKeysAreValidated() {
        assertEquals(SpeakerGrouping.AFFILIATION, SpeakerGrouping.fromKey("Affiliation"));
        assertThrows(SpeakerValidationException.class, () -> SpeakerGrouping.fromKey("email"));
    }
}
