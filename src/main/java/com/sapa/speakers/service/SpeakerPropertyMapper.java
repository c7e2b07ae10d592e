package com.sapa.speakers.service;

import com.sapa.speakers.exception.DataIntegrityException;
import com.sapa.speakers.exception.SpeakerValidationException;
import com.sapa.speakers.model.ContactStatus;
import com.sapa.speakers.model.FieldSpecialty;
import com.sapa.speakers.model.LabeledOption;
import com.sapa.speakers.model.Priority;
import com.sapa.speakers.model.Settable;
import com.sapa.speakers.model.Speaker;
import com.sapa.speakers.model.SpeakerCreate;
import com.sapa.speakers.model.SpeakerUpdate;
import com.sapa.speakers.notion.NotionPage;
import com.sapa.speakers.notion.PropertyValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Translates speakers to Notion property values and back.
 *
 * <p>Writing: absent fields are omitted so a sparse update only touches what the caller supplied;
 * cleared fields (and blank optional text) are written in their empty shape; sentinel enum values
 * are rejected. Reading: missing properties become null or empty, unknown select labels become the
 * sentinel, and only an unusable title fails.
 *
 * <p>Text is trimmed on write and read back as stored, so a padded value comes back without its
 * surrounding whitespace.
 */
@Component
public class SpeakerPropertyMapper {
    private static final Logger log = LoggerFactory.getLogger(SpeakerPropertyMapper.class);

    public Map<String, PropertyValue> toRemoteProperties(SpeakerCreate create) {
        if (create.getName() == null) {
            throw new SpeakerValidationException("name", "name is required");
        }
        return toRemoteProperties(SpeakerUpdate.from(create));
    }

    public Map<String, PropertyValue> toRemoteProperties(Speaker speaker) {
        return toRemoteProperties(SpeakerUpdate.from(speaker));
    }

    public Map<String, PropertyValue> toRemoteProperties(SpeakerUpdate update) {
        Map<String, PropertyValue> props = new LinkedHashMap<>();

        Settable<String> name = update.getName();
        if (name.isCleared()) {
            throw new SpeakerValidationException("name", "name cannot be cleared");
        }
        if (name.isSet()) {
            props.put(SpeakerProperty.NAME.propertyName(), new PropertyValue.Title(requireName(name.get())));
        }

        putSelect(props, SpeakerProperty.FIELD_SPECIALTY, update.getFieldSpecialty(), "field_specialty");
        putText(props, SpeakerProperty.AFFILIATION, update.getAffiliation());
        putText(props, SpeakerProperty.POSITION, update.getPosition());
        putText(props, SpeakerProperty.LINKEDIN_URL, update.getLinkedinUrl());
        putTopics(props, update.getPotentialTopics());
        putSelect(props, SpeakerProperty.CONTACT_STATUS, update.getContactStatus(), "contact_status");
        putText(props, SpeakerProperty.RESEARCH_NOTES, update.getResearchNotes());
        putText(props, SpeakerProperty.EMAIL, update.getEmail());
        putSelect(props, SpeakerProperty.PRIORITY, update.getPriority(), "priority");
        return props;
    }

    public Speaker fromRemoteRecord(NotionPage page) {
        Map<String, PropertyValue> props = page.properties();

        Speaker s = new Speaker(page.id());
        s.setUrl(page.url());
        s.setName(readName(page.id(), props.get(SpeakerProperty.NAME.propertyName())));
        s.setFieldSpecialty(readSelect(props, SpeakerProperty.FIELD_SPECIALTY, FieldSpecialty::fromRemoteLabel));
        s.setAffiliation(readText(props, SpeakerProperty.AFFILIATION));
        s.setPosition(readText(props, SpeakerProperty.POSITION));
        s.setLinkedinUrl(readText(props, SpeakerProperty.LINKEDIN_URL));
        s.setPotentialTopics(readTopics(props));
        ContactStatus status = readSelect(props, SpeakerProperty.CONTACT_STATUS, ContactStatus::fromRemoteLabel);
        s.setContactStatus(status == null ? ContactStatus.NOT_CONTACTED : status);
        s.setResearchNotes(readText(props, SpeakerProperty.RESEARCH_NOTES));
        s.setEmail(readText(props, SpeakerProperty.EMAIL));
        s.setPriority(readSelect(props, SpeakerProperty.PRIORITY, Priority::fromRemoteLabel));
        return s;
    }

    // ---- writing ----

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new SpeakerValidationException("name", "name must not be empty");
        }
        return name.trim();
    }

    private static <E extends LabeledOption> void putSelect(Map<String, PropertyValue> props, SpeakerProperty property,
                                                            Settable<E> value, String fieldName) {
        if (value.isAbsent()) return;
        if (value.isCleared()) {
            props.put(property.propertyName(), new PropertyValue.Select(null));
            return;
        }
        E option = value.get();
        if (!option.isRecognized()) {
            throw new SpeakerValidationException(fieldName,
                    "Cannot write unrecognized " + fieldName + "; choose one of the known options");
        }
        props.put(property.propertyName(), new PropertyValue.Select(option.label()));
    }

    private static void putText(Map<String, PropertyValue> props, SpeakerProperty property, Settable<String> value) {
        if (value.isAbsent()) return;
        String text = value.isSet() ? value.get().trim() : "";
        boolean empty = text.isEmpty();
        PropertyValue out;
        switch (property.kind()) {
            case RICH_TEXT:
                out = empty ? PropertyValue.RichText.empty() : PropertyValue.RichText.of(text);
                break;
            case URL:
                out = new PropertyValue.Url(empty ? null : text);
                break;
            case EMAIL:
                out = new PropertyValue.Email(empty ? null : text);
                break;
            default:
                throw new IllegalStateException("Not a text property: " + property);
        }
        props.put(property.propertyName(), out);
    }

    private static void putTopics(Map<String, PropertyValue> props, Settable<List<String>> value) {
        if (value.isAbsent()) return;
        List<String> topics = value.isSet() ? value.get() : List.of();
        Set<String> unique = new LinkedHashSet<>();
        for (String topic : topics) {
            String t = topic == null ? "" : topic.trim();
            if (t.isEmpty()) {
                throw new SpeakerValidationException("potential_topics", "topics must not be blank");
            }
            if (t.contains(",")) {
                throw new SpeakerValidationException("potential_topics", "topic '" + t + "' must not contain a comma");
            }
            unique.add(t);
        }
        props.put(SpeakerProperty.POTENTIAL_TOPICS.propertyName(), new PropertyValue.MultiSelect(new ArrayList<>(unique)));
    }

    // ---- reading ----

    private static String readName(String pageId, PropertyValue value) {
        if (value == null) {
            throw new DataIntegrityException(pageId, "missing Name property");
        }
        if (!(value instanceof PropertyValue.Title title)) {
            throw new DataIntegrityException(pageId, "Name property is not a title");
        }
        String name = title.text().trim();
        if (name.isEmpty()) {
            throw new DataIntegrityException(pageId, "empty Name");
        }
        return name;
    }

    private static <E> E readSelect(Map<String, PropertyValue> props, SpeakerProperty property, Function<String, E> lookup) {
        PropertyValue value = props.get(property.propertyName());
        if (value instanceof PropertyValue.Select select) {
            return select.name() == null ? null : lookup.apply(select.name());
        }
        ignoreMismatch(property, value);
        return null;
    }

    private static String readText(Map<String, PropertyValue> props, SpeakerProperty property) {
        PropertyValue value = props.get(property.propertyName());
        String text = null;
        if (value instanceof PropertyValue.RichText r && property.kind() == r.kind()) {
            text = r.text();
        } else if (value instanceof PropertyValue.Url u && property.kind() == u.kind()) {
            text = u.url();
        } else if (value instanceof PropertyValue.Email e && property.kind() == e.kind()) {
            text = e.email();
        } else {
            ignoreMismatch(property, value);
        }
        return text == null || text.isEmpty() ? null : text;
    }

    private static List<String> readTopics(Map<String, PropertyValue> props) {
        PropertyValue value = props.get(SpeakerProperty.POTENTIAL_TOPICS.propertyName());
        if (value instanceof PropertyValue.MultiSelect m) {
            return new ArrayList<>(new LinkedHashSet<>(m.names()));
        }
        ignoreMismatch(SpeakerProperty.POTENTIAL_TOPICS, value);
        return new ArrayList<>();
    }

    private static void ignoreMismatch(SpeakerProperty property, PropertyValue value) {
        if (value != null) {
            log.debug("Ignoring property '{}': expected {} but got {}", property.propertyName(), property.kind(), value);
        }
    }
}
