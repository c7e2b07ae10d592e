package com.sapa.speakers.tools;

import com.sapa.speakers.config.AppProperties;
import com.sapa.speakers.config.NotionProperties;
import com.sapa.speakers.model.ContactStatus;
import com.sapa.speakers.model.Priority;
import com.sapa.speakers.model.Speaker;
import com.sapa.speakers.notion.NotionDatabase;
import com.sapa.speakers.notion.PropertyValue;
import com.sapa.speakers.service.InMemoryNotionTransport;
import com.sapa.speakers.service.SpeakerPropertyMapper;
import com.sapa.speakers.service.SpeakerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SpeakerToolsTest {

    private InMemoryNotionTransport transport;
    private SpeakerRepository repository;
    private AppProperties appProperties;
    private ToolRegistry registry;

    @BeforeEach
    public void setUp() {
        transport = new InMemoryNotionTransport();
        NotionProperties notionProperties = new NotionProperties();
        notionProperties.setDatabaseId("db-speakers");
        repository = new SpeakerRepository(transport, new SpeakerPropertyMapper(), notionProperties);
        appProperties = new AppProperties();
        registry = new ToolRegistry();
        new SpeakerTools(repository, appProperties).registerAll(registry);
    }

    private String call(String tool, Map<String, Object> args) {
        return registry.invoke(tool, args).block();
    }

    private String seed(String name, String status, String affiliation) {
        Map<String, PropertyValue> props = new LinkedHashMap<>();
        props.put("Name", new PropertyValue.Title(name));
        if (status != null) props.put("Contact Status", new PropertyValue.Select(status));
        if (affiliation != null) props.put("Affiliation", PropertyValue.RichText.of(affiliation));
        return transport.seed(props).id();
    }

    @Test
    public void registersEverySpeakerAction() {
        assertEquals(List.of("add_speaker", "search_speakers", "update_speaker", "list_speakers",
                        "get_speaker_details", "archive_speaker", "prepare_research_summary", "test_connection"),
                List.copyOf(registry.names()));
    }

    @Test
    public void addSpeakerReportsNewPage() {
        String out = call("add_speaker", Map.of("name", "Dr. Jane Smith", "affiliation", "Stanford",
                "potential_topics", List.of("Clinical NLP"), "priority", "High"));

        assertEquals("Successfully added speaker 'Dr. Jane Smith' to the database.\n"
                + "Notion Page ID: page-1\nURL: https://www.notion.so/page-1", out);
        Speaker stored = repository.getSpeaker("page-1").block();
        assertEquals(ContactStatus.NOT_CONTACTED, stored.getContactStatus());
        assertEquals(Priority.HIGH, stored.getPriority());
        assertEquals(List.of("Clinical NLP"), stored.getPotentialTopics());
    }

    @Test
    public void invalidLabelIsReportedBeforeAnyRemoteCall() {
        String out = call("add_speaker", Map.of("name", "Dr. Jane Smith", "field_specialty", "Astrology"));

        assertTrue(out.startsWith("Error adding speaker: Invalid field_specialty 'Astrology'. Valid options: [Drug Discovery & AI"), out);
        assertEquals(0, transport.calls);
    }

    @Test
    public void searchListsMatchesOrSaysNone() {
        seed("Dr. Jane Smith", "Contacted", "Stanford");
        seed("Dr. Raj Patel", null, "MIT");

        String out = call("search_speakers", Map.of("affiliation", "stanford"));

        assertEquals("Found 1 speaker(s):\n\n---\nName: Dr. Jane Smith\nID: page-1\nAffiliation: Stanford\nStatus: Contacted", out);
        assertEquals("No speakers found matching the criteria.", call("search_speakers", Map.of("name", "Nobody")));
    }

    @Test
    public void searchFailureBecomesErrorText() {
        transport.failOnQuery = 1;

        String out = call("search_speakers", Map.of());

        assertTrue(out.startsWith("Error searching speakers: Notion query database failed (502)"), out);
    }

    @Test
    public void updateSetsAndClearsOnlyGivenFields() {
        call("add_speaker", Map.of("name", "Dr. Jane Smith", "email", "jane@stanford.edu", "affiliation", "Stanford"));
        String id = "page-1";
        Map<String, Object> args = new HashMap<>();
        args.put("speaker_id", id);
        args.put("contact_status", "Confirmed");
        args.put("email", "");

        String out = call("update_speaker", args);

        assertEquals("Successfully updated speaker 'Dr. Jane Smith'.\nNotion Page ID: page-1\nStatus: Confirmed", out);
        Speaker s = repository.getSpeaker(id).block();
        assertNull(s.getEmail());
        assertEquals("Stanford", s.getAffiliation());
        assertEquals(ContactStatus.CONFIRMED, s.getContactStatus());
    }

    @Test
    public void updateOfUnknownSpeakerIsReported() {
        String out = call("update_speaker", Map.of("speaker_id", "nope", "priority", "Low"));

        assertEquals("Error updating speaker: Speaker not found: nope", out);
    }

    @Test
    public void listGroupsByStatusWithDefaultLimit() {
        appProperties.setListDefaultLimit(3);
        seed("A", "Contacted", "Stanford");
        seed("B", null, null);
        seed("C", "Contacted", null);
        seed("D", "Confirmed", null);

        String out = call("list_speakers", Map.of());

        assertEquals("Total speakers: 3\n\n\n## Contacted (2)\n- A (Stanford)\n- C\n\n## Not Contacted (1)\n- B", out);
        assertTrue(call("list_speakers", Map.of("group_by", "priority", "limit", 10)).contains("## Not set (4)"));
        assertTrue(call("list_speakers", Map.of("group_by", "colour")).startsWith("Error listing speakers: Invalid group_by"));
    }

    @Test
    public void detailsRenderEveryField() {
        String id = seed("Dr. Jane Smith", null, null);

        String out = call("get_speaker_details", Map.of("speaker_id", id));

        assertTrue(out.startsWith("# Dr. Jane Smith\n\n**Notion ID:** page-1\n"), out);
        assertTrue(out.contains("- **Field/Specialty:** Not specified"));
        assertTrue(out.contains("- **Status:** Not Contacted"));
        assertTrue(out.contains("- **Priority:** Not set"));
        assertTrue(out.contains("## Potential Topics\n- None specified"));
        assertTrue(out.endsWith("## Research Notes\nNo notes yet."));
        assertTrue(call("get_speaker_details", Map.of("speaker_id", "nope")).startsWith("Error getting speaker details: Speaker not found"));
    }

    @Test
    public void archiveHidesSpeaker() {
        String id = seed("Dr. Jane Smith", null, null);

        assertTrue(call("archive_speaker", Map.of("speaker_id", id)).startsWith("Archived speaker page-1."));
        assertEquals("No speakers found matching the criteria.", call("search_speakers", Map.of()));
    }

    @Test
    public void researchSummaryIsFormattedLocally() {
        Map<String, Object> args = new HashMap<>();
        args.put("name", "Dr. Jane Smith");
        args.put("affiliation", "Stanford");
        args.put("position", "Associate Professor");
        args.put("field_specialty", "Clinical/Medical AI");
        args.put("background", "Works on clinical decision support.");
        args.put("notable_work", "Sepsis early-warning model.");
        args.put("potential_topics", List.of("LLMs at the bedside", "Validation"));

        String out = call("prepare_research_summary", args);

        assertTrue(out.startsWith("# Research Summary: Dr. Jane Smith\n"), out);
        assertTrue(out.contains("- **Field:** Clinical/Medical AI"));
        assertTrue(out.contains("## Potential Speaking Topics\n- LLMs at the bedside\n- Validation\n"));
        assertTrue(out.contains("- **LinkedIn:** Not found"));
        assertTrue(out.contains("- **Priority:** Medium"));
        assertEquals(0, transport.calls);

        args.put("priority_recommendation", "Urgent");
        assertTrue(call("prepare_research_summary", args).startsWith("Error preparing research summary: Invalid priority"));
    }

    @Test
    public void connectionStatusIsRendered() {
        assertTrue(call("test_connection", Map.of()).startsWith("Connection failed: "));

        Map<String, String> types = new LinkedHashMap<>();
        types.put("Name", "title");
        transport.database = new NotionDatabase("db-speakers", "SAPA Speakers", types);
        String out = call("test_connection", Map.of());

        assertTrue(out.startsWith("Connection successful!\nDatabase: SAPA Speakers\nDatabase ID: db-speakers\nSchema problems:"), out);
        assertTrue(out.contains("- Priority (missing, expected select)"));
    }
}
