package com.sapa.speakers.controller;

import com.sapa.speakers.config.AppProperties;
import com.sapa.speakers.config.NotionProperties;
import com.sapa.speakers.service.InMemoryNotionTransport;
import com.sapa.speakers.service.SpeakerPropertyMapper;
import com.sapa.speakers.service.SpeakerRepository;
import com.sapa.speakers.tools.SpeakerTools;
import com.sapa.speakers.tools.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

public class ToolControllerTest {

    private WebTestClient client;

    @BeforeEach
    public void setUp() {
        InMemoryNotionTransport transport = new InMemoryNotionTransport();
        SpeakerRepository repository = new SpeakerRepository(transport, new SpeakerPropertyMapper(), new NotionProperties());
        ToolRegistry registry = new ToolRegistry();
        new SpeakerTools(repository, new AppProperties()).registerAll(registry);
        client = WebTestClient.bindToController(new ToolController(registry))
                .controllerAdvice(new GlobalErrorHandler())
                .build();
    }

    @Test
    public void listsToolSchemas() {
        client.get().uri("/tools").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(8)
                .jsonPath("$[0].name").isEqualTo("add_speaker")
                .jsonPath("$[0].parameters[0].name").isEqualTo("name")
                .jsonPath("$[0].parameters[0].required").isEqualTo(true)
                .jsonPath("$[3].name").isEqualTo("list_speakers");
    }

    @Test
    public void invokesToolAndWrapsTextOutput() {
        client.post().uri("/tools/add_speaker")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "Dr. Jane Smith"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.tool").isEqualTo("add_speaker")
                .jsonPath("$.output").isEqualTo("Successfully added speaker 'Dr. Jane Smith' to the database.\n"
                        + "Notion Page ID: page-1\nURL: https://www.notion.so/page-1");
    }

    @Test
    public void toolFailuresStillAnswerOk() {
        client.post().uri("/tools/get_speaker_details")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("speaker_id", "missing"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.output").isEqualTo("Error getting speaker details: Speaker not found: missing");
    }

    @Test
    public void bodyIsOptionalForToolsWithoutArguments() {
        client.post().uri("/tools/test_connection")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.tool").isEqualTo("test_connection");
    }

    @Test
    public void unknownToolIsNotFound() {
        client.post().uri("/tools/delete_everything")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of())
                .exchange()
                .expectStatus().isNotFound();
    }
}
