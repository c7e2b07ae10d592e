package com.sapa.speakers.controller;

import com.sapa.speakers.dto.SpeakerDtos;
import com.sapa.speakers.model.SearchFilter;
import com.sapa.speakers.model.Speaker;
import com.sapa.speakers.model.SpeakerGrouping;
import com.sapa.speakers.model.SpeakerListing;
import com.sapa.speakers.service.SpeakerRepository;
import com.sapa.speakers.tools.SpeakerArgumentParser;
import com.sapa.speakers.tools.ToolArguments;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed speaker resources. Request bodies use the same snake_case keys as the tools, and
 * failures are mapped to statuses by {@link GlobalErrorHandler}.
 */
@RestController
@RequestMapping("/speakers")
@Tag(name = "speakers")
public class SpeakerController {
    private final SpeakerRepository repository;

    public SpeakerController(SpeakerRepository repository) {
        this.repository = repository;
    }

    @GetMapping
    public Mono<SpeakerDtos.SpeakerSearchResponse<Speaker>> search(
            @RequestParam(value = "name", required = false) String name,
            @RequestParam(value = "field_specialty", required = false) String fieldSpecialty,
            @RequestParam(value = "affiliation", required = false) String affiliation,
            @RequestParam(value = "contact_status", required = false) String contactStatus,
            @RequestParam(value = "priority", required = false) String priority,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return Mono.defer(() -> {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("name", name);
            args.put("field_specialty", fieldSpecialty);
            args.put("affiliation", affiliation);
            args.put("contact_status", contactStatus);
            args.put("priority", priority);
            SearchFilter filter = SpeakerArgumentParser.toFilter(new ToolArguments(args));
            return repository.searchSpeakers(filter, limit);
        }).map(SpeakerDtos.SpeakerSearchResponse<Speaker>::new);
    }

    @GetMapping("/grouped")
    public Mono<SpeakerListing> grouped(@RequestParam(value = "by", defaultValue = "contact_status") String by,
                                        @RequestParam(value = "limit", required = false) Integer limit) {
        return Mono.defer(() -> repository.listSpeakers(SpeakerGrouping.fromKey(by), limit));
    }

    @GetMapping("/{id}")
    public Mono<Speaker> get(@PathVariable("id") String id) {
        return repository.getSpeaker(id);
    }

    @PostMapping
    public Mono<ResponseEntity<Speaker>> create(@Valid @RequestBody SpeakerDtos.CreateSpeakerRequest body) {
        return Mono.defer(() -> repository.addSpeaker(SpeakerArgumentParser.toCreate(new ToolArguments(body.toArguments()))))
                .map(s -> ResponseEntity.status(HttpStatus.CREATED).body(s));
    }

    /** Only the keys present in the body change; a key sent as null or "" clears that field. */
    @PatchMapping("/{id}")
    public Mono<Speaker> update(@PathVariable("id") String id, @RequestBody Map<String, Object> body) {
        return Mono.defer(() -> repository.updateSpeaker(id, SpeakerArgumentParser.toUpdate(new ToolArguments(body))));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> archive(@PathVariable("id") String id) {
        return repository.archiveSpeaker(id).thenReturn(ResponseEntity.noContent().<Void>build());
    }
}
