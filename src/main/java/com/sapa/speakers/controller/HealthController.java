package com.sapa.speakers.controller;

import com.sapa.speakers.model.ConnectionStatus;
import com.sapa.speakers.service.SpeakerRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class HealthController {
    private final SpeakerRepository repository;

    public HealthController(SpeakerRepository repository) { this.repository = repository; }

    @GetMapping("/healthz")
    public Mono<ResponseEntity<ConnectionStatus>> health() {
        return repository.testConnection()
                .map(status -> status.isSuccess()
                        ? ResponseEntity.ok(status)
                        : ResponseEntity.status(503).body(status));
    }
}
