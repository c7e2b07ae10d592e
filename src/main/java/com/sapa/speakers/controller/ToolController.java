package com.sapa.speakers.controller;

import com.sapa.speakers.dto.ToolDtos;
import com.sapa.speakers.tools.ToolRegistry;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/tools")
@Tag(name = "tools")
public class ToolController {
    private final ToolRegistry toolRegistry;

    public ToolController(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ToolDtos.ToolInfo> list() {
        return toolRegistry.definitions().stream().map(ToolDtos.ToolInfo::of).toList();
    }

    @PostMapping(value = "/{name}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ToolDtos.ToolResult>> invoke(@PathVariable("name") String name,
                                                           @RequestBody(required = false) Map<String, Object> arguments) {
        if (toolRegistry.find(name).isEmpty()) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return toolRegistry.invoke(name, arguments == null ? Map.of() : arguments)
                .map(output -> ResponseEntity.ok(new ToolDtos.ToolResult(name, output)));
    }
}
