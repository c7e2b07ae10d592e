package com.sapa.speakers.config;

import com.sapa.speakers.tools.SpeakerTools;
import com.sapa.speakers.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolConfig {
    private static final Logger log = LoggerFactory.getLogger(ToolConfig.class);

    @Bean
    public ToolRegistry toolRegistry(SpeakerTools speakerTools) {
        ToolRegistry registry = new ToolRegistry();
        speakerTools.registerAll(registry);
        log.info("Registered {} tools: {}", registry.size(), registry.names());
        return registry;
    }
}
