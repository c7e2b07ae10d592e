package com.sapa.speakers.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SAPA Speaker Tracker API")
                        .version("0.1.0")
                        .description("Speaker candidate records kept in a Notion database, exposed as agent tools and REST resources."))
                .addTagsItem(new Tag().name("tools").description("Named actions for agents; every result is plain text"))
                .addTagsItem(new Tag().name("speakers").description("Typed speaker resources"));
    }
}
