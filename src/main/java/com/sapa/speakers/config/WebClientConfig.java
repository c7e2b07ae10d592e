package com.sapa.speakers.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sapa.speakers.notion.NotionJsonCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    public NotionJsonCodec notionJsonCodec(ObjectMapper objectMapper) {
        return new NotionJsonCodec(objectMapper);
    }

    // Authorization is added per request so a missing key fails the first call, not startup
    @Bean(name = "notionClient")
    public WebClient notionClient(NotionProperties notionProperties) {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
        return WebClient.builder()
                .baseUrl(notionProperties.getBaseUrl())
                .exchangeStrategies(strategies)
                .defaultHeader("Notion-Version", notionProperties.getVersion())
                .defaultHeaders(headers -> headers.setAccept(MediaType.parseMediaTypes("application/json")))
                .build();
    }
}
