package com.sapa.speakers.notion;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Calls against the one configured Notion database. Implementations signal
 * {@link com.sapa.speakers.exception.RemoteServiceException} for any transport or API failure
 * and {@link com.sapa.speakers.exception.NotionConfigurationException} when credentials are missing.
 */
public interface NotionTransport {

    Mono<NotionPage> createPage(Map<String, PropertyValue> properties);

    Mono<NotionPage> retrievePage(String pageId);

    Mono<NotionPage> updatePage(String pageId, Map<String, PropertyValue> properties);

    Mono<NotionPage> archivePage(String pageId);

    Mono<NotionQueryResult> queryDatabase(NotionQuery query);

    Mono<NotionDatabase> retrieveDatabase();
}
