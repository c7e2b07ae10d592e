package com.sapa.speakers.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sapa.speakers.config.NotionProperties;
import com.sapa.speakers.exception.RemoteServiceException;
import com.sapa.speakers.exception.SpeakerTrackerException;
import com.sapa.speakers.notion.NotionDatabase;
import com.sapa.speakers.notion.NotionJsonCodec;
import com.sapa.speakers.notion.NotionPage;
import com.sapa.speakers.notion.NotionQuery;
import com.sapa.speakers.notion.NotionQueryResult;
import com.sapa.speakers.notion.NotionTransport;
import com.sapa.speakers.notion.PropertyValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Notion REST client for the speakers database: page create/retrieve/update, database query and
 * database metadata. No retries; every failure is surfaced as a {@link RemoteServiceException}.
 */
@Service
public class NotionService implements NotionTransport {
    private static final Logger log = LoggerFactory.getLogger(NotionService.class);

    private final WebClient notionClient;
    private final NotionJsonCodec codec;
    private final ObjectMapper objectMapper;
    private final NotionProperties notionProperties;

    public NotionService(@Qualifier("notionClient") WebClient notionClient, NotionJsonCodec codec,
                         ObjectMapper objectMapper, NotionProperties notionProperties) {
        this.notionClient = notionClient;
        this.codec = codec;
        this.objectMapper = objectMapper;
        this.notionProperties = notionProperties;
    }

    @Override
    public Mono<NotionPage> createPage(Map<String, PropertyValue> properties) {
        return Mono.defer(() -> {
            ObjectNode body = codec.newObject();
            body.putObject("parent").put("database_id", notionProperties.requireDatabaseId());
            body.set("properties", codec.writeProperties(properties));
            return send(HttpMethod.POST, "/pages", body, "create page")
                    .map(codec::readPage);
        });
    }

    @Override
    public Mono<NotionPage> retrievePage(String pageId) {
        return send(HttpMethod.GET, "/pages/{id}", null, "retrieve page " + pageId, pageId)
                .map(codec::readPage);
    }

    @Override
    public Mono<NotionPage> updatePage(String pageId, Map<String, PropertyValue> properties) {
        return Mono.defer(() -> {
            ObjectNode body = codec.newObject();
            body.set("properties", codec.writeProperties(properties));
            return send(HttpMethod.PATCH, "/pages/{id}", body, "update page " + pageId, pageId)
                    .map(codec::readPage);
        });
    }

    @Override
    public Mono<NotionPage> archivePage(String pageId) {
        return Mono.defer(() -> {
            ObjectNode body = codec.newObject();
            body.put("archived", true);
            return send(HttpMethod.PATCH, "/pages/{id}", body, "archive page " + pageId, pageId)
                    .map(codec::readPage);
        });
    }

    @Override
    public Mono<NotionQueryResult> queryDatabase(NotionQuery query) {
        return Mono.defer(() -> {
            String databaseId = notionProperties.requireDatabaseId();
            ObjectNode body = codec.writeQuery(query);
            log.debug("Notion query database={} page_size={} cursor={} filtered={}",
                    databaseId, query.pageSize(), query.startCursor(), query.filter() != null);
            return send(HttpMethod.POST, "/databases/{id}/query", body, "query database", databaseId)
                    .map(codec::readQueryResult);
        });
    }

    @Override
    public Mono<NotionDatabase> retrieveDatabase() {
        return Mono.defer(() -> send(HttpMethod.GET, "/databases/{id}", null, "retrieve database", notionProperties.requireDatabaseId())
                .map(codec::readDatabase));
    }

    private Mono<JsonNode> send(HttpMethod method, String uriTemplate, JsonNode body, String operation, Object... uriVariables) {
        return Mono.defer(() -> {
            String apiKey = notionProperties.requireApiKey();
            WebClient.RequestBodySpec request = notionClient.method(method)
                    .uri(uriTemplate, uriVariables)
                    .headers(h -> h.setBearerAuth(apiKey));
            WebClient.RequestHeadersSpec<?> ready = body == null
                    ? request
                    : request.contentType(MediaType.APPLICATION_JSON).bodyValue(body);
            return ready.retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> toRemoteError(operation, resp))
                    .bodyToMono(JsonNode.class)
                    .switchIfEmpty(Mono.error(() -> new RemoteServiceException("Empty Notion response to " + operation, 0, null)))
                    .timeout(notionProperties.getTimeout())
                    .onErrorMap(e -> !(e instanceof SpeakerTrackerException), e -> {
                        if (e instanceof TimeoutException) {
                            log.warn("Notion {} timed out after {}", operation, notionProperties.getTimeout());
                            return new RemoteServiceException("Notion " + operation + " timed out", e);
                        }
                        log.error("Notion {} failed: {}", operation, e.toString());
                        return new RemoteServiceException("Notion " + operation + " failed: " + e.getMessage(), e);
                    });
        });
    }

    private Mono<RemoteServiceException> toRemoteError(String operation, ClientResponse resp) {
        int status = resp.statusCode().value();
        return resp.bodyToMono(String.class).defaultIfEmpty("")
                .map(raw -> {
                    String code = null;
                    String message = raw;
                    try {
                        JsonNode err = objectMapper.readTree(raw);
                        if (err != null && err.isObject()) {
                            code = err.path("code").asText(null);
                            message = err.path("message").asText(raw);
                        }
                    } catch (Exception parseError) {
                        log.debug("Notion error body is not JSON ({} bytes)", raw.length());
                    }
                    if (status == 404) {
                        log.debug("Notion {} -> 404 {}", operation, code);
                    } else {
                        log.warn("Notion {} rejected: status={} code={} message={}", operation, status, code, message);
                    }
                    return new RemoteServiceException("Notion " + operation + " failed (" + status
                            + (code != null ? " " + code : "") + "): " + message, status, code);
                });
    }
}
