package com.sapa.speakers.service;

import com.sapa.speakers.config.NotionProperties;
import com.sapa.speakers.exception.RemoteServiceException;
import com.sapa.speakers.exception.SpeakerNotFoundException;
import com.sapa.speakers.exception.SpeakerValidationException;
import com.sapa.speakers.model.ConnectionStatus;
import com.sapa.speakers.model.SearchFilter;
import com.sapa.speakers.model.Speaker;
import com.sapa.speakers.model.SpeakerCreate;
import com.sapa.speakers.model.SpeakerGrouping;
import com.sapa.speakers.model.SpeakerListing;
import com.sapa.speakers.model.SpeakerUpdate;
import com.sapa.speakers.notion.FilterExpression;
import com.sapa.speakers.notion.NotionDatabase;
import com.sapa.speakers.notion.NotionPage;
import com.sapa.speakers.notion.NotionQuery;
import com.sapa.speakers.notion.NotionTransport;
import com.sapa.speakers.notion.PropertyValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Speaker operations against the Notion speakers database. Nothing is cached: every read goes to
 * Notion, and concurrent updates to one speaker are arbitrated by Notion (last write wins).
 * Each operation runs its remote calls one after another; none are retried.
 */
@Service
public class SpeakerRepository {
    private static final Logger log = LoggerFactory.getLogger(SpeakerRepository.class);
    private static final int MAX_PAGE_SIZE = 100;

    private final NotionTransport transport;
    private final SpeakerPropertyMapper mapper;
    private final NotionProperties notionProperties;

    public SpeakerRepository(NotionTransport transport, SpeakerPropertyMapper mapper, NotionProperties notionProperties) {
        this.transport = transport;
        this.mapper = mapper;
        this.notionProperties = notionProperties;
    }

    public Mono<Speaker> addSpeaker(SpeakerCreate create) {
        return Mono.defer(() -> {
            Map<String, PropertyValue> properties = mapper.toRemoteProperties(create);
            return transport.createPage(properties)
                    .map(mapper::fromRemoteRecord)
                    .doOnNext(s -> log.info("Added speaker '{}' id={}", s.getName(), s.getId()));
        });
    }

    public Mono<Speaker> getSpeaker(String id) {
        return Mono.defer(() -> {
            String pageId = requireId(id);
            return transport.retrievePage(pageId)
                    .onErrorMap(SpeakerRepository::isNotFound, e -> new SpeakerNotFoundException(pageId, e))
                    .map(page -> {
                        if (page.archived()) {
                            throw new SpeakerNotFoundException(pageId);
                        }
                        return mapper.fromRemoteRecord(page);
                    });
        });
    }

    /**
     * Drains Notion's cursor pagination until there are no more pages or {@code limit} speakers
     * were collected. Results keep Notion's order. A failure on any page fails the whole search.
     */
    public Mono<List<Speaker>> searchSpeakers(SearchFilter filter, Integer limit) {
        return Mono.defer(() -> {
            if (limit != null && limit <= 0) {
                throw new SpeakerValidationException("limit", "limit must be positive");
            }
            FilterExpression expression = SpeakerFilterBuilder.build(filter);
            return drain(expression, limit, null, new ArrayList<>(), 1);
        });
    }

    private Mono<List<Speaker>> drain(FilterExpression filter, Integer limit, String cursor, List<Speaker> acc, int pageNo) {
        int pageSize = limit == null ? pageSize() : Math.min(pageSize(), limit - acc.size());
        return transport.queryDatabase(new NotionQuery(filter, pageSize, cursor))
                .flatMap(result -> {
                    for (NotionPage page : result.results()) {
                        if (limit != null && acc.size() >= limit) break;
                        acc.add(mapper.fromRemoteRecord(page));
                    }
                    boolean full = limit != null && acc.size() >= limit;
                    if (full || !result.hasMore() || result.nextCursor() == null) {
                        log.debug("Search drained pages={} speakers={} limitReached={}", pageNo, acc.size(), full);
                        return Mono.just(acc);
                    }
                    return drain(filter, limit, result.nextCursor(), acc, pageNo + 1);
                });
    }

    /**
     * Applies only the supplied fields, then re-reads the page so the caller sees what Notion
     * actually persisted (select options may be created or normalised on write).
     */
    public Mono<Speaker> updateSpeaker(String id, SpeakerUpdate updates) {
        return Mono.defer(() -> {
            String pageId = requireId(id);
            Map<String, PropertyValue> properties = mapper.toRemoteProperties(updates);
            if (properties.isEmpty()) {
                return getSpeaker(pageId);
            }
            return transport.updatePage(pageId, properties)
                    .onErrorMap(SpeakerRepository::isNotFound, e -> new SpeakerNotFoundException(pageId, e))
                    .doOnNext(p -> log.info("Updated speaker id={} fields={}", pageId, properties.keySet()))
                    .then(getSpeaker(pageId));
        });
    }

    public Mono<SpeakerListing> listSpeakers(SpeakerGrouping groupBy, Integer limit) {
        return searchSpeakers(SearchFilter.none(), limit)
                .map(speakers -> {
                    if (groupBy == null) {
                        return new SpeakerListing(speakers, null, null);
                    }
                    // Grouped after the full drain so no group is split across page boundaries
                    Map<String, List<Speaker>> groups = new LinkedHashMap<>();
                    for (Speaker s : speakers) {
                        groups.computeIfAbsent(groupBy.groupOf(s), k -> new ArrayList<>()).add(s);
                    }
                    return new SpeakerListing(speakers, groupBy, groups);
                });
    }

    /** Soft delete: Notion keeps archived pages restorable from its trash. */
    public Mono<Void> archiveSpeaker(String id) {
        return Mono.defer(() -> {
            String pageId = requireId(id);
            return transport.archivePage(pageId)
                    .onErrorMap(SpeakerRepository::isNotFound, e -> new SpeakerNotFoundException(pageId, e))
                    .doOnNext(p -> log.info("Archived speaker id={}", pageId))
                    .then();
        });
    }

    /**
     * Diagnostic read of the database metadata. Never signals an error; failures are reported in
     * the returned status, along with any expected property that is missing or has the wrong kind.
     */
    public Mono<ConnectionStatus> testConnection() {
        return Mono.defer(transport::retrieveDatabase)
                .map(db -> ConnectionStatus.connected(db.id(), db.title(), schemaProblems(db)))
                .onErrorResume(e -> {
                    log.warn("Notion connection check failed: {}", e.getMessage());
                    return Mono.just(ConnectionStatus.failed(notionProperties.getDatabaseId(), e.getMessage()));
                });
    }

    private static List<String> schemaProblems(NotionDatabase db) {
        List<String> problems = new ArrayList<>();
        for (SpeakerProperty property : SpeakerProperty.values()) {
            String actual = db.propertyTypes().get(property.propertyName());
            String expected = property.kind().wireName();
            if (actual == null) {
                problems.add(property.propertyName() + " (missing, expected " + expected + ")");
            } else if (!actual.equals(expected)) {
                problems.add(property.propertyName() + " (is " + actual + ", expected " + expected + ")");
            }
        }
        return problems;
    }

    private int pageSize() {
        int configured = notionProperties.getPageSize();
        return configured <= 0 ? MAX_PAGE_SIZE : Math.min(configured, MAX_PAGE_SIZE);
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new SpeakerValidationException("speaker_id", "speaker_id is required");
        }
        return id.trim();
    }

    private static boolean isNotFound(Throwable e) {
        return e instanceof RemoteServiceException r && r.isNotFound();
    }
}
