package com.sapa.speakers.notion;

import java.util.List;

public record NotionQueryResult(List<NotionPage> results, boolean hasMore, String nextCursor) {

    public NotionQueryResult {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
