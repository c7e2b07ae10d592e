package com.sapa.speakers.notion;

/**
 * One database query request. A null filter queries every row; a null cursor starts from the first page.
 */
public record NotionQuery(FilterExpression filter, int pageSize, String startCursor) {
}
