package com.sapa.speakers.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Result of a connectivity check against the configured speakers database.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConnectionStatus {
    private final boolean success;
    private final String databaseId;
    private final String databaseTitle;
    /** Expected properties that are missing or have the wrong kind, e.g. "Priority (expected select)". */
    private final List<String> schemaProblems;
    private final String error;

    private ConnectionStatus(boolean success, String databaseId, String databaseTitle, List<String> schemaProblems, String error) {
        this.success = success;
        this.databaseId = databaseId;
        this.databaseTitle = databaseTitle;
        this.schemaProblems = schemaProblems == null ? List.of() : List.copyOf(schemaProblems);
        this.error = error;
    }

    public static ConnectionStatus connected(String databaseId, String databaseTitle, List<String> schemaProblems) {
        return new ConnectionStatus(true, databaseId, databaseTitle, schemaProblems, null);
    }

    public static ConnectionStatus failed(String databaseId, String error) {
        return new ConnectionStatus(false, databaseId, null, List.of(), error);
    }

    public boolean isSuccess() { return success; }
    public String getDatabaseId() { return databaseId; }
    public String getDatabaseTitle() { return databaseTitle; }
    public List<String> getSchemaProblems() { return schemaProblems; }
    public String getError() { return error; }

    public boolean isSchemaComplete() {
        return success && schemaProblems.isEmpty();
    }
}
