package com.sapa.speakers.config;

import com.sapa.speakers.exception.NotionConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Notion connection settings, prefixed with "notion" in application.yml.
 * The key and database id are checked on first use so the service can boot without them.
 */
@ConfigurationProperties(prefix = "notion")
public class NotionProperties {
    /** Integration token, usually supplied through NOTION_API_KEY. */
    private String apiKey;
    /** Id of the speakers database, usually supplied through NOTION_DATABASE_ID. */
    private String databaseId;
    private String baseUrl = "https://api.notion.com/v1";
    /** Value of the Notion-Version header. */
    private String version = "2022-06-28";
    /** Per-request timeout; pagination relies on it and has none of its own. */
    private Duration timeout = Duration.ofSeconds(30);
    /** Query page size; Notion caps this at 100. */
    private int pageSize = 100;

    public String requireApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new NotionConfigurationException("notion.api-key", "NOTION_API_KEY");
        }
        return apiKey;
    }

    public String requireDatabaseId() {
        if (databaseId == null || databaseId.isBlank()) {
            throw new NotionConfigurationException("notion.database-id", "NOTION_DATABASE_ID");
        }
        return databaseId;
    }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getDatabaseId() { return databaseId; }
    public void setDatabaseId(String databaseId) { this.databaseId = databaseId; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public int getPageSize() { return pageSize; }
    public void setPageSize(int pageSize) { this.pageSize = pageSize; }
}
