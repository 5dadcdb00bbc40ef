package com.cgi.fielddiscovery.discovery.service.queue;

import java.util.Collections;
import java.util.List;

/**
 * Request to run the discovery of one session.
 * Immutable class to ensure thread safety.
 */
public class DiscoveryTask {
    private final String sessionId;
    private final String dataSourceId;
    private final List<String> schemas;
    private final List<String> tables;
    private final boolean forceRefresh;

    /**
     * Constructor.
     *
     * @param sessionId Session to run
     * @param dataSourceId Data source to discover
     * @param schemas Schema scope, empty for all schemas
     * @param tables Table scope, empty for all tables
     * @param forceRefresh Skip result cache reads
     */
    public DiscoveryTask(String sessionId, String dataSourceId, List<String> schemas, List<String> tables,
                         boolean forceRefresh) {
        this.sessionId = sessionId;
        this.dataSourceId = dataSourceId;
        this.schemas = schemas != null ? List.copyOf(schemas) : Collections.emptyList();
        this.tables = tables != null ? List.copyOf(tables) : Collections.emptyList();
        this.forceRefresh = forceRefresh;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getDataSourceId() {
        return dataSourceId;
    }

    public List<String> getSchemas() {
        return schemas;
    }

    public List<String> getTables() {
        return tables;
    }

    public boolean isForceRefresh() {
        return forceRefresh;
    }

    @Override
    public String toString() {
        return "DiscoveryTask{session='" + sessionId + "', dataSource='" + dataSourceId
                + "', schemas=" + schemas + ", tables=" + tables + ", forceRefresh=" + forceRefresh + "}";
    }
}
