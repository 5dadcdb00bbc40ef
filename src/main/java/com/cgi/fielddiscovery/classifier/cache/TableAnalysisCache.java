package com.cgi.fielddiscovery.classifier.cache;

import com.cgi.fielddiscovery.catalog.model.CatalogColumn;
import com.cgi.fielddiscovery.catalog.model.TableGroup;
import com.cgi.fielddiscovery.classifier.model.FieldAnalysis;
import com.cgi.fielddiscovery.classifier.model.TableAnalysis;
import com.cgi.fielddiscovery.classifier.service.ClassificationMetricsCollector;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-through cache of table analyses keyed by the content fingerprint of the table group.
 * A failing store never fails the caller: read errors count as misses and write errors are logged.
 */
@Slf4j
@Component
public class TableAnalysisCache {

    private final ResultCache store;
    private final FingerprintGenerator fingerprintGenerator;
    private final ObjectMapper objectMapper;
    private final ClassificationMetricsCollector metricsCollector;
    private final Duration ttl;
    private final String keyPrefix;

    public TableAnalysisCache(ResultCache store,
                              FingerprintGenerator fingerprintGenerator,
                              ObjectMapper objectMapper,
                              ClassificationMetricsCollector metricsCollector,
                              @Value("${fielddiscovery.cache.field-analysis-ttl-seconds:3600}") long ttlSeconds,
                              @Value("${fielddiscovery.cache.key-prefix:field_analysis:}") String keyPrefix) {
        this.store = store;
        this.fingerprintGenerator = fingerprintGenerator;
        this.objectMapper = objectMapper;
        this.metricsCollector = metricsCollector;
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.keyPrefix = keyPrefix;
    }

    /**
     * Looks up a previous analysis of identical table content.
     *
     * @param group Table group
     * @return Cached analysis, empty on a miss or a store failure
     */
    public Optional<TableAnalysis> lookup(TableGroup group) {
        try {
            Optional<String> cached = store.get(key(group));
            if (cached.isEmpty()) {
                metricsCollector.recordCacheMiss();
                return Optional.empty();
            }
            TableAnalysis analysis = objectMapper.readValue(cached.get(), TableAnalysis.class);
            metricsCollector.recordCacheHit();
            log.debug("Cache hit for table {}", group.getQualifiedName());
            return Optional.of(rebind(analysis, group));
        } catch (Exception e) {
            metricsCollector.recordCacheError();
            metricsCollector.recordCacheMiss();
            log.warn("Cache read failed for table {}, recomputing: {}", group.getQualifiedName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stores an analysis under the fingerprint of its table group.
     *
     * @param group Table group the analysis was computed from
     * @param analysis Analysis to store
     */
    public void store(TableGroup group, TableAnalysis analysis) {
        try {
            store.put(key(group), objectMapper.writeValueAsString(analysis), ttl);
        } catch (Exception e) {
            metricsCollector.recordCacheError();
            log.warn("Cache write failed for table {}: {}", group.getQualifiedName(), e.getMessage());
        }
    }

    /**
     * Only classification results are shared through the cache. Catalog identity (asset and column ids)
     * always comes from the group being analysed, since equal content may live in another data source.
     */
    static TableAnalysis rebind(TableAnalysis cached, TableGroup group) {
        Map<String, CatalogColumn> liveColumns = new HashMap<>();
        for (CatalogColumn column : group.getColumns()) {
            liveColumns.putIfAbsent(column.getName(), column);
        }

        List<FieldAnalysis> fields = new ArrayList<>(cached.getFields().size());
        for (FieldAnalysis field : cached.getFields()) {
            CatalogColumn live = field.getColumn() != null ? liveColumns.get(field.getColumn().getName()) : null;
            fields.add(FieldAnalysis.builder()
                    .column(live != null ? live : field.getColumn())
                    .result(field.getResult())
                    .build());
        }

        return TableAnalysis.builder()
                .schema(group.getSchema())
                .tableName(group.getTableName())
                .assetId(group.getAssetId())
                .fields(fields)
                .degraded(cached.isDegraded())
                .build();
    }

    private String key(TableGroup group) {
        return keyPrefix + fingerprintGenerator.fingerprint(group);
    }
}
