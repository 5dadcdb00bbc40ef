package com.cgi.fielddiscovery.catalog.service;

import com.cgi.fielddiscovery.catalog.client.CatalogServiceClient;
import com.cgi.fielddiscovery.catalog.model.CatalogColumn;
import com.cgi.fielddiscovery.catalog.model.TableAsset;
import com.cgi.fielddiscovery.catalog.model.TableGroup;
import com.cgi.fielddiscovery.common.exception.CatalogException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the catalog's table assets into table-grouped units of discovery work.
 */
@Slf4j
@Service
public class CatalogAssetService {

    private final CatalogServiceClient catalogClient;

    public CatalogAssetService(CatalogServiceClient catalogClient) {
        this.catalogClient = catalogClient;
    }

    /**
     * Fetches the assets of a data source and groups their columns by (schema, table).
     * A failing listing call propagates; a failing detail call only drops that table.
     *
     * @param dataSourceId Data source identifier
     * @param schemas Optional schema scope
     * @param tables Optional table scope
     * @return Table groups in catalog order
     * @throws CatalogException If the asset listing fails
     */
    public List<TableGroup> fetchTableGroups(String dataSourceId, List<String> schemas, List<String> tables) {
        StopWatch watch = new StopWatch();
        watch.start();

        List<TableAsset> assets = catalogClient.fetchTableAssets(dataSourceId, schemas, tables);
        Map<String, TableGroup> groups = new LinkedHashMap<>();

        for (TableAsset asset : assets) {
            if (!inScope(asset, schemas, tables)) {
                log.debug("Table {} is outside the requested scope", asset.getQualifiedName());
                continue;
            }

            List<CatalogColumn> columns = asset.hasEmbeddedColumns()
                    ? asset.getEmbeddedColumns()
                    : fetchColumnsQuietly(asset);
            if (columns.isEmpty()) {
                continue;
            }

            TableGroup group = groups.computeIfAbsent(asset.getQualifiedName(), key -> TableGroup.builder()
                    .schema(asset.getSchema())
                    .tableName(asset.getTableName())
                    .assetId(asset.getId())
                    .build());
            columns.forEach(group::addColumn);
        }

        watch.stop();
        log.info("Grouped {} table assets into {} table groups for data source {} in {} ms",
                assets.size(), groups.size(), dataSourceId, watch.getTotalTimeMillis());

        return new ArrayList<>(groups.values());
    }

    private List<CatalogColumn> fetchColumnsQuietly(TableAsset asset) {
        if (asset.getId() == null) {
            log.warn("Table asset {} has no id, cannot fetch its columns", asset.getQualifiedName());
            return Collections.emptyList();
        }
        try {
            return catalogClient.fetchTableColumns(asset);
        } catch (CatalogException e) {
            log.warn("Failed to fetch columns for table {} ({}): {}",
                    asset.getQualifiedName(), asset.getId(), e.getMessage());
            return Collections.emptyList();
        }
    }

    private boolean inScope(TableAsset asset, List<String> schemas, List<String> tables) {
        boolean schemaOk = schemas == null || schemas.isEmpty() || schemas.contains(asset.getSchema());
        boolean tableOk = tables == null || tables.isEmpty() || tables.contains(asset.getTableName());
        return schemaOk && tableOk;
    }
}
