package com.cgi.fielddiscovery.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Table asset from the catalog listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableAsset {
    private String id;

    @Builder.Default
    private String schema = "public";

    @Builder.Default
    private String tableName = "unknown";

    /**
     * Columns embedded in the listing entry, when the catalog inlines them.
     */
    @Builder.Default
    private List<CatalogColumn> embeddedColumns = new ArrayList<>();

    public boolean hasEmbeddedColumns() {
        return embeddedColumns != null && !embeddedColumns.isEmpty();
    }

    public String getQualifiedName() {
        return schema + "." + tableName;
    }
}
