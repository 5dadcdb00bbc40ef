package com.cgi.fielddiscovery.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Column of a cataloged table, as returned by the asset detail endpoint.
 * Missing attributes are already substituted with defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogColumn {
    private String id;
    private String name;

    @Builder.Default
    private String dataType = "unknown";

    @Builder.Default
    private boolean nullable = true;

    private String description;

    /**
     * Sample values supplied by the catalog, may be empty.
     */
    @Builder.Default
    private List<String> sampleValues = new ArrayList<>();

    public boolean hasSampleValues() {
        return sampleValues != null && !sampleValues.isEmpty();
    }
}
