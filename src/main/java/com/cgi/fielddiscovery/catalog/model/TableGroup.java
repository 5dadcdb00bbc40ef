package com.cgi.fielddiscovery.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Unit of discovery work: the columns of one (schema, table).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableGroup {
    private String schema;
    private String tableName;
    private String assetId;

    @Builder.Default
    private List<CatalogColumn> columns = new ArrayList<>();

    public String getQualifiedName() {
        return schema + "." + tableName;
    }

    /**
     * Adds a column unless a column with the same name is already present.
     *
     * @param column Column to add
     * @return true if the column was added
     */
    public boolean addColumn(CatalogColumn column) {
        boolean duplicate = columns.stream().anyMatch(c -> c.getName().equals(column.getName()));
        if (duplicate) {
            return false;
        }
        columns.add(column);
        return true;
    }
}
