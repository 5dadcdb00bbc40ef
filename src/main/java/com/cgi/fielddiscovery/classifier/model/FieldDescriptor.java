package com.cgi.fielddiscovery.classifier.model;

import com.cgi.fielddiscovery.catalog.model.CatalogColumn;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity and declared metadata of a field submitted for classification.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldDescriptor {
    private String name;

    @Builder.Default
    private String dataType = "unknown";

    private String tableName;
    private String schema;

    @Builder.Default
    private boolean nullable = true;

    private String description;

    public static FieldDescriptor of(CatalogColumn column, String schema, String tableName) {
        return FieldDescriptor.builder()
                .name(column.getName())
                .dataType(column.getDataType())
                .nullable(column.isNullable())
                .description(column.getDescription())
                .schema(schema)
                .tableName(tableName)
                .build();
    }
}
