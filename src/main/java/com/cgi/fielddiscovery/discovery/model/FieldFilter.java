package com.cgi.fielddiscovery.discovery.model;

import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import com.cgi.fielddiscovery.discovery.model.enums.Sensitivity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filter and page window for discovered-field queries. Null criteria are ignored.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FieldFilter {
    public static final int DEFAULT_LIMIT = 50;

    private String dataSourceId;
    private String schema;
    private String table;
    private FieldStatus status;
    private FieldClassification classification;
    private Sensitivity sensitivity;

    /**
     * Case-insensitive substring matched against field name, table name and description.
     */
    private String search;

    @Builder.Default
    private int limit = DEFAULT_LIMIT;

    private int offset;
}
