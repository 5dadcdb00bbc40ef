package com.cgi.fielddiscovery.classifier.model;

import com.cgi.fielddiscovery.catalog.model.CatalogColumn;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldAnalysis {
    private CatalogColumn column;
    private ClassificationResult result;
}
