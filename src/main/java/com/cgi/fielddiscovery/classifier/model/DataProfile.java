package com.cgi.fielddiscovery.classifier.model;

import com.cgi.fielddiscovery.classifier.model.enums.Distribution;
import com.cgi.fielddiscovery.classifier.model.enums.ValueFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Statistical profile of a field's sample values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataProfile {
    private double uniqueness;
    private double nullability;
    private int cardinality;
    private double entropy;

    @Builder.Default
    private Distribution distribution = Distribution.UNKNOWN;

    @Builder.Default
    private ValueFormat format = ValueFormat.UNKNOWN;

    public static DataProfile empty() {
        return DataProfile.builder().build();
    }
}
