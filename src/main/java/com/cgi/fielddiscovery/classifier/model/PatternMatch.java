package com.cgi.fielddiscovery.classifier.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A named pattern that matched a field, by name or by sample values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternMatch {
    private String type;
    private String pattern;
    private int matches;

    @Builder.Default
    private List<String> samples = new ArrayList<>();

    private double confidence;
}
