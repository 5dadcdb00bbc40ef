package com.cgi.fielddiscovery.discovery.model;

import com.cgi.fielddiscovery.discovery.model.enums.BulkAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-item outcome of a bulk review action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkUpdateResult {
    private BulkAction action;
    private int requested;

    @Builder.Default
    private List<String> succeeded = new ArrayList<>();

    /**
     * Failure reason by field id.
     */
    @Builder.Default
    private Map<String, String> failed = new LinkedHashMap<>();
}
