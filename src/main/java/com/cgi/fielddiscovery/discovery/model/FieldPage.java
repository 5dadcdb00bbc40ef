package com.cgi.fielddiscovery.discovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldPage {
    @Builder.Default
    private List<DiscoveredField> fields = new ArrayList<>();

    private long total;
    private int limit;
    private int offset;
}
