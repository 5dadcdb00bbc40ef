package com.cgi.fielddiscovery.discovery.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request to start a discovery session.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartDiscoveryRequest {

    @NotBlank
    @Schema(description = "Data source to discover", requiredMode = Schema.RequiredMode.REQUIRED)
    private String dataSourceId;

    @Schema(description = "Schemas to include, all schemas when empty")
    private List<String> schemas = new ArrayList<>();

    @Schema(description = "Tables to include, all tables when empty")
    private List<String> tables = new ArrayList<>();

    @Schema(description = "Ignore cached analyses")
    private boolean forceRefresh;
}
