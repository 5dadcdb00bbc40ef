package com.cgi.fielddiscovery.discovery.api.dto;

import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.model.enums.Sensitivity;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual classification override.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClassifyFieldRequest {

    @NotNull
    private FieldClassification classification;

    @Schema(description = "Sensitivity, defaults to the usual sensitivity of the classification")
    private Sensitivity sensitivity;
}
