package com.cgi.fielddiscovery.discovery.api.dto;

import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateStatusRequest {

    @NotNull
    private FieldStatus status;
}
