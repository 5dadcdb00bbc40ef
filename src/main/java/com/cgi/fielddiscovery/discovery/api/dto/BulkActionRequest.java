package com.cgi.fielddiscovery.discovery.api.dto;

import com.cgi.fielddiscovery.discovery.model.enums.BulkAction;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkActionRequest {

    @NotEmpty
    private List<String> fieldIds = new ArrayList<>();

    @NotNull
    private BulkAction action;
}
