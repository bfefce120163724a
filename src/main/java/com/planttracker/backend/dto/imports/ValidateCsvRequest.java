package com.planttracker.backend.dto.imports;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ValidateCsvRequest {

    @NotBlank(message = "CSV content is required")
    private String csvContent;

    @NotBlank(message = "Import type is required")
    private String importType;

    @Valid
    private ImportConfig config; // Optional - defaults apply
}
