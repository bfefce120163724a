package com.planttracker.backend.dto.imports;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class ConflictResolutionBatch {

    @NotEmpty(message = "At least one resolution is required")
    private List<@Valid ConflictResolutionRequest> resolutions;
}
