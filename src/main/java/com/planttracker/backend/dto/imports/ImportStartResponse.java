package com.planttracker.backend.dto.imports;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ImportStartResponse {
    private String jobId;
    private ImportProgress progress;
}
