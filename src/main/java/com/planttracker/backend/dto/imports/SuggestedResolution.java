package com.planttracker.backend.dto.imports;

import com.planttracker.backend.enums.SuggestedAction;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class SuggestedResolution {
    private String conflictId;
    private SuggestedAction recommended;
    private List<SuggestedAction> allowedActions;
}
