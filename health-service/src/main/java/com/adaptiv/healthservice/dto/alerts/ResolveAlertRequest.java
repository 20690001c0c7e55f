package com.adaptiv.healthservice.dto.alerts;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveAlertRequest {
    @Size(max = 1000, message = "Resolution notes must be at most 1000 characters")
    private String resolutionNotes;
}
