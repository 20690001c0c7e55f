package com.adaptiv.healthservice.dto.consent;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DisableConsentRequest {
    @Size(max = 500, message = "Reason must be at most 500 characters")
    private String reason;
}
