package com.adaptiv.healthservice.dto.consent;

import com.adaptiv.healthservice.models.ConsentDecision;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConsentReviewRequest {
    @NotNull(message = "Decision is required")
    private ConsentDecision decision;

    @Size(max = 500, message = "Reason must be at most 500 characters")
    private String reason;
}
