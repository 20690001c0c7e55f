package com.adaptiv.healthservice.dto.vitals;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VitalSignBatchRequest {
    @NotEmpty(message = "At least one reading is required")
    @Size(max = 1000, message = "A batch may contain at most 1000 readings")
    private List<@Valid VitalSignRequest> readings;
}
