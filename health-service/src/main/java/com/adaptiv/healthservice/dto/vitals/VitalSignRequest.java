package com.adaptiv.healthservice.dto.vitals;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VitalSignRequest {

    @NotNull(message = "Heart rate is required")
    @Min(value = 30, message = "Heart rate must be at least 30 BPM")
    @Max(value = 250, message = "Heart rate must be at most 250 BPM")
    private Integer heartRate;

    @DecimalMin(value = "0", message = "SpO2 must be between 0 and 100")
    @DecimalMax(value = "100", message = "SpO2 must be between 0 and 100")
    private Double spo2;

    @Min(value = 70, message = "Systolic pressure must be between 70 and 250")
    @Max(value = 250, message = "Systolic pressure must be between 70 and 250")
    private Integer systolicBp;

    @Min(value = 40, message = "Diastolic pressure must be between 40 and 150")
    @Max(value = 150, message = "Diastolic pressure must be between 40 and 150")
    private Integer diastolicBp;

    @DecimalMin(value = "0", message = "HRV cannot be negative")
    private Double hrv;

    @Size(max = 64)
    private String sourceDevice;

    @Size(max = 128)
    private String deviceId;

    // Defaults to the time of submission.
    private LocalDateTime timestamp;
}
