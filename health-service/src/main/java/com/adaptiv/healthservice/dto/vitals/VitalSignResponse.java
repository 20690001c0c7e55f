package com.adaptiv.healthservice.dto.vitals;

import com.adaptiv.healthservice.models.VitalSignRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VitalSignResponse {
    private Long readingId;
    private UUID subjectId;
    private Integer heartRate;
    private Double spo2;
    private Integer systolicBp;
    private Integer diastolicBp;
    private Double hrv;
    private String sourceDevice;
    private String deviceId;
    private LocalDateTime timestamp;

    public static VitalSignResponse from(VitalSignRecord record) {
        return VitalSignResponse.builder()
                .readingId(record.getReadingId())
                .subjectId(record.getSubjectId())
                .heartRate(record.getHeartRate())
                .spo2(record.getSpo2())
                .systolicBp(record.getSystolicBp())
                .diastolicBp(record.getDiastolicBp())
                .hrv(record.getHrv())
                .sourceDevice(record.getSourceDevice())
                .deviceId(record.getDeviceId())
                .timestamp(record.getRecordedAt())
                .build();
    }
}
