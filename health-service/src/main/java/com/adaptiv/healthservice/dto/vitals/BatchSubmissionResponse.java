package com.adaptiv.healthservice.dto.vitals;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchSubmissionResponse {
    private int readingsSaved;
    private int alertsCreated;
}
