package com.adaptiv.healthservice.services.vitals;

import com.adaptiv.healthservice.dto.vitals.VitalSignBatchRequest;
import com.adaptiv.healthservice.dto.vitals.VitalSignRequest;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.repository.AlertRecordRepository;
import com.adaptiv.healthservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.doThrow;

/**
 * A reading and its alerts commit together: when the alert write fails the
 * reading is rolled back with it.
 */
class VitalSignIngestionAtomicityTest extends IntegrationTestSupport {

    @Autowired
    private VitalSignService vitalSignService;

    @SpyBean
    private AlertRecordRepository failingAlerts;

    private Account patient;

    @BeforeEach
    void setUp() {
        patient = patient("pat@example.com");
    }

    @Test
    void alertWriteFailureRollsBackReading() {
        doThrow(new DataIntegrityViolationException("alerts unavailable")).when(failingAlerts).saveAll(anyIterable());

        VitalSignRequest reading = VitalSignRequest.builder().heartRate(190).spo2(97.0).build();

        assertThrows(DataIntegrityViolationException.class,
                () -> vitalSignService.ingest(patient.getAccountId(), reading));

        assertEquals(0, vitalSignRepository.countBySubjectId(patient.getAccountId()));
        assertEquals(0, alertRepository.findBySubjectId(patient.getAccountId()).size());
    }

    @Test
    void failureMidBatchRollsBackEarlierReadings() {
        doThrow(new DataIntegrityViolationException("alerts unavailable")).when(failingAlerts).saveAll(anyIterable());

        VitalSignBatchRequest batch = new VitalSignBatchRequest(List.of(
                VitalSignRequest.builder().heartRate(72).spo2(98.0).build(),
                VitalSignRequest.builder().heartRate(75).spo2(97.0).build(),
                VitalSignRequest.builder().heartRate(200).spo2(97.0).build()));

        assertThrows(DataIntegrityViolationException.class,
                () -> vitalSignService.submitBatch(identity(patient), batch));

        assertEquals(0, vitalSignRepository.countBySubjectId(patient.getAccountId()));
    }

    @Test
    void normalReadingIsStoredWithoutAlerts() {
        VitalSignRequest reading = VitalSignRequest.builder().heartRate(72).spo2(98.0).systolicBp(118).build();

        assertEquals(0, vitalSignService.ingest(patient.getAccountId(), reading).getAlertsCreated());
        assertEquals(1, vitalSignRepository.countBySubjectId(patient.getAccountId()));
    }
}
