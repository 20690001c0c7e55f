package com.adaptiv.healthservice.services.alerts;

import com.adaptiv.healthservice.models.AlertType;
import com.adaptiv.healthservice.models.Severity;
import com.adaptiv.healthservice.models.VitalSignRecord;
import lombok.Getter;

import java.util.Optional;
import java.util.function.Function;

/**
 * Fixed clinical limits. Boundaries are strict: a reading exactly at the limit does not fire.
 */
@Getter
public enum VitalThreshold {

    HIGH_HEART_RATE(AlertType.HIGH_HEART_RATE, Severity.CRITICAL, 180, true,
            VitalSignRecord::getHeartRate,
            "High Heart Rate Detected",
            "Heart rate of %s BPM is above the safe limit of %s BPM.",
            "Stop activity and rest. Contact your clinician if your heart rate stays elevated."),

    LOW_SPO2(AlertType.LOW_SPO2, Severity.CRITICAL, 90, false,
            VitalSignRecord::getSpo2,
            "Low Blood Oxygen Detected",
            "Blood oxygen saturation of %s%% is below the safe limit of %s%%.",
            "Stop activity, sit upright and breathe slowly. Seek medical help if it does not recover."),

    HIGH_BLOOD_PRESSURE(AlertType.HIGH_BLOOD_PRESSURE, Severity.WARNING, 160, true,
            VitalSignRecord::getSystolicBp,
            "High Blood Pressure Detected",
            "Systolic blood pressure of %s mmHg is above the limit of %s mmHg.",
            "Rest and re-measure in a few minutes. Inform your clinician if it remains high.");

    private final AlertType alertType;
    private final Severity severity;
    private final double limit;
    private final boolean upperLimit;
    private final Function<VitalSignRecord, ? extends Number> reading;
    private final String title;
    private final String messageTemplate;
    private final String actionRequired;

    VitalThreshold(AlertType alertType, Severity severity, double limit, boolean upperLimit,
                   Function<VitalSignRecord, ? extends Number> reading,
                   String title, String messageTemplate, String actionRequired) {
        this.alertType = alertType;
        this.severity = severity;
        this.limit = limit;
        this.upperLimit = upperLimit;
        this.reading = reading;
        this.title = title;
        this.messageTemplate = messageTemplate;
        this.actionRequired = actionRequired;
    }

    /**
     * The offending value, or empty when the measurement is absent or within range.
     */
    public Optional<Double> breach(VitalSignRecord record) {
        Number value = reading.apply(record);
        if (value == null) {
            return Optional.empty();
        }
        double measured = value.doubleValue();
        boolean breached = upperLimit ? measured > limit : measured < limit;
        return breached ? Optional.of(measured) : Optional.empty();
    }

    public String describe(double measured) {
        return String.format(messageTemplate, format(measured), format(limit));
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
