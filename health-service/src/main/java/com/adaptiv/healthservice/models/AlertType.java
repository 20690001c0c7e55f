package com.adaptiv.healthservice.models;

public enum AlertType {
    HIGH_HEART_RATE,
    LOW_SPO2,
    HIGH_BLOOD_PRESSURE,
    CONSENT_DISABLE_REQUEST
}
