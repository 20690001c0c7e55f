package com.adaptiv.healthservice.models;

public enum ShareState {
    ON,
    DISABLE_REQUESTED,
    OFF;

    /**
     * Clinicians keep access while a disable request is waiting for review.
     */
    public boolean permitsClinicianAccess() {
        return this != OFF;
    }
}
