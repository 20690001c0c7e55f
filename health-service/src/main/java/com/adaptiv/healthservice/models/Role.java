package com.adaptiv.healthservice.models;

/**
 * Closed set of account roles. Admins manage accounts but never see clinical data.
 */
public enum Role {
    PATIENT,
    CLINICIAN,
    ADMIN
}
