package com.adaptiv.healthservice.models;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL,
    EMERGENCY
}
