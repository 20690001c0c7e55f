package com.adaptiv.healthservice.models;

public enum ConsentDecision {
    APPROVE,
    REJECT
}
