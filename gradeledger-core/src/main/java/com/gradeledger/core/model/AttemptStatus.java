package com.gradeledger.core.model;

public enum AttemptStatus {
    STARTED,
    SUBMITTED
}
