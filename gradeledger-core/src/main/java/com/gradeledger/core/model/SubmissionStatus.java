package com.gradeledger.core.model;

public enum SubmissionStatus {
    SUBMITTED,
    RESUBMITTED
}
