package com.gradeledger.core.model;

/**
 * Practice tests can be started any time; scheduled tests only inside their window.
 */
public enum TestMode {
    PRACTICE,
    SCHEDULED
}
