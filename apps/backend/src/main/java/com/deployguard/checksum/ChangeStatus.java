package com.deployguard.checksum;

public enum ChangeStatus {
    UNCHANGED,
    EXPECTED_CHANGED,
    UNEXPECTED_CHANGED,
    ADDED,
    REMOVED
}
