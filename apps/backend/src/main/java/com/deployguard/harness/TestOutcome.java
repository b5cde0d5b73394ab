package com.deployguard.harness;

public record TestOutcome(boolean passed, String message) {

    public static TestOutcome pass() {
        return new TestOutcome(true, null);
    }

    public static TestOutcome fail(String message) {
        return new TestOutcome(false, message);
    }

    public static TestOutcome of(boolean passed, String failureMessage) {
        return passed ? pass() : fail(failureMessage);
    }
}
