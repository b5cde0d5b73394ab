package com.deployguard.harness;

/**
 * @param required a failing required test fails the phase; optional failures are warnings
 */
public record TestResult(String name, boolean required, boolean passed, String message, long durationMillis) {}
