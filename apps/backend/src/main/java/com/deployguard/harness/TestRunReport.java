package com.deployguard.harness;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record TestRunReport(int passed, int failed, List<TestResult> results) {

    public TestRunReport {
        results = List.copyOf(results);
    }

    public static TestRunReport empty() {
        return new TestRunReport(0, 0, List.of());
    }

    public int total() {
        return results.size();
    }

    @JsonIgnore
    public boolean isAllPassed() {
        return failed == 0;
    }

    public List<TestResult> requiredFailures() {
        return results.stream().filter(r -> !r.passed() && r.required()).toList();
    }

    public List<TestResult> optionalFailures() {
        return results.stream().filter(r -> !r.passed() && !r.required()).toList();
    }
}
