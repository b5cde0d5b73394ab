package com.deployguard.harness;

import com.deployguard.model.Dataset;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Ordered registry of {@link DataTest}s run against one dataset. Not thread-safe while being
 * populated; {@link #run} only reads the registrations.
 */
@Slf4j
public class TestHarness {

    private final List<Registration> tests = new ArrayList<>();

    public TestHarness register(String name, DataTest test) {
        tests.add(new Registration(name, test, true));
        return this;
    }

    /** Predicate form: {@code false} is a failure. */
    public TestHarness registerCheck(String name, Predicate<Dataset> predicate) {
        return register(name, d -> TestOutcome.of(predicate.test(d), name + " returned false"));
    }

    public TestHarness registerOptional(String name, DataTest test) {
        tests.add(new Registration(name, test, false));
        return this;
    }

    public TestHarness registerOptionalCheck(String name, Predicate<Dataset> predicate) {
        return registerOptional(name, d -> TestOutcome.of(predicate.test(d), name + " returned false"));
    }

    /** Appends every test of {@code suite}, keeping its required/optional flags. */
    public TestHarness include(TestHarness suite) {
        tests.addAll(suite.tests);
        return this;
    }

    public int size() {
        return tests.size();
    }

    public List<String> names() {
        return tests.stream().map(Registration::name).toList();
    }

    public TestRunReport run(Dataset dataset) {
        List<TestResult> results = new ArrayList<>(tests.size());
        int passed = 0;
        int failed = 0;
        for (Registration t : tests) {
            long start = System.nanoTime();
            TestOutcome outcome;
            try {
                outcome = t.test().check(dataset);
                if (outcome == null) outcome = TestOutcome.pass();
            } catch (Exception e) {
                if (e instanceof InterruptedException) Thread.currentThread().interrupt();
                log.debug("Data test '{}' threw", t.name(), e);
                outcome = TestOutcome.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            long ms = (System.nanoTime() - start) / 1_000_000;
            results.add(new TestResult(t.name(), t.required(), outcome.passed(), outcome.message(), ms));
            if (outcome.passed()) {
                passed++;
            } else {
                failed++;
                log.info("Data test failed: {} ({}){}", t.name(), t.required() ? "required" : "optional",
                        outcome.message() == null ? "" : " - " + outcome.message());
            }
        }
        log.debug("Data tests: {}/{} passed", passed, tests.size());
        return new TestRunReport(passed, failed, results);
    }

    private record Registration(String name, DataTest test, boolean required) {}
}
