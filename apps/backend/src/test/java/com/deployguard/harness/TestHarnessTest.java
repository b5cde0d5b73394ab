package com.deployguard.harness;

import com.deployguard.model.Dataset;
import org.junit.jupiter.api.Test;

import static com.deployguard.Fixtures.customers;
import static com.deployguard.Fixtures.dataset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TestHarnessTest {

    private final Dataset data = dataset(customers(3));

    @Test
    void throwingTestIsAFailureAndTheRunContinues() {
        TestRunReport report = new TestHarness()
                .register("explodes", d -> {
                    throw new IllegalStateException("kaboom");
                })
                .registerCheck("has three", d -> d.size() == 3)
                .run(data);

        assertEquals(1, report.passed());
        assertEquals(1, report.failed());
        assertThat(report.results()).extracting(TestResult::name).containsExactly("explodes", "has three");
        assertThat(report.results().get(0).message()).isEqualTo("IllegalStateException: kaboom");
        assertThat(report.isAllPassed()).isFalse();
    }

    @Test
    void interruptedTestKeepsTheInterruptFlag() {
        try {
            TestRunReport report = new TestHarness()
                    .register("waits", d -> {
                        throw new InterruptedException("cancelled");
                    })
                    .run(data);

            assertThat(report.results().get(0).passed()).isFalse();
            assertThat(report.results().get(0).message()).isEqualTo("InterruptedException: cancelled");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void optionalFailuresAreSeparatedFromRequiredOnes() {
        TestRunReport report = new TestHarness()
                .registerCheck("required", d -> false)
                .registerOptionalCheck("optional", d -> false)
                .registerOptional("optional pass", d -> TestOutcome.pass())
                .run(data);

        assertThat(report.requiredFailures()).extracting(TestResult::name).containsExactly("required");
        assertThat(report.optionalFailures()).extracting(TestResult::name).containsExactly("optional");
        assertThat(report.requiredFailures().get(0).message()).isEqualTo("required returned false");
        assertEquals(3, report.total());
    }

    @Test
    void nullOutcomeCountsAsPass() {
        TestRunReport report = new TestHarness().register("silent", d -> null).run(data);
        assertThat(report.isAllPassed()).isTrue();
    }

    @Test
    void includeKeepsOrderAndFlags() {
        TestHarness suite = new TestHarness()
                .registerCheck("a", d -> true)
                .registerOptionalCheck("b", d -> false);
        TestHarness h = new TestHarness().registerCheck("first", d -> true).include(suite);

        assertThat(h.names()).containsExactly("first", "a", "b");
        assertThat(h.run(data).optionalFailures()).extracting(TestResult::name).containsExactly("b");
    }

    @Test
    void emptyHarnessPasses() {
        TestRunReport report = new TestHarness().run(data);
        assertEquals(0, report.total());
        assertThat(report.isAllPassed()).isTrue();
    }
}
