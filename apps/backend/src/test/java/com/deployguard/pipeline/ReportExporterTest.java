package com.deployguard.pipeline;

import com.deployguard.Fixtures;
import com.deployguard.model.Dataset;
import com.deployguard.storage.impl.InMemoryAppendOnlyStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.deployguard.Fixtures.customers;
import static com.deployguard.Fixtures.dataset;
import static org.assertj.core.api.Assertions.assertThat;

class ReportExporterTest {

    private final Fixtures fx = new Fixtures(new InMemoryAppendOnlyStore());
    private final ReportExporter exporter = new ReportExporter(new ObjectMapper());

    private PipelineRun rolledBackRun() {
        ValidationPipeline p = fx.pipelines.create("export");
        return p.execute(dataset(customers(3)),
                d -> d.mapRecord("3", r -> r.with("status", "inactive")),
                PreOptions.builder().scope(Set.of("1")).build());
    }

    @Test
    void jsonCarriesTheDecisionAndFindings() throws Exception {
        PipelineRun run = rolledBackRun();

        JsonNode post = new ObjectMapper().readTree(exporter.toJson(run.post()));

        assertThat(post.get("phase").asText()).isEqualTo("POST");
        assertThat(post.get("status").asText()).isEqualTo("FAILED");
        assertThat(post.get("rollbackTriggered").asBoolean()).isTrue();
        assertThat(post.get("errors").get(0).get("category").asText()).isEqualTo("CHECKSUM_SCOPE_VIOLATION");
        assertThat(post.get("auditEntryId").asText()).isEqualTo("export#1");
        assertThat(post.get("startedAt").isTextual()).isTrue();
    }

    @Test
    void wholeRunIsRendered() throws Exception {
        JsonNode run = new ObjectMapper().readTree(exporter.toJson(rolledBackRun()));

        assertThat(run.get("state").asText()).isEqualTo("ROLLED_BACK");
        assertThat(run.get("pre").get("status").asText()).isEqualTo("PASSED");
        assertThat(run.get("output").get("records")).hasSize(3);
    }

    @Test
    void summaryStatesRollbackAndReasons() {
        PipelineRun run = rolledBackRun();

        String summary = exporter.summary(run.post());

        assertThat(summary).startsWith("POST FAILED");
        assertThat(summary).contains("rollback: TRIGGERED");
        assertThat(summary).contains("- CHECKSUM_SCOPE_VIOLATION[3]");
        assertThat(exporter.summary(run.pre())).doesNotContain("rollback");
    }

    @Test
    void passingPostSaysNotTriggered() {
        ValidationPipeline p = fx.pipelines.create();
        Dataset input = dataset(customers(2));
        p.runPre(input);

        assertThat(exporter.summary(p.runPost(input))).contains("rollback: not triggered");
    }
}
