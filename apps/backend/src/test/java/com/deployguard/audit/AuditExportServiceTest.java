package com.deployguard.audit;

import com.deployguard.Fixtures;
import com.deployguard.model.Finding;
import com.deployguard.model.FindingCategory;
import com.deployguard.storage.impl.InMemoryAppendOnlyStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AuditExportServiceTest {

    private Fixtures fx;
    private AuditExportService exporter;

    @BeforeEach
    void setUp() {
        fx = new Fixtures(new InMemoryAppendOnlyStore());
        exporter = new AuditExportService(fx.chains, fx.mapper);
        AuditChain chain = fx.chains.chain("exp");
        chain.append("agent, \"quoted\"", "pre", "root-1", List.of(), 0.0);
        chain.append("agent-b", "post", "root-2",
                List.of(Finding.error(FindingCategory.CHECKSUM_SCOPE_VIOLATION, "7", "record changed outside declared scope"),
                        Finding.warning(FindingCategory.ANOMALY_WARNING, "record_count", "moved")), 0.5);
    }

    @Test
    void csvHasHeaderEscapingAndCounts() {
        String csv = exporter.export("exp", null, AuditExportService.Format.CSV);
        String[] lines = csv.split("\n");

        assertThat(lines).hasSize(3);
        assertThat(lines[0]).startsWith("sequence,timestamp,actor,phase");
        assertThat(lines[1]).contains("\"agent, \"\"quoted\"\"\"");
        assertThat(lines[2]).contains(",post,root-2,0.5,1,1,");
    }

    @Test
    void ndjsonHasOneParsableEntryPerLine() throws Exception {
        String nd = exporter.export("exp", null, AuditExportService.Format.NDJSON);
        String[] lines = nd.split("\n");
        assertThat(lines).hasSize(2);
        JsonNode second = new ObjectMapper().readTree(lines[1]);
        assertThat(second.get("sequence").asLong()).isEqualTo(1);
        assertThat(second.get("findings")).hasSize(2);
        assertThat(second.get("timestamp").isTextual()).isTrue();
    }

    @Test
    void jsonRespectsQuery() throws Exception {
        String json = exporter.export("exp", AuditQuery.builder().phase("post").build(), AuditExportService.Format.JSON);
        JsonNode arr = new ObjectMapper().readTree(json);
        assertThat(arr.isArray()).isTrue();
        assertThat(arr).hasSize(1);
        assertThat(arr.get(0).get("actor").asText()).isEqualTo("agent-b");
    }

    @Test
    void asyncExportEmitsSameContent() {
        String expected = exporter.export("exp", null, AuditExportService.Format.CSV);
        StepVerifier.create(exporter.exportAsync("exp", null, AuditExportService.Format.CSV))
                .expectNext(expected)
                .verifyComplete();
    }
}
