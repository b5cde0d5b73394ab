package com.deployguard;

import com.deployguard.audit.AuditChainRegistry;
import com.deployguard.audit.AuditIncidentListener;
import com.deployguard.audit.AuditTamperDetectedEvent;
import com.deployguard.audit.dto.AuditVerifyReport;
import com.deployguard.config.IntegrityProperties;
import com.deployguard.model.Dataset;
import com.deployguard.pipeline.PipelineRun;
import com.deployguard.pipeline.PipelineState;
import com.deployguard.pipeline.PreOptions;
import com.deployguard.pipeline.ValidationPipeline;
import com.deployguard.pipeline.ValidationPipelineFactory;
import com.deployguard.storage.AppendOnlyStore;
import com.deployguard.storage.impl.InMemoryAppendOnlyStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Set;

import static com.deployguard.Fixtures.customers;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class DeployGuardApplicationTests {

    @Autowired
    private IntegrityProperties props;

    @Autowired
    private AppendOnlyStore store;

    @Autowired
    private ValidationPipelineFactory pipelines;

    @Autowired
    private AuditChainRegistry chains;

    @Autowired
    private AuditIncidentListener incidents;

    @Autowired
    private ApplicationEventPublisher publisher;

    @Test
    void bindsIntegrityProperties() {
        assertThat(props.getStorage().getType()).isEqualTo("memory");
        assertThat(props.getPipeline().getIdentityField()).isEqualTo("id");
        assertThat(props.getAnomaly().getRecordCountCritical()).isEqualTo(100.0);
        assertThat(props.getAnomaly().getMeanSizeCritical()).isNull();
        assertThat(props.getAudit().getAlertThreshold()).isEqualTo(0.75);
        assertThat(store).isInstanceOf(InMemoryAppendOnlyStore.class);
    }

    @Test
    void runsADeploymentEndToEnd() {
        ValidationPipeline p = pipelines.create("context-deploy");
        Dataset input = pipelines.dataset("crm", customers(5));

        PipelineRun run = p.execute(input,
                d -> d.mapRecord("4", r -> r.with("status", "inactive")),
                PreOptions.builder().scope(Set.of("4")).build());

        assertThat(run.state()).isEqualTo(PipelineState.COMPLETED);
        assertThat(chains.chainIds()).contains("context-deploy");
        assertThat(chains.chain("context-deploy").verify().ok()).isTrue();
    }

    @Test
    void highRiskRunsReachTheIncidentListener() {
        ValidationPipeline p = pipelines.create("context-alerts");
        Dataset input = pipelines.dataset("crm", customers(4));

        p.execute(input,
                d -> d.mapRecord("1", r -> r.with("status", "x")).mapRecord("2", r -> r.with("status", "y")),
                PreOptions.defaults());

        assertThat(incidents.recentAlerts()).anySatisfy(a -> assertThat(a.chainId()).isEqualTo("context-alerts"));
    }

    @Test
    void tamperEventsAreRecorded() {
        AuditVerifyReport report = new AuditVerifyReport("context-tamper", 3, false, 1, List.of(), "abc");

        publisher.publishEvent(new AuditTamperDetectedEvent(report));

        assertThat(incidents.recentIncidents()).contains(report);
    }
}
