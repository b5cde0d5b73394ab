package com.deployguard.pipeline;

import com.deployguard.util.StoredJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

/**
 * JSON and plain-text renderings of phase reports for CI callers.
 */
@Component
public class ReportExporter {

    private final ObjectMapper mapper;

    public ReportExporter(ObjectMapper objectMapper) {
        this.mapper = StoredJson.mapper(objectMapper).enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(PhaseReport report) {
        return write(report);
    }

    public String toJson(PipelineRun run) {
        return write(run);
    }

    /** Short human-readable summary; always states whether rollback was triggered and why. */
    public String summary(PhaseReport r) {
        StringBuilder sb = new StringBuilder();
        sb.append(r.phase()).append(' ').append(r.status())
                .append(" session=").append(r.sessionId())
                .append(" state=").append(r.state())
                .append(" risk=").append(r.riskScore()).append('\n');
        sb.append("  errors=").append(r.errors().size())
                .append(" warnings=").append(r.warnings().size())
                .append(" audit=").append(r.auditEntryId()).append('\n');
        if (r.phase() == Phase.POST) {
            sb.append("  rollback: ").append(r.rollbackTriggered() ? "TRIGGERED" : "not triggered").append('\n');
            r.rollbackReasons().forEach(reason -> sb.append("    - ").append(reason).append('\n'));
        }
        r.warnings().forEach(w -> sb.append("  warning: ").append(w).append('\n'));
        return sb.toString();
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render report", e);
        }
    }
}
