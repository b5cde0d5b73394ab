package com.deployguard.audit;

import com.deployguard.model.Finding;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class AuditExportService {

    public enum Format { JSON, NDJSON, CSV }

    static final String CSV_HEADER =
            "sequence,timestamp,actor,phase,dataset_root,risk_score,errors,warnings,findings,prev_hash,self_hash\n";

    private final AuditChainRegistry registry;
    private final ObjectMapper objectMapper;

    public String export(String chainId, AuditQuery query, Format format) {
        List<AuditEntry> rows = registry.chain(chainId).query(query == null ? AuditQuery.all() : query);
        return switch (format) {
            case JSON -> toJson(rows);
            case NDJSON -> toNdjson(rows);
            case CSV -> toCsv(rows);
        };
    }

    public Mono<String> exportAsync(String chainId, AuditQuery query, Format format) {
        return Mono.fromCallable(() -> export(chainId, query, format))
                .subscribeOn(Schedulers.boundedElastic());
    }

    String toJson(List<AuditEntry> rows) {
        try {
            return AuditHasher.entryMapper(objectMapper)
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot export audit entries as JSON", e);
        }
    }

    String toNdjson(List<AuditEntry> rows) {
        ObjectMapper om = AuditHasher.entryMapper(objectMapper);
        StringBuilder sb = new StringBuilder();
        for (AuditEntry row : rows) {
            try {
                sb.append(om.writeValueAsString(row)).append('\n');
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot export audit entry " + row.sequence(), e);
            }
        }
        return sb.toString();
    }

    String toCsv(List<AuditEntry> rows) {
        StringBuilder sb = new StringBuilder(CSV_HEADER);
        for (AuditEntry e : rows) sb.append(toCsvLine(e));
        return sb.toString();
    }

    private String toCsvLine(AuditEntry e) {
        long errors = e.findings().stream().filter(Finding::isError).count();
        long warnings = e.findings().size() - errors;
        String findings = e.findings().stream().map(Finding::toString).collect(Collectors.joining("; "));
        return csv(e.sequence()) + "," + csv(e.timestamp()) + "," + csv(e.actor()) + ","
                + csv(e.phase()) + "," + csv(e.datasetRootChecksum()) + "," + csv(e.riskScore()) + ","
                + errors + "," + warnings + "," + csv(findings) + ","
                + csv(e.prevHash()) + "," + csv(e.selfHash()) + "\n";
    }

    private String csv(Object v) {
        if (v == null) return "";
        String s = String.valueOf(v);
        boolean q = s.contains(",") || s.contains("\"") || s.contains("\n");
        if (q) s = "\"" + s.replace("\"", "\"\"") + "\"";
        return s;
    }
}
