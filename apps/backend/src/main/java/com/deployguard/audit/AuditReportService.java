package com.deployguard.audit;

import com.deployguard.config.IntegrityProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditReportService {

    public static final String PHASE_PRE = "pre";
    public static final String PHASE_POST = "post";

    private final AuditChainRegistry registry;
    private final IntegrityProperties props;

    /**
     * Compliance summary of {@code chainId} between {@code from} and {@code to} (inclusive, null
     * for open ends). A post entry carrying any error is counted as a rollback.
     */
    public ComplianceReport complianceReport(String chainId, Instant from, Instant to) {
        AuditChain chain = registry.chain(chainId);
        List<AuditEntry> entries = chain.query(AuditQuery.builder().from(from).to(to).build());
        double alertThreshold = props.getAudit().getAlertThreshold();

        Map<String, List<AuditEntry>> grouped = new TreeMap<>();
        for (AuditEntry e : entries) {
            grouped.computeIfAbsent(String.valueOf(e.actor()), k -> new ArrayList<>()).add(e);
        }

        Map<String, ComplianceReport.ActorSummary> byActor = new LinkedHashMap<>();
        grouped.forEach((actor, list) -> {
            int pre = 0, post = 0, rollbacks = 0, highRisk = 0;
            double riskSum = 0;
            for (AuditEntry e : list) {
                if (PHASE_PRE.equals(e.phase())) pre++;
                if (PHASE_POST.equals(e.phase())) {
                    post++;
                    if (e.hasErrors()) rollbacks++;
                }
                if (e.riskScore() > alertThreshold) highRisk++;
                riskSum += e.riskScore();
            }
            double avg = Math.round(riskSum / list.size() * 1000d) / 1000d;
            byActor.put(actor, new ComplianceReport.ActorSummary(actor, list.size(), pre, post, rollbacks, avg, highRisk));
        });

        List<AuditAlert> alerts = chain.alerts().stream()
                .filter(a -> (from == null || !a.timestamp().isBefore(from))
                        && (to == null || !a.timestamp().isAfter(to)))
                .toList();

        boolean intact = chain.verify().ok();
        log.info("[AUDIT] compliance report chain={} entries={} actors={} intact={}",
                chainId, entries.size(), byActor.size(), intact);
        return new ComplianceReport(chainId, from, to, entries.size(), byActor, alerts, intact);
    }
}
