package com.deployguard.audit;

import com.deployguard.audit.dto.AuditVerifyReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent tamper incidents and alerts so that operators can inspect them
 * without re-reading the chains.
 */
@Slf4j
@Component
public class AuditIncidentListener {

    static final int MAX_RECENT = 100;

    private final Deque<AuditVerifyReport> incidents = new ArrayDeque<>();
    private final Deque<AuditAlert> alerts = new ArrayDeque<>();

    @EventListener(AuditTamperDetectedEvent.class)
    public void onTamper(AuditTamperDetectedEvent ev) {
        AuditVerifyReport r = ev.report();
        log.error("[INCIDENT] audit chain {} tampered at index {} ({} break(s))",
                r.chainId(), r.brokenAtIndex(), r.breaks().size());
        synchronized (incidents) {
            incidents.addFirst(r);
            while (incidents.size() > MAX_RECENT) incidents.removeLast();
        }
    }

    @EventListener(AuditAlertRaisedEvent.class)
    public void onAlert(AuditAlertRaisedEvent ev) {
        AuditAlert a = ev.alert();
        log.warn("[INCIDENT] {} alert {} on chain {}: {}", a.level(), a.id(), a.chainId(), a.message());
        synchronized (alerts) {
            alerts.addFirst(a);
            while (alerts.size() > MAX_RECENT) alerts.removeLast();
        }
    }

    public List<AuditVerifyReport> recentIncidents() {
        synchronized (incidents) {
            return List.copyOf(incidents);
        }
    }

    public List<AuditAlert> recentAlerts() {
        synchronized (alerts) {
            return List.copyOf(alerts);
        }
    }
}
