package com.deployguard.audit;

import com.deployguard.audit.dto.AuditVerifyReport;
import org.springframework.context.ApplicationEvent;

/**
 * Stored history of a chain no longer matches its hashes. Published independently of the
 * run that noticed it.
 */
public class AuditTamperDetectedEvent extends ApplicationEvent {
    public AuditTamperDetectedEvent(AuditVerifyReport report) { super(report); }
    public AuditVerifyReport report() { return (AuditVerifyReport) getSource(); }
}
