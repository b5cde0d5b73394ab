package com.deployguard.audit;

import org.springframework.context.ApplicationEvent;

public class AuditAlertRaisedEvent extends ApplicationEvent {
    public AuditAlertRaisedEvent(AuditAlert alert) { super(alert); }
    public AuditAlert alert() { return (AuditAlert) getSource(); }
}
