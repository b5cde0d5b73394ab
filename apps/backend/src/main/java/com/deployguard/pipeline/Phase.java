package com.deployguard.pipeline;

import java.util.Locale;

public enum Phase {
    PRE, POST;

    /** Name recorded in audit entries. */
    public String auditName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
