package com.deployguard.audit.dto;

public record AuditIssue(
        int index,                 // position in the chain
        Long storedSequence,       // null when the entry could not be read
        String expectedPrev,
        String storedPrev,
        String expectedHash,       // hash(storedPrev + canonical)
        String storedHash,
        String reason
) {}
