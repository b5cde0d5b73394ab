package com.deployguard.audit;

import com.deployguard.config.IntegrityProperties;
import com.deployguard.storage.AppendOnlyStore;
import com.deployguard.storage.StreamIds;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link AuditChain} per chain id for the lifetime of the process.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditChainRegistry {

    private final AppendOnlyStore store;
    private final ObjectMapper objectMapper;
    private final IntegrityProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final Map<String, AuditChain> chains = new ConcurrentHashMap<>();

    public AuditChain chain(String chainId) {
        return chains.computeIfAbsent(chainId, id -> {
            log.debug("[AUDIT] opening chain={}", id);
            return new AuditChain(id, store, objectMapper, props.getAudit(), publisher, clock);
        });
    }

    /** Chain ids that have persisted entries. */
    public List<String> chainIds() {
        return store.streams(StreamIds.AUDIT).stream()
                .map(s -> StreamIds.name(StreamIds.AUDIT, s))
                .toList();
    }
}
