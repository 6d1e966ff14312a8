package com.jguard.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository auditRepository;
    private final ObjectMapper objectMapper;

    public AuditService(AuditRepository auditRepository, ObjectMapper objectMapper) {
        this.auditRepository = auditRepository;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public AuditEvent log(AuditEvent event) {
        AuditEvent saved = auditRepository.save(event);
        log.info("audit event={} action={} author={} outcome={}",
                saved.getEventType(), saved.getAction(),
                saved.getAuthorId(), saved.getOutcome());
        return saved;
    }

    /**
     * Records the outcome of a dispatch in which at least one filter triggered.
     */
    public void logFilterTriggered(String event, String authorId, String channelId,
                                   List<String> filters, List<String> actions) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("event", event);
        details.put("filters", filters);
        details.put("actions", actions);
        log(AuditEvent.of(AuditEvent.TYPE_FILTER_TRIGGERED,
                        actions.isEmpty() ? "-" : String.join(", ", actions))
                .withAuthorId(authorId)
                .withChannelId(channelId)
                .withResource("filter", String.join(",", filters))
                .withDetails(toJson(details)));
    }

    public void logAlertFailed(String authorId, String channelId, String reason) {
        log(AuditEvent.of(AuditEvent.TYPE_ALERT_FAILED, "send_alert")
                .withAuthorId(authorId)
                .withChannelId(channelId)
                .withOutcome("FAILURE")
                .withDetails(toJson(Map.of("reason", reason != null ? reason : "unknown"))));
    }

    public void logFilterListsLoaded(List<String> listNames) {
        log(AuditEvent.of(AuditEvent.TYPE_FILTER_LISTS_LOADED, "load")
                .withResource("filter_list", String.join(",", listNames)));
    }

    public Page<AuditEvent> findByAuthor(String authorId, Pageable pageable) {
        return auditRepository.findByAuthorIdOrderByTimestampDesc(authorId, pageable);
    }

    public Page<AuditEvent> findByEventType(String eventType, Pageable pageable) {
        return auditRepository.findByEventTypeOrderByTimestampDesc(eventType, pageable);
    }

    private String toJson(Map<String, ?> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit details: {}", e.getMessage());
            return "{}";
        }
    }
}
