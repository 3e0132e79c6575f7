package com.kotsin.turnengine.audit;

import com.kotsin.turnengine.command.Command;
import com.kotsin.turnengine.command.CommandHistoryEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Audit trail of every committed and rejected command batch.
 */
@Component
@Slf4j
public class AuditLogger {

    @Value("${features.audit-logging.enabled:true}")
    private boolean auditLoggingEnabled;

    private static final DateTimeFormatter AUDIT_DATE_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ").withZone(ZoneOffset.UTC);

    public void logCommittedBatch(String userId, List<CommandHistoryEntry> entries) {
        if (!auditLoggingEnabled || entries.isEmpty()) {
            return;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("userId", userId);
        details.put("size", entries.size());
        details.put("commands", entries.stream()
            .map(e -> e.getType() + "#" + e.getCommandId())
            .collect(Collectors.toList()));

        log.info("AUDIT: {}", formatAuditRecord(createAuditRecord("BATCH_COMMITTED", entries.get(0).getTimestamp(), details)));
    }

    public void logRejectedBatch(String userId, List<Command> commands, long timestamp, Exception cause) {
        if (!auditLoggingEnabled) {
            return;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("userId", userId);
        details.put("commands", commands.stream().map(Command::getType).collect(Collectors.toList()));
        details.put("errorType", cause.getClass().getSimpleName());
        details.put("errorMessage", cause.getMessage());

        log.warn("AUDIT: {}", formatAuditRecord(createAuditRecord("BATCH_REJECTED", timestamp, details)));
    }

    public void logHistoryPruned(String mode, int before, int after) {
        if (!auditLoggingEnabled) {
            return;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("mode", mode);
        details.put("entriesBefore", before);
        details.put("entriesAfter", after);

        log.info("AUDIT: {}", formatAuditRecord(createAuditRecord("HISTORY_PRUNED", System.currentTimeMillis(), details)));
    }

    private Map<String, Object> createAuditRecord(String event, long timestamp, Map<String, Object> details) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("timestamp", AUDIT_DATE_FORMAT.format(Instant.ofEpochMilli(timestamp)));
        record.put("event", event);
        record.put("details", details);
        return record;
    }

    private String formatAuditRecord(Map<String, Object> record) {
        return record.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(", ", "{", "}"));
    }
}
