package org.nowstart.scalper.service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.entity.AuditEvent;
import org.nowstart.scalper.repository.AuditEventRepository;
import org.springframework.stereotype.Service;

/**
 * Best-effort audit trail of trading decisions. A failed write is logged and never interrupts
 * trading.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingAuditService {

    private final AuditEventRepository auditEventRepository;

    public void record(String type, String pair, String positionId, Map<String, ?> details) {
        String payload = details.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(" "));
        try {
            auditEventRepository.save(AuditEvent.builder()
                    .eventId(UUID.randomUUID())
                    .type(type)
                    .pair(pair)
                    .positionId(positionId)
                    .payload(payload)
                    .build());
        } catch (RuntimeException e) {
            log.warn("event=audit_write_failed type={} pair={} position_id={}", type, pair, positionId, e);
        }
    }

    public List<AuditEvent> recentEvents() {
        return auditEventRepository.findTop100ByOrderByCreatedAtDesc();
    }
}
