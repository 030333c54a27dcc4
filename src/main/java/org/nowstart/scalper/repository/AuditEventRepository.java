package org.nowstart.scalper.repository;

import java.util.List;
import java.util.UUID;
import org.nowstart.scalper.data.entity.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    List<AuditEvent> findTop100ByOrderByCreatedAtDesc();
}
