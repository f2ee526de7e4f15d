package com.contactcare.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.contactcare.backend.modules.audit.domain.AuditLog;
import com.contactcare.backend.modules.audit.infrastructure.AuditLogRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records who changed which contact record. Runs inside the caller's transaction,
 * so an audit row never outlives a rolled-back change.
 */
@Service
public class AuditLogService {

    public static final String RESOURCE_FAMILY_MEMBER = "FAMILY_MEMBER";
    public static final String RESOURCE_CONTACT_SCHEDULE = "CONTACT_SCHEDULE";
    public static final String RESOURCE_CONTACT_SESSION = "CONTACT_SESSION";
    public static final String RESOURCE_RISK_ASSESSMENT = "RISK_ASSESSMENT";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        AuditLog entry = AuditLog.entry(
                command.actionType(),
                command.resourceType(),
                command.resourceKey(),
                command.organizationId(),
                command.actor(),
                command.detail(),
                OffsetDateTime.now(clock)
        );
        auditLogRepository.save(entry);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID organizationId,
            String actor,
            Map<String, Object> detail
    ) {

        public static AuditLogCommand of(
                String actionType,
                String resourceType,
                UUID resourceId,
                UUID organizationId,
                String actor
        ) {
            return new AuditLogCommand(actionType, resourceType, String.valueOf(resourceId), organizationId, actor, Map.of());
        }

        public AuditLogCommand withDetail(Map<String, Object> detail) {
            return new AuditLogCommand(actionType, resourceType, resourceKey, organizationId, actor, detail);
        }
    }
}
