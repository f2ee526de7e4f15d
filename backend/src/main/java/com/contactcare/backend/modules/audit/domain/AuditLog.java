package com.contactcare.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Append-only trail entry. Rows are written once and never updated.
 */
@Entity
@Immutable
@Table(name = "audit_log")
public class AuditLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "action_type", nullable = false, updatable = false, length = 64)
    private String actionType;

    @Column(name = "resource_type", nullable = false, updatable = false, length = 64)
    private String resourceType;

    @Column(name = "resource_key", nullable = false, updatable = false, length = 128)
    private String resourceKey;

    @Column(name = "organization_id", updatable = false, columnDefinition = "uuid")
    private UUID organizationId;

    @Column(name = "actor", updatable = false, length = 200)
    private String actor;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "detail", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AuditLog() {
    }

    private AuditLog(String actionType, String resourceType, String resourceKey, UUID organizationId,
                     String actor, Map<String, Object> detail, OffsetDateTime createdAt) {
        this.actionType = Objects.requireNonNull(actionType, "actionType is required");
        this.resourceType = Objects.requireNonNull(resourceType, "resourceType is required");
        this.resourceKey = Objects.requireNonNull(resourceKey, "resourceKey is required");
        this.organizationId = organizationId;
        this.actor = actor;
        this.detail = detail == null || detail.isEmpty() ? null : new HashMap<>(detail);
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public static AuditLog entry(String actionType, String resourceType, String resourceKey, UUID organizationId,
                                 String actor, Map<String, Object> detail, OffsetDateTime recordedAt) {
        return new AuditLog(actionType, resourceType, resourceKey, organizationId, actor, detail, recordedAt);
    }

    public UUID getId() {
        return id;
    }

    public String getActionType() {
        return actionType;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public UUID getOrganizationId() {
        return organizationId;
    }

    public String getActor() {
        return actor;
    }

    public Map<String, Object> getDetail() {
        return detail == null ? Collections.emptyMap() : Collections.unmodifiableMap(detail);
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
