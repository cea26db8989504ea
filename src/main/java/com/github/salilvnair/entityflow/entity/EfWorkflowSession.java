package com.github.salilvnair.entityflow.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Entity
@Table(name = "ef_workflow_session")
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class EfWorkflowSession {

    @Id
    @Column(name = "session_id")
    private String sessionId;

    @Column(name = "current_workflow")
    private String currentWorkflow;

    @Column(name = "current_step")
    private String currentStep;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "context_json")
    private String contextJson;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    @PreUpdate
    private void touch() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }
}
