package com.github.salilvnair.entityflow.repo;

import com.github.salilvnair.entityflow.entity.EfWorkflowSession;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WorkflowSessionRepository
        extends JpaRepository<EfWorkflowSession, String> {
}
