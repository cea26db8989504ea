package com.github.salilvnair.entityflow.store;

import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.entity.EfWorkflowSession;
import com.github.salilvnair.entityflow.repo.WorkflowSessionRepository;
import com.github.salilvnair.entityflow.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class JpaSessionStore implements SessionStore {

    private final WorkflowSessionRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkflowContext> load(String sessionId) {
        return repository.findById(sessionId)
                .map(EfWorkflowSession::getContextJson)
                .filter(json -> json != null && !json.isBlank())
                .map(json -> JsonUtil.fromJson(json, WorkflowContext.class));
    }

    @Override
    @Transactional
    public void save(String sessionId, WorkflowContext context) {
        EfWorkflowSession row = repository.findById(sessionId)
                .orElseGet(() -> EfWorkflowSession.builder().sessionId(sessionId).build());
        row.setContextJson(JsonUtil.toJson(context));
        row.setCurrentWorkflow(context.getCurrentWorkflow());
        row.setCurrentStep(context.getCurrentStep());
        repository.save(row);
        log.debug("Saved workflow session {} at step {}", sessionId, context.getCurrentStep());
    }

    @Override
    @Transactional
    public void delete(String sessionId) {
        repository.deleteById(sessionId);
    }
}
