package com.github.salilvnair.entityflow.engine.session;

import com.github.salilvnair.entityflow.config.EntityFlowProperties;
import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.model.ActionResult;
import com.github.salilvnair.entityflow.store.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Runs one user turn against a stored session. Turns for the same session are serialized and
 * the context is saved only when the turn returns normally.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionTurnExecutor {

    private final SessionStore sessionStore;
    private final EntityFlowProperties properties;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ActionResult executeTurn(String sessionId, String userMessage, Function<WorkflowContext, ActionResult> turn) {
        ReentrantLock lock = acquire(sessionId);
        try {
            WorkflowContext staged = sessionStore.load(sessionId)
                    .map(WorkflowContext::copy)
                    .orElseGet(() -> WorkflowContext.create(sessionId, properties.getWorkflow().getMaxStackDepth()));
            if (userMessage != null && !userMessage.isBlank()) {
                staged.addUserMessage(userMessage);
            }
            ActionResult result = turn.apply(staged);
            if (result == null) {
                result = ActionResult.failure("The turn produced no result");
            }
            String reply = result.text();
            if (reply != null && !reply.isBlank()) {
                staged.addAssistantMessage(reply);
            }
            sessionStore.save(sessionId, staged);
            log.debug("Session {} saved at step {}", sessionId, staged.getCurrentStep());
            return result;
        } finally {
            release(sessionId, lock);
        }
    }

    public WorkflowContext current(String sessionId) {
        return sessionStore.load(sessionId)
                .orElseGet(() -> WorkflowContext.create(sessionId, properties.getWorkflow().getMaxStackDepth()));
    }

    public void reset(String sessionId) {
        ReentrantLock lock = acquire(sessionId);
        try {
            sessionStore.delete(sessionId);
        } finally {
            release(sessionId, lock);
        }
    }

    int lockCount() {
        return locks.size();
    }

    /** Locks the session, retrying if the lock was retired while this thread waited on it. */
    private ReentrantLock acquire(String sessionId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
            lock.lock();
            if (locks.get(sessionId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    /** Drops the lock from the map when nobody else is queued for it. */
    private void release(String sessionId, ReentrantLock lock) {
        try {
            if (!lock.hasQueuedThreads()) {
                locks.remove(sessionId, lock);
            }
        } finally {
            lock.unlock();
        }
    }
}
