package com.github.salilvnair.entityflow.llm.core;

import com.github.salilvnair.entityflow.engine.exception.EntityFlowErrorCode;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Applies the caller timeout to a {@link TextCompleter} and maps every failure to a
 * PROVIDER_* {@link EntityFlowException} so callers have one thing to catch. Provider calls run on
 * the given executor and are interrupted when they time out.
 */
@Slf4j
public class GuardedTextCompleter implements TextCompleter {

    private final TextCompleter delegate;
    private final long timeoutMs;
    private final Executor executor;

    public GuardedTextCompleter(TextCompleter delegate, long timeoutMs, Executor executor) {
        this.delegate = delegate;
        this.timeoutMs = timeoutMs;
        this.executor = executor;
    }

    @Override
    public String complete(String prompt, int maxTokens, double temperature) {
        FutureTask<String> call = new FutureTask<>(() -> delegate.complete(prompt, maxTokens, temperature));
        try {
            executor.execute(call);
        } catch (RejectedExecutionException e) {
            throw new EntityFlowException(EntityFlowErrorCode.PROVIDER_ERROR, "Text completion rejected: executor is saturated", e);
        }
        String text;
        try {
            text = call.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Text completion timed out after {} ms", timeoutMs);
            throw new EntityFlowException(EntityFlowErrorCode.PROVIDER_TIMEOUT,
                    "Text completion timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EntityFlowException(EntityFlowErrorCode.PROVIDER_ERROR, "Text completion interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new EntityFlowException(EntityFlowErrorCode.PROVIDER_ERROR,
                    "Text completion failed: " + cause.getMessage(), cause);
        }
        if (text == null || text.isBlank()) {
            throw new EntityFlowException(EntityFlowErrorCode.PROVIDER_INVALID_RESPONSE, "Text completion returned no text");
        }
        return text;
    }
}
