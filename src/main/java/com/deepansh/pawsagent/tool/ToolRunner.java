package com.deepansh.pawsagent.tool;

import com.deepansh.pawsagent.config.AgentProperties;
import com.deepansh.pawsagent.exception.ToolValidationException;
import com.deepansh.pawsagent.tool.idempotency.IdempotencyCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Executes one tool call with input validation, timeout, retry/backoff and
 * idempotency caching.
 *
 * Per call:
 * 1. Idempotency key → cached outcome returned as-is
 * 2. Input validated; a validation failure is final (not retried) and cached
 * 3. Up to retries + 1 attempts on the tool pool, each raced against the timeout.
 *    A timed-out attempt is cancelled, interrupting its thread, before the next one
 *    starts. A handler returning ok=false is final; a thrown exception or timeout is
 *    retried after delay * 2^attempt
 * 4. Final outcome cached
 *
 * The returned future always completes normally with a {@link ToolResult}.
 * Concurrent calls with the same key share one execution.
 */
@Component
@Slf4j
public class ToolRunner {

    private final IdempotencyCache cache;
    private final ToolInputValidator validator;
    private final IdempotencyKeyGenerator keyGenerator;
    private final Executor toolExecutor;
    private final BackoffScheduler backoff;
    private final ToolPolicy defaults;

    private final ConcurrentMap<String, CompletableFuture<ToolResult>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public ToolRunner(IdempotencyCache cache,
                      ToolInputValidator validator,
                      IdempotencyKeyGenerator keyGenerator,
                      @Qualifier("toolTaskExecutor") Executor toolExecutor,
                      AgentProperties properties) {
        this(cache, validator, keyGenerator, toolExecutor,
                BackoffScheduler.delayed(toolExecutor), ToolPolicy.defaults(properties.getTools()));
    }

    ToolRunner(IdempotencyCache cache,
               ToolInputValidator validator,
               IdempotencyKeyGenerator keyGenerator,
               Executor toolExecutor,
               BackoffScheduler backoff,
               ToolPolicy defaults) {
        this.cache = cache;
        this.validator = validator;
        this.keyGenerator = keyGenerator;
        this.toolExecutor = toolExecutor;
        this.backoff = backoff;
        this.defaults = defaults;
    }

    public <I> CompletableFuture<ToolResult> executeAsync(ToolHandler<I> handler, Object rawInput, ToolContext context) {
        String key = keyGenerator.generate(handler.getName(), rawInput, context);

        Optional<ToolResult> cached = cache.get(key);
        if (cached.isPresent()) {
            log.info("[{}] Tool {} returned cached result", context.requestId(), handler.getName());
            return CompletableFuture.completedFuture(cached.get());
        }

        CompletableFuture<ToolResult> mine = new CompletableFuture<>();
        CompletableFuture<ToolResult> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            log.info("[{}] Tool {} already running for this key, joining it", context.requestId(), handler.getName());
            return running;
        }

        // A concurrent run may have finished between the lookup and the claim
        Optional<ToolResult> raced = cache.get(key);
        if (raced.isPresent()) {
            inFlight.remove(key, mine);
            mine.complete(raced.get());
            return mine;
        }

        CompletableFuture<ToolResult> execution;
        try {
            execution = run(handler, rawInput, context);
        } catch (RuntimeException e) {
            // e.g. the tool pool rejected the first attempt
            execution = CompletableFuture.failedFuture(e);
        }

        execution.whenComplete((result, error) -> {
            ToolResult outcome = error == null
                    ? result
                    : ToolResult.failure("Tool " + handler.getName() + " failed: " + describe(error));
            try {
                cache.put(key, outcome);
            } finally {
                inFlight.remove(key, mine);
                mine.complete(outcome);
            }
        });
        return mine;
    }

    /** Blocking variant of {@link #executeAsync}. */
    public <I> ToolResult execute(ToolHandler<I> handler, Object rawInput, ToolContext context) {
        try {
            return executeAsync(handler, rawInput, context).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Tool " + handler.getName() + " interrupted");
        } catch (ExecutionException e) {
            return ToolResult.failure("Tool " + handler.getName() + " failed: " + describe(e));
        }
    }

    private <I> CompletableFuture<ToolResult> run(ToolHandler<I> handler, Object rawInput, ToolContext context) {
        ToolPolicy policy = handler.getPolicy()
                .map(p -> p.mergeWith(defaults))
                .orElse(defaults);

        I input;
        try {
            input = validator.validate(rawInput, handler.getInputType());
        } catch (ToolValidationException e) {
            log.warn("[{}] Invalid input for tool {}: {}", context.requestId(), handler.getName(), e.getMessage());
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Invalid input for tool " + handler.getName() + ": " + e.getMessage()));
        }

        return attempt(handler, input, context, policy, 0);
    }

    private <I> CompletableFuture<ToolResult> attempt(ToolHandler<I> handler, I input, ToolContext context,
                                                      ToolPolicy policy, int attempt) {
        String name = handler.getName();
        log.info("[{}] Executing tool {} (attempt {}/{})", context.requestId(), name, attempt + 1, policy.attempts());

        FutureTask<ToolResult> task = new FutureTask<>(() -> handler.execute(input, context));
        return submit(task)
                .orTimeout(policy.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (error != null && unwrap(error) instanceof TimeoutException) {
                        // stop the attempt before its retry starts
                        task.cancel(true);
                    }
                    if (error == null) {
                        return CompletableFuture.completedFuture(result != null
                                ? result
                                : ToolResult.failure("Tool " + name + " returned no result"));
                    }

                    String reason = unwrap(error) instanceof TimeoutException
                            ? "Tool execution timeout after " + policy.timeout().toMillis() + "ms"
                            : describe(error);
                    log.warn("[{}] Tool {} failed (attempt {}): {}", context.requestId(), name, attempt + 1, reason);

                    if (attempt >= policy.retries()) {
                        return CompletableFuture.completedFuture(ToolResult.failure(
                                "Tool " + name + " failed after " + policy.attempts() + " attempts: " + reason));
                    }
                    return CompletableFuture.runAsync(() -> { }, backoff.after(policy.backoff(attempt)))
                            .thenCompose(ignored -> attempt(handler, input, context, policy, attempt + 1));
                })
                .thenCompose(Function.identity());
    }

    /**
     * Runs the task on the tool pool. The returned future mirrors the task's outcome;
     * cancelling the task interrupts the thread running it.
     */
    private CompletableFuture<ToolResult> submit(FutureTask<ToolResult> task) {
        CompletableFuture<ToolResult> outcome = new CompletableFuture<>();
        toolExecutor.execute(() -> {
            task.run();
            try {
                outcome.complete(task.get());
            } catch (CancellationException e) {
                outcome.completeExceptionally(e);
            } catch (ExecutionException e) {
                outcome.completeExceptionally(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome.completeExceptionally(e);
            }
        });
        return outcome;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
