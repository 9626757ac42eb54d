package com.filter.core.pipeline;

import com.filter.core.error.FilterException;
import com.filter.core.error.StorageException;
import com.filter.core.logging.InvocationContext;
import com.filter.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Sequences named steps, feeding each step's value into the next.
 *
 * <p>Strictly short-circuiting: after the first failure no further step runs and the failure is
 * carried verbatim to {@link #result()}. Nothing is rolled back; every step must leave resumable
 * state on its own.
 *
 * <pre>
 * Result&lt;Story&gt; r = CommandPipeline.start(ctx, "resolve project", () -&gt; session.project())
 *         .then("allocate story id", p -&gt; registry.allocateId(ctx))
 *         .then("create story record", id -&gt; registry.create(ctx, id, title, ...))
 *         .result();
 * </pre>
 */
public final class CommandPipeline<T> {

    private static final Logger log = LoggerFactory.getLogger(CommandPipeline.class);

    private final InvocationContext ctx;
    private final Result<T> result;

    private CommandPipeline(InvocationContext ctx, Result<T> result) {
        this.ctx = ctx;
        this.result = result;
    }

    public static <T> CommandPipeline<T> start(InvocationContext ctx, String stepName, Supplier<T> first) {
        return new CommandPipeline<>(ctx, Result.<Void>success(null)).then(stepName, ignored -> first.get());
    }

    public static <T> CommandPipeline<T> of(InvocationContext ctx, T value) {
        return new CommandPipeline<>(ctx, Result.success(value));
    }

    public <U> CommandPipeline<U> then(String stepName, Step<? super T, ? extends U> step) {
        if (result instanceof Result.Failure<T> failure) {
            log.debug("Skipping step '{}' after failure in '{}'", stepName, failure.step());
            return new CommandPipeline<>(ctx, failure.retype());
        }
        T value = ((Result.Success<T>) result).value();
        MdcContext.setStep(stepName);
        try {
            U next = step.apply(value);
            log.debug("Step '{}' completed", stepName);
            return new CommandPipeline<>(ctx, Result.success(next));
        } catch (FilterException e) {
            log.warn("Step '{}' failed [{}]: {}", stepName, e.category(), e.getMessage());
            ctx.audit("pipeline.step.failed", stepName + ": " + e.getMessage());
            return new CommandPipeline<>(ctx, Result.failure(stepName, e));
        } catch (UncheckedIOException e) {
            log.warn("Step '{}' failed with I/O error: {}", stepName, e.getMessage());
            return new CommandPipeline<>(ctx, Result.failure(stepName,
                    new StorageException("I/O failure", e.getCause())));
        } finally {
            MdcContext.clearStep();
        }
    }

    /**
     * Runs a side-effecting step and passes the current value through unchanged.
     */
    public CommandPipeline<T> peek(String stepName, Consumer<? super T> action) {
        return then(stepName, value -> {
            action.accept(value);
            return value;
        });
    }

    public Result<T> result() {
        return result;
    }
}
