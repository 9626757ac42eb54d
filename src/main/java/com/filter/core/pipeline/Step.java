package com.filter.core.pipeline;

/**
 * One fallible unit of work in a {@link CommandPipeline}. Failures are signalled by throwing
 * a {@link com.filter.core.error.FilterException}.
 */
@FunctionalInterface
public interface Step<I, O> {

    O apply(I input);
}
