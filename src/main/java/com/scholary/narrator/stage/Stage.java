package com.scholary.narrator.stage;

/**
 * One step of the pipeline.
 *
 * <p>A stage takes the previous stage's output plus the job context and either returns its own
 * output or throws {@link StageException}. Stages run synchronously on the executor thread and
 * never retry.
 *
 * @param <I> the previous stage's output
 * @param <O> this stage's output
 */
@FunctionalInterface
public interface Stage<I, O> {

  O invoke(I input, StageContext context);
}
