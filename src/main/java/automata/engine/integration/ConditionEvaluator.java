package automata.engine.integration;

import automata.engine.model.ScheduledTask;

/**
 * Decides whether a task's conditions hold right now.
 */
@FunctionalInterface
public interface ConditionEvaluator {

    /** Evaluator that treats every condition as met. */
    ConditionEvaluator ALWAYS = task -> true;

    boolean evaluate(ScheduledTask task);
}
