package automata.engine.service;

import automata.engine.model.RetryPolicy;
import automata.engine.model.TaskType;
import automata.engine.model.action.TaskAction;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Definition of a task to create. Everything except name, type and action is optional.
 */
public record NewTask(
        String userId,
        String name,
        String description,
        TaskType type,
        JsonNode schedule,
        JsonNode trigger,
        TaskAction action,
        JsonNode conditions,
        RetryPolicy retryPolicy,
        JsonNode notification) {

    public static NewTask oneTime(String userId, String name, JsonNode schedule, TaskAction action) {
        return new NewTask(userId, name, null, TaskType.ONE_TIME, schedule, null, action, null, null, null);
    }

    public NewTask withRetryPolicy(RetryPolicy policy) {
        return new NewTask(userId, name, description, type, schedule, trigger, action, conditions, policy,
                notification);
    }

    public NewTask withConditions(JsonNode value) {
        return new NewTask(userId, name, description, type, schedule, trigger, action, value, retryPolicy,
                notification);
    }

    public NewTask withNotification(JsonNode value) {
        return new NewTask(userId, name, description, type, schedule, trigger, action, conditions, retryPolicy,
                value);
    }
}
