package automata.engine.model;

import automata.engine.model.action.TaskAction;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable durable unit of schedulable work.
 * schedule, trigger, conditions and notification are opaque JSON interpreted
 * by collaborators, never by the engine itself.
 */
public final class ScheduledTask {
    private final String id;
    private final String userId;
    private final String name;
    private final String description;
    private final TaskType type;
    private final JsonNode schedule;
    private final JsonNode trigger;
    private final TaskAction action;
    private final JsonNode conditions;
    private final RetryPolicy retryPolicy; // null = no retries
    private final JsonNode notification;
    private final TaskStatus status;
    private final Instant lastRun;
    private final Instant nextRun;
    private final int runCount;
    private final Instant createdAt;
    private final Instant updatedAt;

    private ScheduledTask(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.userId = builder.userId;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.description = builder.description;
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.schedule = builder.schedule;
        this.trigger = builder.trigger;
        this.action = Objects.requireNonNull(builder.action, "action is required");
        this.conditions = builder.conditions;
        this.retryPolicy = builder.retryPolicy;
        this.notification = builder.notification;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.lastRun = builder.lastRun;
        this.nextRun = builder.nextRun;
        if (builder.runCount < 0) {
            throw new IllegalArgumentException("runCount must be >= 0");
        }
        this.runCount = builder.runCount;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public TaskType type() {
        return type;
    }

    public JsonNode schedule() {
        return schedule;
    }

    public JsonNode trigger() {
        return trigger;
    }

    public TaskAction action() {
        return action;
    }

    public JsonNode conditions() {
        return conditions;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public JsonNode notification() {
        return notification;
    }

    public TaskStatus status() {
        return status;
    }

    public Instant lastRun() {
        return lastRun;
    }

    public Instant nextRun() {
        return nextRun;
    }

    public int runCount() {
        return runCount;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Active, polled type, and nextRun reached. */
    public boolean isDue(Instant now) {
        return status == TaskStatus.ACTIVE
                && type != TaskType.TRIGGER
                && nextRun != null
                && !nextRun.isAfter(now);
    }

    public boolean hasConditions() {
        return conditions != null && !conditions.isNull()
                && !(conditions.isContainerNode() && conditions.isEmpty());
    }

    /** Reads a boolean flag such as "onSuccess" from the notification preferences. */
    public boolean notificationEnabled(String flag) {
        return notification != null && notification.path(flag).asBoolean(false);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .userId(userId)
                .name(name)
                .description(description)
                .type(type)
                .schedule(schedule)
                .trigger(trigger)
                .action(action)
                .conditions(conditions)
                .retryPolicy(retryPolicy)
                .notification(notification)
                .status(status)
                .lastRun(lastRun)
                .nextRun(nextRun)
                .runCount(runCount)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String userId;
        private String name;
        private String description;
        private TaskType type = TaskType.ONE_TIME;
        private JsonNode schedule;
        private JsonNode trigger;
        private TaskAction action;
        private JsonNode conditions;
        private RetryPolicy retryPolicy;
        private JsonNode notification;
        private TaskStatus status = TaskStatus.ACTIVE;
        private Instant lastRun;
        private Instant nextRun;
        private int runCount = 0;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder schedule(JsonNode schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder trigger(JsonNode trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder action(TaskAction action) {
            this.action = action;
            return this;
        }

        public Builder conditions(JsonNode conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder notification(JsonNode notification) {
            this.notification = notification;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastRun(Instant lastRun) {
            this.lastRun = lastRun;
            return this;
        }

        public Builder nextRun(Instant nextRun) {
            this.nextRun = nextRun;
            return this;
        }

        public Builder runCount(int runCount) {
            this.runCount = runCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ScheduledTask build() {
            return new ScheduledTask(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScheduledTask task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ScheduledTask{id='" + id + "', name='" + name + "', type=" + type.value()
                + ", status=" + status.value() + ", runCount=" + runCount + ", nextRun=" + nextRun + "}";
    }
}
