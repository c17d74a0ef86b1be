package cronarchy.scheduler.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model representing a scheduled job.
 * A job without an id has not been persisted yet.
 */
public final class Job {
    private final Long id;
    private final Instant dueAt;
    private final String hook;
    private final List<Object> args;
    private final Long recurrence; // seconds, null for one-shot jobs

    private Job(Builder builder) {
        this.id = builder.id;
        this.dueAt = Objects.requireNonNull(builder.dueAt, "dueAt is required").truncatedTo(ChronoUnit.SECONDS);
        this.hook = Objects.requireNonNull(builder.hook, "hook is required");
        this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.recurrence = builder.recurrence;
    }

    // Getters
    public Long id() {
        return id;
    }

    public Instant dueAt() {
        return dueAt;
    }

    public String hook() {
        return hook;
    }

    public List<Object> args() {
        return args;
    }

    public Long recurrence() {
        return recurrence;
    }

    /** Check if the job has been stored */
    public boolean isPersisted() {
        return id != null;
    }

    /** Check if the job schedules a next occurrence after it runs */
    public boolean isRecurring() {
        return recurrence != null && recurrence > 0;
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .dueAt(dueAt)
                .hook(hook)
                .args(args)
                .recurrence(recurrence);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long id;
        private Instant dueAt;
        private String hook;
        private List<Object> args = List.of();
        private Long recurrence;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder dueAt(Instant dueAt) {
            this.dueAt = dueAt;
            return this;
        }

        public Builder hook(String hook) {
            this.hook = hook;
            return this;
        }

        public Builder args(List<?> args) {
            this.args = args != null ? new ArrayList<>(args) : List.of();
            return this;
        }

        public Builder recurrence(Long recurrence) {
            this.recurrence = recurrence;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id)
                && dueAt.equals(job.dueAt)
                && hook.equals(job.hook)
                && args.equals(job.args)
                && Objects.equals(recurrence, job.recurrence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, dueAt, hook, args, recurrence);
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", hook='" + hook + "', dueAt=" + dueAt + ", recurrence=" + recurrence + "}";
    }
}
