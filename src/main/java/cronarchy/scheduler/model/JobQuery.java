package cronarchy.scheduler.model;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Conjunction of optional job filters. Unset filters are ignored.
 *
 * <p>{@code recurrence == 0} matches jobs without a recurrence.
 */
public record JobQuery(
        Set<Long> ids,
        Instant dueAt,
        String hook,
        List<Object> args,
        Long recurrence) {

    public static JobQuery all() {
        return new JobQuery(null, null, null, null, null);
    }

    public boolean isEmpty() {
        return ids == null && dueAt == null && hook == null && args == null && recurrence == null;
    }

    public JobQuery withIds(Collection<Long> ids) {
        return new JobQuery(new TreeSet<>(ids), dueAt, hook, args, recurrence);
    }

    public JobQuery withDueAt(Instant dueAt) {
        return new JobQuery(ids, dueAt, hook, args, recurrence);
    }

    public JobQuery withHook(String hook) {
        return new JobQuery(ids, dueAt, hook, args, recurrence);
    }

    public JobQuery withArgs(List<Object> args) {
        return new JobQuery(ids, dueAt, hook, args, recurrence);
    }

    public JobQuery withRecurrence(Long recurrence) {
        return new JobQuery(ids, dueAt, hook, args, recurrence);
    }

    public JobQuery withoutRecurrence() {
        return withRecurrence(0L);
    }
}
