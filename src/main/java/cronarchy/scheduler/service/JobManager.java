package cronarchy.scheduler.service;

import cronarchy.scheduler.exceptions.JobNotFoundException;
import cronarchy.scheduler.model.Job;
import cronarchy.scheduler.model.JobQuery;
import cronarchy.scheduler.model.JobRecord;
import cronarchy.scheduler.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Queries and schedules the jobs of one scheduler instance.
 *
 * <p>Storage errors surface as {@link cronarchy.scheduler.exceptions.StorageException};
 * nothing here retries. Retry policy belongs to the daemon.
 */
public class JobManager {

    private static final Logger log = LoggerFactory.getLogger(JobManager.class);

    private final String instanceId;
    private final JobRepository repository;
    private final Clock clock;

    public JobManager(String instanceId, JobRepository repository, Clock clock) {
        this.instanceId = instanceId;
        this.repository = repository;
        this.clock = clock;
    }

    public String instanceId() {
        return instanceId;
    }

    /**
     * Create a job in memory. It is not stored until passed to {@link #scheduleJob(Job)}.
     */
    public Job newJob(Instant dueAt, String hook, List<?> args, Long recurrence) {
        return Job.builder()
                .dueAt(dueAt)
                .hook(hook)
                .args(args)
                .recurrence(recurrence)
                .build();
    }

    /**
     * Get a job by id.
     *
     * @throws JobNotFoundException if no row has this id
     */
    public Job getJob(long id) {
        return repository.findById(id)
                .map(this::toJob)
                .orElseThrow(() -> new JobNotFoundException(id));
    }

    /**
     * Get the first job matching the query.
     *
     * @throws JobNotFoundException if nothing matches
     */
    public Job getJob(JobQuery query) {
        List<Job> jobs = getJobs(query);
        if (jobs.isEmpty()) {
            throw new JobNotFoundException(query.toString());
        }
        return jobs.get(0);
    }

    /**
     * Get all jobs matching every set filter of the query, in storage order.
     */
    public List<Job> getJobs(JobQuery query) {
        JobRepository.Filter filter = new JobRepository.Filter(
                query.ids(),
                query.dueAt(),
                query.hook(),
                query.args() != null ? ArgsCodec.serialize(query.args()) : null,
                query.recurrence());

        return repository.find(filter).stream()
                .map(this::toJob)
                .toList();
    }

    /**
     * Get all jobs due strictly before now, in storage order.
     */
    public List<Job> getPendingJobs() {
        return repository.findDueBefore(clock.instant()).stream()
                .map(this::toJob)
                .toList();
    }

    /**
     * Store a job. A job without id, or whose id no longer exists, is inserted
     * as a new row; otherwise the existing row is overwritten.
     *
     * @return the id of the stored row
     */
    public long scheduleJob(Job job) {
        JobRecord record = toRecord(job);

        if (job.isPersisted() && repository.update(record) > 0) {
            log.debug("[{}] Updated job {} ({})", instanceId, job.id(), job.hook());
            return job.id();
        }

        long id = repository.insert(record);
        log.debug("[{}] Scheduled job {} ({}) at {}", instanceId, id, job.hook(), job.dueAt());
        return id;
    }

    /**
     * Schedule the next occurrence of a recurring job as a new row, due one
     * recurrence after the job's own due time. The original row is untouched.
     *
     * @return the new job, or empty if the job does not recur
     * @throws JobNotFoundException if no row has this id
     */
    public Optional<Job> scheduleJobRecurrence(long id) {
        Job job = getJob(id);
        if (!job.isRecurring()) {
            return Optional.empty();
        }

        Instant next = job.dueAt().plus(Duration.ofSeconds(job.recurrence()));
        Job nextJob = job.toBuilder()
                .id(null)
                .dueAt(next)
                .build();

        long newId = scheduleJob(nextJob);
        return Optional.of(nextJob.toBuilder().id(newId).build());
    }

    /**
     * Delete jobs by id. Ids without a row are ignored.
     *
     * @return number of rows removed
     */
    public int deleteJobs(Collection<Long> ids) {
        return repository.deleteByIds(ids);
    }

    private Job toJob(JobRecord record) {
        return Job.builder()
                .id(record.id())
                .dueAt(record.dueAt())
                .hook(record.hook())
                .args(ArgsCodec.deserialize(record.args()))
                .recurrence(record.recurrence())
                .build();
    }

    private JobRecord toRecord(Job job) {
        return new JobRecord(
                job.id(),
                job.dueAt(),
                job.hook(),
                ArgsCodec.serialize(job.args()),
                job.isRecurring() ? job.recurrence() : null);
    }
}
