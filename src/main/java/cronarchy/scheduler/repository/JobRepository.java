package cronarchy.scheduler.repository;

import cronarchy.scheduler.model.JobRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for the jobs table of one scheduler instance.
 * Works on stored rows; argument serialization is the caller's concern.
 * All methods throw {@link cronarchy.scheduler.exceptions.StorageException} on failure.
 */
public interface JobRepository {

    /**
     * Insert a new row.
     *
     * @param record the row to insert; its id is ignored
     * @return the id assigned by the store
     */
    long insert(JobRecord record);

    /**
     * Overwrite every column of the row with the record's id.
     *
     * @param record the row to write; id must be set
     * @return number of rows updated (0 or 1)
     */
    int update(JobRecord record);

    /**
     * Find a row by id.
     *
     * @param id the job id
     * @return the row if found
     */
    Optional<JobRecord> findById(long id);

    /**
     * Find rows matching all set fields of the filter, in storage order.
     *
     * @param filter conjunction of optional conditions
     * @return matching rows
     */
    List<JobRecord> find(Filter filter);

    /**
     * Find rows due strictly before the given time, in storage order.
     *
     * @param now the cut-off instant
     * @return due rows
     */
    List<JobRecord> findDueBefore(Instant now);

    /**
     * Delete rows by id. Absent ids are ignored.
     *
     * @param ids ids to delete
     * @return number of rows deleted
     */
    int deleteByIds(Collection<Long> ids);

    /**
     * Row-level filter. A {@code recurrence} of 0 matches rows without recurrence.
     */
    record Filter(
            Set<Long> ids,
            Instant dueAt,
            String hook,
            String args,
            Long recurrence) {
    }
}
