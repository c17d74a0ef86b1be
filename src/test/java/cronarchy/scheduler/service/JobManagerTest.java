package cronarchy.scheduler.service;

import cronarchy.scheduler.exceptions.JobNotFoundException;
import cronarchy.scheduler.model.Job;
import cronarchy.scheduler.model.JobQuery;
import cronarchy.scheduler.store.Database;
import cronarchy.scheduler.store.JdbcJobRepository;
import cronarchy.scheduler.support.MutableClock;
import cronarchy.scheduler.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JobManagerTest {

    private static final Instant T = Instant.ofEpochSecond(1_700_000_000L);

    private static Database db;
    private static MutableClock clock;
    private static JobManager manager;

    @BeforeAll
    static void setup() {
        db = new Database(TestDatabases.memoryUrl("job-manager"), 2);
        clock = new MutableClock(T);
        manager = new JobManager("site", new JdbcJobRepository(db, "site_jobs"), clock);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        clock.set(T);
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM site_jobs");
            conn.commit();
        }
    }

    private long schedule(Instant dueAt, String hook, List<?> args, Long recurrence) {
        return manager.scheduleJob(manager.newJob(dueAt, hook, args, recurrence));
    }

    @Test
    void newJobIsNotStored() {
        Job job = manager.newJob(T, "mail.digest", List.of(1), null);

        assertNull(job.id());
        assertFalse(job.isPersisted());
        assertTrue(manager.getJobs(JobQuery.all()).isEmpty());
    }

    @Test
    void scheduleAndGet() {
        long id = schedule(T, "mail.digest", List.of(42, "weekly"), 3600L);

        Job job = manager.getJob(id);
        assertEquals(id, job.id());
        assertEquals("mail.digest", job.hook());
        assertEquals(List.of(42, "weekly"), job.args());
        assertEquals(T, job.dueAt());
        assertEquals(3600L, job.recurrence());
    }

    @Test
    void getMissingJobThrowsNotFound() {
        JobNotFoundException e = assertThrows(JobNotFoundException.class, () -> manager.getJob(987_654L));
        assertEquals("job-not-found", e.errorCode());
    }

    @Test
    void scheduleExistingJobUpdatesInPlace() {
        long id = schedule(T, "report", List.of(), null);

        Job moved = manager.getJob(id).toBuilder().dueAt(T.plusSeconds(600)).build();
        assertEquals(id, manager.scheduleJob(moved));

        assertEquals(1, manager.getJobs(JobQuery.all()).size());
        assertEquals(T.plusSeconds(600), manager.getJob(id).dueAt());
    }

    @Test
    void scheduleWithVanishedIdInsertsNewRow() {
        long id = schedule(T, "report", List.of(), null);
        Job job = manager.getJob(id);
        manager.deleteJobs(List.of(id));

        long newId = manager.scheduleJob(job);

        assertNotEquals(id, newId);
        assertEquals("report", manager.getJob(newId).hook());
    }

    @Test
    void recurrenceAnchoredToOriginalDueTime() {
        long id = schedule(T, "cleanup", List.of("tmp"), 300L);
        clock.set(T.plusSeconds(7_777));

        Optional<Job> next = manager.scheduleJobRecurrence(id);

        assertTrue(next.isPresent());
        assertEquals(T.plusSeconds(300), next.get().dueAt());
        assertNotEquals(id, next.get().id());

        Job stored = manager.getJob(next.get().id());
        assertEquals(T.plusSeconds(300), stored.dueAt());
        assertEquals("cleanup", stored.hook());
        assertEquals(List.of("tmp"), stored.args());
        assertEquals(300L, stored.recurrence());

        // original row untouched
        assertEquals(T, manager.getJob(id).dueAt());
    }

    @Test
    void oneShotJobHasNoRecurrence() {
        long id = schedule(T, "once", List.of(), null);

        assertTrue(manager.scheduleJobRecurrence(id).isEmpty());
        assertEquals(1, manager.getJobs(JobQuery.all()).size());
    }

    @Test
    void recurrenceOfMissingJobThrowsNotFound() {
        assertThrows(JobNotFoundException.class, () -> manager.scheduleJobRecurrence(55_555L));
    }

    @Test
    void deleteIsIdempotentAndLeavesOtherRows() {
        long keep = schedule(T, "keep", List.of(), null);
        long drop = schedule(T, "drop", List.of(), null);

        assertEquals(1, manager.deleteJobs(List.of(drop)));
        assertDoesNotThrow(() -> manager.deleteJobs(List.of(drop, 31_337L)));
        assertEquals(0, manager.deleteJobs(List.of(drop)));

        assertEquals(List.of(keep), manager.getJobs(JobQuery.all()).stream().map(Job::id).toList());
    }

    @Test
    void pendingJobsAreStrictlyBeforeNow() {
        long past = schedule(T.minusSeconds(1), "past", List.of(), null);
        schedule(T, "now", List.of(), null);
        schedule(T.plusSeconds(60), "future", List.of(), null);

        assertEquals(List.of(past), manager.getPendingJobs().stream().map(Job::id).toList());

        clock.advanceSeconds(61);
        assertEquals(3, manager.getPendingJobs().size());
    }

    @Test
    void queryByArgsMatchesSerializedForm() {
        long match = schedule(T, "mail", List.of(7, "a"), null);
        schedule(T, "mail", List.of(7, "b"), null);

        List<Job> found = manager.getJobs(JobQuery.all().withHook("mail").withArgs(List.of(7, "a")));

        assertEquals(List.of(match), found.stream().map(Job::id).toList());
    }

    @Test
    void queryByIdsAndRecurrence() {
        long a = schedule(T, "x", List.of(), 60L);
        long b = schedule(T, "x", List.of(), null);
        schedule(T, "x", List.of(), 60L);

        assertEquals(List.of(b), manager.getJobs(JobQuery.all().withIds(List.of(a, b)).withoutRecurrence())
                .stream().map(Job::id).toList());
        assertEquals(List.of(a), manager.getJobs(JobQuery.all().withIds(List.of(a, b)).withRecurrence(60L))
                .stream().map(Job::id).toList());
    }

    @Test
    void getJobByQueryReturnsFirstMatch() {
        long first = schedule(T, "dup", List.of(), null);
        schedule(T, "dup", List.of(), null);

        assertEquals(first, manager.getJob(JobQuery.all().withHook("dup")).id());
        assertThrows(JobNotFoundException.class, () -> manager.getJob(JobQuery.all().withHook("none")));
    }
}
