package cronarchy.scheduler.store;

import cronarchy.scheduler.exceptions.StorageException;
import cronarchy.scheduler.model.JobRecord;
import cronarchy.scheduler.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of JobRepository over one instance's jobs table.
 * Due times are bound and read as UTC {@link OffsetDateTime}s, never through
 * the JVM's default zone.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;
    private final String table;

    public JdbcJobRepository(Database db, String table) {
        this.db = db;
        this.table = table;
        db.createJobsTable(table);
    }

    @Override
    public long insert(JobRecord record) {
        String sql = "INSERT INTO " + table + " (hook, args, due_at, recurrence) VALUES (?, ?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            bindColumns(ps, record);
            ps.executeUpdate();

            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StorageException("No id generated for job " + record.hook());
                }
                id = keys.getLong(1);
            }
            conn.commit();

            log.debug("Inserted job {} ({})", id, record.hook());
            return id;
        } catch (SQLException e) {
            throw new StorageException("Failed to insert job: " + record.hook(), e);
        }
    }

    @Override
    public int update(JobRecord record) {
        String sql = "UPDATE " + table + " SET hook = ?, args = ?, due_at = ?, recurrence = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindColumns(ps, record);
            ps.setLong(5, record.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw new StorageException("Failed to update job: " + record.id(), e);
        }
    }

    @Override
    public Optional<JobRecord> findById(long id) {
        String sql = "SELECT * FROM " + table + " WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to find job: " + id, e);
        }
    }

    @Override
    public List<JobRecord> find(Filter filter) {
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (filter.ids() != null) {
            if (filter.ids().isEmpty()) {
                return List.of();
            }
            conditions.add("id IN (" + placeholders(filter.ids().size()) + ")");
            params.addAll(filter.ids());
        }
        if (filter.dueAt() != null) {
            conditions.add("due_at = ?");
            params.add(utc(filter.dueAt()));
        }
        if (filter.hook() != null) {
            conditions.add("hook = ?");
            params.add(filter.hook());
        }
        if (filter.args() != null) {
            conditions.add("args = ?");
            params.add(filter.args());
        }
        if (filter.recurrence() != null) {
            if (filter.recurrence() == 0) {
                conditions.add("recurrence IS NULL");
            } else {
                conditions.add("recurrence = ?");
                params.add(filter.recurrence());
            }
        }

        String sql = "SELECT * FROM " + table
                + (conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions))
                + " ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to query jobs", e);
        }
    }

    @Override
    public List<JobRecord> findDueBefore(Instant now) {
        String sql = "SELECT * FROM " + table + " WHERE due_at < ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, utc(now));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to find pending jobs", e);
        }
    }

    @Override
    public int deleteByIds(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        String sql = "DELETE FROM " + table + " WHERE id IN (" + placeholders(ids.size()) + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            for (Long id : ids) {
                ps.setLong(i++, id);
            }
            int deleted = ps.executeUpdate();
            conn.commit();

            log.debug("Deleted {} of {} jobs", deleted, ids.size());
            return deleted;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete jobs: " + ids, e);
        }
    }

    // --- Helpers ---

    private void bindColumns(PreparedStatement ps, JobRecord record) throws SQLException {
        ps.setString(1, record.hook());
        ps.setString(2, record.args());
        ps.setObject(3, utc(record.dueAt()));
        if (record.recurrence() != null && record.recurrence() > 0) {
            ps.setLong(4, record.recurrence());
        } else {
            ps.setNull(4, Types.BIGINT);
        }
    }

    private List<JobRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<JobRecord> records = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                records.add(mapRow(rs));
            }
        }
        return records;
    }

    private JobRecord mapRow(ResultSet rs) throws SQLException {
        long recurrence = rs.getLong("recurrence");
        boolean oneShot = rs.wasNull();
        return new JobRecord(
                rs.getLong("id"),
                rs.getObject("due_at", OffsetDateTime.class).toInstant(),
                rs.getString("hook"),
                rs.getString("args"),
                oneShot ? null : recurrence);
    }

    private static OffsetDateTime utc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
