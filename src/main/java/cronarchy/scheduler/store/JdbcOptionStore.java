package cronarchy.scheduler.store;

import cronarchy.scheduler.exceptions.StorageException;
import cronarchy.scheduler.repository.OptionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * JDBC implementation of OptionStore over the shared options table.
 * Each write is a single MERGE, committed on its own.
 */
public class JdbcOptionStore implements OptionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcOptionStore.class);

    private final Database db;

    public JdbcOptionStore(Database db) {
        this.db = db;
    }

    @Override
    public long get(String name, long defaultValue) {
        String sql = "SELECT val FROM options WHERE name = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return defaultValue;
                }
                try {
                    return Long.parseLong(rs.getString("val"));
                } catch (NumberFormatException e) {
                    log.warn("Option {} is not a number, using {}", name, defaultValue);
                    return defaultValue;
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read option: " + name, e);
        }
    }

    @Override
    public void set(String name, long value) {
        String sql = "MERGE INTO options (name, val) KEY (name) VALUES (?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, name);
            ps.setString(2, Long.toString(value));
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StorageException("Failed to write option: " + name, e);
        }
    }
}
