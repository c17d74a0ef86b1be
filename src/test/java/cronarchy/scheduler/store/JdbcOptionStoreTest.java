package cronarchy.scheduler.store;

import cronarchy.scheduler.support.TestDatabases;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class JdbcOptionStoreTest {

    private static Database db;
    private static JdbcOptionStore options;

    @BeforeAll
    static void setup() {
        db = new Database(TestDatabases.memoryUrl("options"), 2);
        options = new JdbcOptionStore(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanOptions() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM options");
            conn.commit();
        }
    }

    @Test
    void missingOptionReturnsDefault() {
        assertEquals(7L, options.get("site_cronarchy_state", 7L));
    }

    @Test
    void setThenGet() {
        options.set("site_cronarchy_last_run", 1_700_000_000L);

        assertEquals(1_700_000_000L, options.get("site_cronarchy_last_run", 0));
    }

    @Test
    void setOverwrites() {
        options.set("site_cronarchy_state", 2);
        options.set("site_cronarchy_state", 4);

        assertEquals(4L, options.get("site_cronarchy_state", 0));
    }

    @Test
    void malformedValueReturnsDefault() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("INSERT INTO options (name, val) VALUES ('broken', 'not-a-number')");
            conn.commit();
        }

        assertEquals(-1L, options.get("broken", -1L));
    }
}
