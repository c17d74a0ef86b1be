package cronarchy.scheduler.support;

public final class TestDatabases {

    private TestDatabases() {
    }

    /** Fresh in-memory H2 URL, kept open until the JVM exits */
    public static String memoryUrl(String name) {
        return "jdbc:h2:mem:test-" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }
}
