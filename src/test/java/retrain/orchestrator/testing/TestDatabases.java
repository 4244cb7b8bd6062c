package retrain.orchestrator.testing;

import retrain.orchestrator.store.Database;

/**
 * Fresh in-memory H2 databases for tests.
 */
public final class TestDatabases {

    private TestDatabases() {
    }

    public static String url(String name) {
        return "jdbc:h2:mem:test-" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    public static Database create(String name) {
        return new Database(url(name), 5);
    }
}
