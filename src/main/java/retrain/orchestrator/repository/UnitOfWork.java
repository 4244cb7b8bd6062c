package retrain.orchestrator.repository;

import java.util.function.Supplier;

/**
 * Groups repository calls into a single commit.
 */
public interface UnitOfWork {

    /**
     * Run {@code work} in one transaction. Repository calls made by the work
     * on the same thread share its connection and are committed together, or
     * rolled back together if the work throws. A nested call joins the
     * enclosing transaction.
     */
    <T> T inTransaction(Supplier<T> work);
}
