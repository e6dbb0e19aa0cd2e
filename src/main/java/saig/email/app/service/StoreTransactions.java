package saig.email.app.service;

import saig.email.app.exception.ConflictException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of work in its own local transaction. Callers hold the entity locks
 * around this call so that the locks are released only after commit.
 */
@Component
public class StoreTransactions {
    private final TransactionTemplate transactionTemplate;

    public StoreTransactions(TransactionTemplate transactionTemplate) {
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * @throws ConflictException if a concurrent writer changed one of the rows first
     */
    public <T> T execute(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (OptimisticLockingFailureException e) {
            throw new ConflictException("Concurrent modification: " + e.getMessage(), e);
        }
    }
}
