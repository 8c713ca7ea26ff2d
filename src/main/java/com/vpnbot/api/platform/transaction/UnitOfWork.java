package com.vpnbot.api.platform.transaction;

import lombok.NonNull;
import lombok.SneakyThrows;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * <p>
 * Runs a closure inside a single ledger transaction. All repository calls made by the closure
 * commit together, or not at all.</p>
 *
 * <p>
 * Transactions use {@link TransactionDefinition#PROPAGATION_REQUIRED}, so a closure executed while
 * another unit of work is already active joins the outer transaction instead of starting a new one.
 * Any exception thrown by the closure, checked or not, rolls the transaction back and propagates to
 * the caller unchanged.</p>
 */
@Component
public class UnitOfWork {

    private final TransactionTemplate transactionTemplate;

    @Autowired
    public UnitOfWork(@NonNull PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
    }

    /**
     * Executes the given {@code work} in a transaction and returns its result.
     *
     * @param work a not {@literal null} closure.
     * @param <T>  type of the result.
     * @param <E>  type of the checked exception that {@code work} may throw.
     * @return the value returned by {@code work}.
     * @throws E re-thrown as is, after rolling back the transaction.
     */
    public <T, E extends Exception> T execute(@NonNull Work<T, E> work) throws E {
        try {
            return transactionTemplate.execute(status -> {
                try {
                    return work.run();
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new CheckedWorkException(e);
                }
            });
        } catch (CheckedWorkException e) {
            // the cause is the E thrown by the work.
            throw rethrow(e.getCause());
        }
    }

    /**
     * Same as {@link #execute(Work)}, for closures that do not produce a result.
     */
    public <E extends Exception> void run(@NonNull VoidWork<E> work) throws E {
        execute(() -> {
            work.run();
            return null;
        });
    }

    @SneakyThrows
    private static RuntimeException rethrow(@NonNull Throwable cause) {
        throw cause;
    }

    @FunctionalInterface
    public interface Work<T, E extends Exception> {
        T run() throws E;
    }

    @FunctionalInterface
    public interface VoidWork<E extends Exception> {
        void run() throws E;
    }

    /**
     * Carries a checked exception through {@link TransactionTemplate}, which only rolls back on
     * unchecked ones.
     */
    private static class CheckedWorkException extends RuntimeException {

        CheckedWorkException(Exception cause) {
            super(cause);
        }
    }
}
