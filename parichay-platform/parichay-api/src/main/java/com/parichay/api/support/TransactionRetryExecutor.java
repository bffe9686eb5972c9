package com.parichay.api.support;

import com.parichay.core.error.ConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of work as one transaction and retries it when it loses a lock or
 * version race. Inside an already running transaction the work simply joins it;
 * the outermost caller owns the retry.
 */
@Component
public class TransactionRetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransactionRetryExecutor.class);

    private final TransactionTemplate template;
    private final TransactionTemplate newTransactionTemplate;
    private final int maxAttempts;

    public TransactionRetryExecutor(
            PlatformTransactionManager transactionManager,
            @Value("${parichay.tx.max-attempts:3}") int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("parichay.tx.max-attempts must be at least 1");
        }
        this.template = new TransactionTemplate(transactionManager);
        this.newTransactionTemplate = new TransactionTemplate(transactionManager);
        this.newTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.maxAttempts = maxAttempts;
    }

    public <T> T execute(Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }
        return executeWithRetry(template, work);
    }

    public void run(Runnable work) {
        execute(() -> {
            work.run();
            return null;
        });
    }

    /**
     * Always opens a separate transaction, suspending the caller's one if present.
     * For small independent writes (such as creating a missing row) that must not
     * poison the caller's transaction when they fail.
     */
    public <T> T executeInNewTransaction(Supplier<T> work) {
        return newTransactionTemplate.execute(status -> work.get());
    }

    private <T> T executeWithRetry(TransactionTemplate tx, Supplier<T> work) {
        ConcurrencyFailureException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return tx.execute(status -> work.get());
            } catch (ConcurrencyFailureException e) {
                last = e;
                log.debug("Concurrent update on attempt {}/{}: {}", attempt, maxAttempts, e.getClass().getSimpleName());
            }
        }
        log.warn("Giving up after {} attempts because of concurrent updates", maxAttempts);
        throw new ConflictException("CONCURRENT_UPDATE",
                "The resource was modified concurrently, please retry", last);
    }
}
