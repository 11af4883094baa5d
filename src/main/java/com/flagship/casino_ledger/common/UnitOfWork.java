package com.flagship.casino_ledger.common;

import com.flagship.casino_ledger.config.CasinoProperties;
import com.flagship.casino_ledger.observability.CasinoMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a block as one storage transaction and retries it on transient
 * conflicts (serialization failures, deadlocks, lock timeouts).
 *
 * When called inside an existing transaction the block simply joins it: a
 * retry is only meaningful for the outermost unit, which owns the rollback.
 */
@Component
@Slf4j
public class UnitOfWork {

    private final TransactionTemplate transactionTemplate;
    private final CasinoProperties properties;
    private final CasinoMetrics metrics;

    public UnitOfWork(PlatformTransactionManager transactionManager,
                      CasinoProperties properties,
                      CasinoMetrics metrics) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
        this.metrics = metrics;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }

        int maxAttempts = properties.getStorage().getMaxAttempts();
        long backoffMs = properties.getStorage().getBackoff().toMillis();

        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (TransientDataAccessException e) {
                metrics.recordStorageRetry(operation);
                if (attempt >= maxAttempts) {
                    log.error("Giving up after storage conflicts: operation={}, attempts={}", operation, attempt, e);
                    throw new StorageConflictException(operation, attempt, e);
                }
                log.warn("Storage conflict, retrying: operation={}, attempt={}, error={}",
                        operation, attempt, e.getMessage());
                pause(operation, attempt, backoffMs * attempt, e);
            }
        }
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }

    private void pause(String operation, int attempt, long millis, TransientDataAccessException cause) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StorageConflictException(operation, attempt, cause);
        }
    }
}
