package ru.tigran.gnosisprofiles.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a find-then-insert-or-update write as one transaction keyed by a natural key.
 *
 * Two requests racing on the same new key can both decide to insert; the unique key makes one
 * of them fail with {@link DataIntegrityViolationException}. That loser is re-run once in a fresh
 * transaction, where its lookup now finds the winner's row and the write becomes an update.
 */
@Slf4j
@Component
public class ProfileUpsertExecutor {

    private final TransactionTemplate transactionTemplate;

    public ProfileUpsertExecutor(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @param key   Natural key for logging, e.g. "user 42"
     * @param write Lookup plus insert/update; must be safe to run twice
     * @return result of the successful run
     */
    public <T> T upsert(String key, Supplier<T> write) {
        try {
            return transactionTemplate.execute(status -> write.get());
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent insert detected for {}, retrying as update: {}", key, e.getMostSpecificCause().getMessage());
            return transactionTemplate.execute(status -> write.get());
        }
    }
}
