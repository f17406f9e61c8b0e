package com.vuong.simpledata.core.domain.repository.support;

import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Transaction boundary of one repository operation.
 * <p>
 * Without an active transaction the work runs in a new one that is committed before
 * returning, or rolled back when the work fails. When the caller already holds an
 * active transaction the work joins it: changes are flushed and committing is left
 * to the caller.
 */
public class UnitOfWork {

    private static final Logger logger = LoggerFactory.getLogger(UnitOfWork.class);

    private final EntityManager entityManager;

    public UnitOfWork(EntityManager entityManager) {
        this.entityManager = Objects.requireNonNull(entityManager, "EntityManager must not be null");
    }

    public <R> R execute(Supplier<R> work) {
        EntityTransaction transaction = entityManager.getTransaction();
        if (transaction.isActive()) {
            R result = work.get();
            entityManager.flush();
            return result;
        }

        transaction.begin();
        try {
            R result = work.get();
            transaction.commit();
            return result;
        } catch (RuntimeException | Error e) {
            if (transaction.isActive()) {
                logger.warn("Rolling back unit of work after failure: {}", e.getMessage());
                transaction.rollback();
            }
            throw e;
        }
    }

    public void run(Runnable work) {
        execute(() -> {
            work.run();
            return null;
        });
    }
}
