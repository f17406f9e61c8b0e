package com.vuong.simpledata.core.service;

import com.vuong.simpledata.config.SimpleDataProperties;
import jakarta.persistence.EntityManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Opens {@link RepositorySession}s on an {@link EntityManagerFactory}.
 * Thread-safe; each session it hands out owns a fresh {@link jakarta.persistence.EntityManager}.
 */
public class RepositoryFactory {

    private static final Logger logger = LoggerFactory.getLogger(RepositoryFactory.class);

    private final EntityManagerFactory entityManagerFactory;
    private final SimpleDataProperties properties;

    public RepositoryFactory(EntityManagerFactory entityManagerFactory, SimpleDataProperties properties) {
        this.entityManagerFactory = Objects.requireNonNull(entityManagerFactory, "EntityManagerFactory must not be null");
        this.properties = Objects.requireNonNull(properties, "Properties must not be null");
    }

    public RepositoryFactory(EntityManagerFactory entityManagerFactory) {
        this(entityManagerFactory, new SimpleDataProperties());
    }

    /**
     * Opens a new unit of work. The caller must close the returned session.
     *
     * @return a session backed by a new EntityManager
     */
    public RepositorySession openSession() {
        logger.debug("Opening repository session");
        return new RepositorySession(entityManagerFactory.createEntityManager(), properties);
    }

    public SimpleDataProperties getProperties() {
        return properties;
    }
}
