package com.vuong.simpledata.core.service;

import com.vuong.simpledata.config.SimpleDataProperties;
import com.vuong.simpledata.core.domain.metadata.EntityInformation;
import com.vuong.simpledata.core.domain.repository.PagingRepository;
import com.vuong.simpledata.core.domain.repository.support.SimplePagingRepository;
import com.vuong.simpledata.exception.ErrorCode;
import com.vuong.simpledata.exception.RepositoryConfigurationException;
import jakarta.persistence.EntityManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ClassUtils;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One unit of work: an {@link EntityManager} plus the repositories bound to it.
 * <p>
 * Repositories are created on first request and cached per entity class for the
 * lifetime of the session. A session is meant for a single thread; close it to
 * release the underlying {@link EntityManager}.
 */
public class RepositorySession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RepositorySession.class);

    private final EntityManager entityManager;
    private final SimpleDataProperties properties;

    // Cache
    private final Map<Class<?>, SimplePagingRepository<?, ?>> repositoryMap = new HashMap<>();

    public RepositorySession(EntityManager entityManager, SimpleDataProperties properties) {
        this.entityManager = Objects.requireNonNull(entityManager, "EntityManager must not be null");
        this.properties = Objects.requireNonNull(properties, "Properties must not be null");
    }

    /**
     * Returns the repository of the given entity class bound to this session.
     *
     * @param <T>         the entity type
     * @param <ID>        the ID type
     * @param entityClass the entity class
     * @return the repository instance
     * @throws RepositoryConfigurationException if the class is not a managed entity with one primary key
     */
    public <T, ID> PagingRepository<T, ID> getRepository(Class<T> entityClass) {
        return resolveRepository(entityClass);
    }

    /**
     * Returns the repository of the given entity class after checking its primary-key type.
     *
     * @param <T>         the entity type
     * @param <ID>        the ID type
     * @param entityClass the entity class
     * @param idClass     the expected primary-key type; primitive and wrapper types are interchangeable
     * @return the repository instance
     * @throws RepositoryConfigurationException if the entity's primary key is not of type {@code idClass}
     */
    public <T, ID> PagingRepository<T, ID> getRepository(Class<T> entityClass, Class<ID> idClass) {
        Objects.requireNonNull(idClass, "ID class must not be null");
        SimplePagingRepository<T, ID> repository = resolveRepository(entityClass);
        Class<?> actual = repository.getEntityInformation().getIdType();
        if (!ClassUtils.resolvePrimitiveIfNecessary(idClass)
                .isAssignableFrom(ClassUtils.resolvePrimitiveIfNecessary(actual))) {
            throw new RepositoryConfigurationException(ErrorCode.ID_TYPE_MISMATCH,
                    "Entity " + entityClass.getSimpleName() + " has primary key of type " + actual.getName()
                            + ", not " + idClass.getName());
        }
        return repository;
    }

    public EntityManager getEntityManager() {
        return entityManager;
    }

    public boolean isOpen() {
        return entityManager.isOpen();
    }

    @Override
    public void close() {
        if (entityManager.isOpen()) {
            entityManager.close();
            logger.debug("Closed repository session with {} repositories", repositoryMap.size());
        }
        repositoryMap.clear();
    }

    @SuppressWarnings("unchecked")
    private <T, ID> SimplePagingRepository<T, ID> resolveRepository(Class<T> entityClass) {
        Objects.requireNonNull(entityClass, "Entity class must not be null");
        checkOpen();
        return (SimplePagingRepository<T, ID>) repositoryMap.computeIfAbsent(entityClass, k -> {
            EntityInformation<T, ID> information = EntityInformation.of(entityClass, entityManager.getMetamodel());
            SimplePagingRepository<T, ID> repository =
                    new SimplePagingRepository<>(information, entityManager, properties);
            logger.info("Registered repository for entity: {}. Entity class: {}",
                    information.getEntityName(), entityClass.getName());
            return repository;
        });
    }

    private void checkOpen() {
        if (!entityManager.isOpen()) {
            throw new IllegalStateException("Repository session is closed");
        }
    }
}
