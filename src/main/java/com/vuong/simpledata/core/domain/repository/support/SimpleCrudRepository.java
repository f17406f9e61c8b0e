package com.vuong.simpledata.core.domain.repository.support;

import com.vuong.simpledata.config.SimpleDataProperties;
import com.vuong.simpledata.core.domain.metadata.EntityInformation;
import com.vuong.simpledata.core.domain.repository.CrudRepository;
import com.vuong.simpledata.core.domain.statement.Condition;
import com.vuong.simpledata.core.domain.statement.DeleteStatement;
import com.vuong.simpledata.core.domain.statement.SelectStatement;
import com.vuong.simpledata.exception.ErrorCode;
import com.vuong.simpledata.exception.RepositoryConfigurationException;
import com.vuong.simpledata.util.ArgumentValidator;
import jakarta.persistence.EntityManager;
import jakarta.persistence.metamodel.SingularAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of {@link CrudRepository} on top of a JPA {@link EntityManager}.
 * <p>
 * One instance serves one entity type and one {@link EntityManager}; it is not meant to
 * be shared between threads. Statements are built with the criteria API from the
 * {@link EntityInformation} resolved at construction.
 *
 * @param <T>  the entity type
 * @param <ID> the primary-key type
 */
public class SimpleCrudRepository<T, ID> implements CrudRepository<T, ID> {

    private static final Logger logger = LoggerFactory.getLogger(SimpleCrudRepository.class);

    protected final EntityInformation<T, ID> entityInformation;
    protected final EntityManager entityManager;
    protected final ArgumentValidator validator = new ArgumentValidator();

    private final SingularAttribute<? super T, ?> idAttribute;
    private final UnitOfWork unitOfWork;
    private final SimpleDataProperties properties;

    /**
     * Creates a repository for the entity described by {@code entityInformation}.
     *
     * @param entityInformation the metadata of the bound entity type
     * @param entityManager     the session statements are executed through
     * @param properties        the module settings
     * @throws RepositoryConfigurationException if the entity does not declare exactly one primary key
     */
    public SimpleCrudRepository(EntityInformation<T, ID> entityInformation, EntityManager entityManager,
                                SimpleDataProperties properties) {
        this.entityInformation = Objects.requireNonNull(entityInformation, "EntityInformation must not be null");
        this.entityManager = Objects.requireNonNull(entityManager, "EntityManager must not be null");
        this.properties = Objects.requireNonNull(properties, "Properties must not be null");

        if (entityInformation.getIdAttributes().size() != 1) {
            throw new RepositoryConfigurationException(ErrorCode.PRIMARY_KEY_COUNT);
        }
        this.idAttribute = entityInformation.getIdAttribute();
        this.unitOfWork = new UnitOfWork(entityManager);

        logger.debug("Created repository for entity: {} with primary key: {}",
                entityInformation.getEntityName(), idAttribute.getName());
    }

    public SimpleCrudRepository(EntityInformation<T, ID> entityInformation, EntityManager entityManager) {
        this(entityInformation, entityManager, new SimpleDataProperties());
    }

    public SimpleCrudRepository(Class<T> domainClass, EntityManager entityManager, SimpleDataProperties properties) {
        this(EntityInformation.of(domainClass, entityManager.getMetamodel()), entityManager, properties);
    }

    public SimpleCrudRepository(Class<T> domainClass, EntityManager entityManager) {
        this(domainClass, entityManager, new SimpleDataProperties());
    }

    public EntityInformation<T, ID> getEntityInformation() {
        return entityInformation;
    }

    public Class<T> getDomainClass() {
        return entityInformation.getDomainClass();
    }

    @Override
    public void clear() {
        int deleted = executeDelete(DeleteStatement.from(getDomainClass()));
        logger.info("Cleared {} entities of type: {}", deleted, entityInformation.getEntityName());
    }

    @Override
    public long count() {
        return executeCount(SelectStatement.from(getDomainClass()));
    }

    @Override
    public void delete(T entity) {
        validator.requireValid(validator.validateEntity(entity));
        logger.debug("Deleting entity of type: {}", entityInformation.getEntityName());
        unitOfWork.run(() -> remove(entity));
    }

    @Override
    public void deleteAll(Iterable<? extends T> entities) {
        validator.requireValid(validator.validateEntities(entities));
        unitOfWork.run(() -> {
            for (T entity : entities) {
                remove(entity);
            }
        });
    }

    @Override
    public void deleteAllById(Iterable<? extends ID> ids) {
        validator.requireValid(validator.validateIds(ids));
        List<ID> idList = toList(ids);
        if (idList.isEmpty()) {
            return;
        }
        int deleted = executeDelete(DeleteStatement.from(getDomainClass()).where(Condition.in(idAttribute, idList)));
        logger.debug("Deleted {} of {} requested entities of type: {}",
                deleted, idList.size(), entityInformation.getEntityName());
    }

    @Override
    public void deleteById(ID id) {
        validator.requireValid(validator.validateId(id));
        int deleted = executeDelete(DeleteStatement.from(getDomainClass()).where(Condition.equal(idAttribute, id)));
        logger.debug("Deleted {} entity of type: {} with ID: {}", deleted, entityInformation.getEntityName(), id);
    }

    @Override
    public boolean existsById(ID id) {
        validator.requireValid(validator.validateId(id));
        return executeCount(SelectStatement.from(getDomainClass()).where(Condition.equal(idAttribute, id))) > 0;
    }

    @Override
    public List<T> findAll() {
        return findAll(Sort.unsorted());
    }

    @Override
    public List<T> findAll(Sort sort) {
        SelectStatement<T> statement = withOrdering(SelectStatement.from(getDomainClass()), sort);
        return statement.toQuery(entityManager).getResultList();
    }

    @Override
    public List<T> findAllById(Iterable<? extends ID> ids) {
        return findAllById(ids, Sort.unsorted());
    }

    @Override
    public List<T> findAllById(Iterable<? extends ID> ids, Sort sort) {
        validator.requireValid(validator.validateIds(ids));
        List<ID> idList = toList(ids);
        if (idList.isEmpty()) {
            return new ArrayList<>();
        }
        SelectStatement<T> statement = SelectStatement.from(getDomainClass()).where(Condition.in(idAttribute, idList));
        return withOrdering(statement, sort).toQuery(entityManager).getResultList();
    }

    @Override
    public Optional<T> findById(ID id) {
        validator.requireValid(validator.validateId(id));
        return Optional.ofNullable(entityManager.find(getDomainClass(), id));
    }

    @Override
    public <S extends T> S save(S entity) {
        validator.requireValid(validator.validateEntity(entity));
        S saved = unitOfWork.execute(() -> {
            S managed = persistOrMerge(entity);
            refresh(List.of(managed));
            return managed;
        });
        logger.debug("Saved entity of type: {} with ID: {}",
                entityInformation.getEntityName(), entityInformation.getId(saved));
        return saved;
    }

    @Override
    public <S extends T> List<S> saveAll(Iterable<S> entities) {
        validator.requireValid(validator.validateEntities(entities));
        List<S> saved = unitOfWork.execute(() -> {
            List<S> managed = new ArrayList<>();
            for (S entity : entities) {
                managed.add(persistOrMerge(entity));
            }
            refresh(managed);
            return managed;
        });
        logger.debug("Saved {} entities of type: {}", saved.size(), entityInformation.getEntityName());
        return saved;
    }

    /**
     * Executes {@code count(pk)} over the rows the statement matches; ordering and
     * paging of the statement are ignored.
     *
     * @param statement must not be null
     * @return the count result
     */
    protected long executeCount(SelectStatement<T> statement) {
        Long count = statement.toCountQuery(entityManager, idAttribute).getSingleResult();
        return count == null ? 0L : count;
    }

    /**
     * Returns the statement with ORDER BY items appended for each order of {@code sort},
     * in declared order.
     *
     * @param statement must not be null
     * @param sort      the sort order to apply, may be null
     * @return the same statement if sort is null or unsorted, else a new ordered statement
     * @throws com.vuong.simpledata.exception.AttributeResolutionException if a sort property is not an attribute of the entity
     */
    protected SelectStatement<T> withOrdering(SelectStatement<T> statement, Sort sort) {
        if (sort == null || sort.isUnsorted()) {
            return statement;
        }
        SelectStatement<T> ordered = statement;
        for (Sort.Order order : sort) {
            SingularAttribute<? super T, ?> attribute = entityInformation.getAttribute(order.getProperty());
            ordered = ordered.orderBy(attribute, order.getDirection(), order.isIgnoreCase());
        }
        return ordered;
    }

    protected int executeDelete(DeleteStatement<T> statement) {
        logger.debug("Executing {}", statement);
        int deleted = unitOfWork.execute(() -> {
            entityManager.flush();
            return statement.execute(entityManager);
        });
        if (properties.isClearAfterBulkDelete()) {
            entityManager.clear();
        }
        return deleted;
    }

    private <S extends T> S persistOrMerge(S entity) {
        if (entityInformation.isNew(entity)) {
            entityManager.persist(entity);
            return entity;
        }
        return entityManager.merge(entity);
    }

    private void refresh(List<? extends T> entities) {
        if (!properties.isRefreshAfterSave()) {
            return;
        }
        entityManager.flush();
        for (T entity : entities) {
            entityManager.refresh(entity);
        }
    }

    private void remove(T entity) {
        if (entityManager.contains(entity)) {
            entityManager.remove(entity);
            return;
        }
        ID id = entityInformation.getId(entity);
        if (id == null) {
            return;
        }
        T existing = entityManager.find(getDomainClass(), id);
        if (existing != null) {
            entityManager.remove(existing);
        }
    }

    private List<ID> toList(Iterable<? extends ID> ids) {
        List<ID> list = new ArrayList<>();
        for (ID id : ids) {
            list.add(id);
        }
        return list;
    }
}
