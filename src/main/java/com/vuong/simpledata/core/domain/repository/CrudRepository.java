package com.vuong.simpledata.core.domain.repository;

import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Optional;

/**
 * Generic CRUD operations on a repository for one mapped entity type.
 * Mutating operations are applied and committed before they return.
 *
 * @param <T>  the entity type
 * @param <ID> the primary-key type
 */
public interface CrudRepository<T, ID> {

    /**
     * Deletes all entities managed by the repository.
     */
    void clear();

    /**
     * Returns the number of entities available.
     * @return the number of entities
     */
    long count();

    /**
     * Deletes a given entity.
     * @param entity must not be null
     * @throws IllegalArgumentException in case the given entity is null
     */
    void delete(T entity);

    /**
     * Deletes the given entities.
     * @param entities must not be null nor contain null elements
     * @throws IllegalArgumentException in case the given entities or one of its elements is null
     */
    void deleteAll(Iterable<? extends T> entities);

    /**
     * Deletes all entities with the given IDs.
     * Entities that aren't found in the persistence store are silently ignored.
     * @param ids must not be null nor contain null elements
     * @throws IllegalArgumentException in case the given ids or one of its elements is null
     */
    void deleteAllById(Iterable<? extends ID> ids);

    /**
     * Deletes the entity with the given id.
     * If the entity is not found in the persistence store it is silently ignored.
     * @param id must not be null
     * @throws IllegalArgumentException if id is null
     */
    void deleteById(ID id);

    /**
     * Returns whether an entity with the given id exists.
     * @param id must not be null
     * @return true if an entity with the given id exists, false otherwise
     * @throws IllegalArgumentException if id is null
     */
    boolean existsById(ID id);

    /**
     * Returns all entities, in storage order.
     * @return all entities
     */
    List<T> findAll();

    /**
     * Returns all entities sorted by the given options.
     * @param sort the sort order to apply, may be null
     * @return all entities
     */
    List<T> findAll(Sort sort);

    /**
     * Returns all entities with the given IDs.
     * If some or all ids are not found, no entities are returned for these IDs.
     * @param ids must not be null nor contain null elements
     * @return never null; the size can be equal or less than the number of given ids
     * @throws IllegalArgumentException in case the given ids or one of its elements is null
     */
    List<T> findAllById(Iterable<? extends ID> ids);

    /**
     * Returns all entities with the given IDs, sorted by the given options.
     * @param ids must not be null nor contain null elements
     * @param sort the sort order to apply, may be null
     * @return never null; the size can be equal or less than the number of given ids
     * @throws IllegalArgumentException in case the given ids or one of its elements is null
     */
    List<T> findAllById(Iterable<? extends ID> ids, Sort sort);

    /**
     * Retrieves an entity by its id.
     * @param id must not be null
     * @return the entity with the given id or empty if none found
     * @throws IllegalArgumentException if id is null
     */
    Optional<T> findById(ID id);

    /**
     * Saves a given entity.
     * Use the returned instance for further operations as the save operation might have
     * changed the entity instance completely.
     * @param entity must not be null
     * @return the saved entity, never null
     * @throws IllegalArgumentException in case the given entity is null
     */
    <S extends T> S save(S entity);

    /**
     * Saves all given entities.
     * @param entities must not be null nor contain null elements
     * @return the saved entities, in the order and with the size of the given ones
     * @throws IllegalArgumentException in case the given entities or one of its elements is null
     */
    <S extends T> List<S> saveAll(Iterable<S> entities);
}
