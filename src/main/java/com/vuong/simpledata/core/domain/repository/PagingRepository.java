package com.vuong.simpledata.core.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Extension of {@link CrudRepository} to retrieve entities page by page.
 *
 * @param <T>  the entity type
 * @param <ID> the primary-key type
 */
public interface PagingRepository<T, ID> extends CrudRepository<T, ID> {

    /**
     * Returns a {@link Page} of entities meeting the paging restriction of the
     * {@link Pageable}, ordered by the pageable's own sort.
     * @param pageable must not be null
     * @return a page of entities
     * @throws IllegalArgumentException in case the pageable is null
     */
    Page<T> findPage(Pageable pageable);

    /**
     * Returns a {@link Page} of entities meeting the paging restriction of the
     * {@link Pageable}.
     * @param pageable must not be null
     * @param sort the sort order to apply; when null the pageable's sort is used
     * @return a page of entities
     * @throws IllegalArgumentException in case the pageable is null
     */
    Page<T> findPage(Pageable pageable, Sort sort);
}
