package com.vuong.simpledata.core.domain.repository.support;

import com.vuong.simpledata.config.SimpleDataProperties;
import com.vuong.simpledata.core.domain.metadata.EntityInformation;
import com.vuong.simpledata.core.domain.repository.PagingRepository;
import com.vuong.simpledata.core.domain.statement.SelectStatement;
import jakarta.persistence.EntityManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.List;

/**
 * {@link PagingRepository} implementation composing a count with an offset/limit fetch.
 * <p>
 * The total and the content come from two separate queries. Under concurrent writers
 * the total may disagree with the content; no snapshot is taken between the two.
 *
 * @param <T>  the entity type
 * @param <ID> the primary-key type
 */
public class SimplePagingRepository<T, ID> extends SimpleCrudRepository<T, ID> implements PagingRepository<T, ID> {

    private static final Logger logger = LoggerFactory.getLogger(SimplePagingRepository.class);

    public SimplePagingRepository(EntityInformation<T, ID> entityInformation, EntityManager entityManager,
                                  SimpleDataProperties properties) {
        super(entityInformation, entityManager, properties);
    }

    public SimplePagingRepository(EntityInformation<T, ID> entityInformation, EntityManager entityManager) {
        super(entityInformation, entityManager);
    }

    public SimplePagingRepository(Class<T> domainClass, EntityManager entityManager, SimpleDataProperties properties) {
        super(domainClass, entityManager, properties);
    }

    public SimplePagingRepository(Class<T> domainClass, EntityManager entityManager) {
        super(domainClass, entityManager);
    }

    @Override
    public Page<T> findPage(Pageable pageable) {
        return findPage(pageable, null);
    }

    @Override
    public Page<T> findPage(Pageable pageable, Sort sort) {
        validator.requireValid(validator.validatePageable(pageable));
        Sort effectiveSort = sort != null ? sort : pageable.getSort();
        return executePage(SelectStatement.from(getDomainClass()), pageable, effectiveSort);
    }

    /**
     * Counts the rows of the unpaged statement, then fetches the requested slice.
     *
     * @param statement the base statement, must not be null
     * @param pageable  the requested page, must not be null
     * @param sort      the sort order to apply, may be null
     * @return a page of entities
     */
    protected Page<T> executePage(SelectStatement<T> statement, Pageable pageable, Sort sort) {
        long total = executeCount(statement);
        SelectStatement<T> paged = withOrdering(withPaging(statement, pageable), sort);
        List<T> content = paged.toQuery(entityManager).getResultList();
        logger.debug("Fetched page {} of type: {} with {} of {} entities",
                pageable.isPaged() ? pageable.getPageNumber() : "unpaged",
                entityInformation.getEntityName(), content.size(), total);
        return new PageImpl<>(content, pageable, total);
    }

    /**
     * Applies the pageable's offset and page size; an unpaged pageable leaves the statement unchanged.
     */
    protected SelectStatement<T> withPaging(SelectStatement<T> statement, Pageable pageable) {
        if (pageable.isUnpaged()) {
            return statement;
        }
        return statement.offset(pageable.getOffset()).limit(pageable.getPageSize());
    }
}
